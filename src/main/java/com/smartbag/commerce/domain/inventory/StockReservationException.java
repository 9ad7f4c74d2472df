package com.smartbag.commerce.domain.inventory;

import java.util.List;

/**
 * 재고 차감 실패 예외들이 공통으로 제공하는 부족 정보
 */
public interface StockReservationException {

    List<StockShortfall> getShortfalls();
}
