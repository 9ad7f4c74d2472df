package com.smartbag.commerce.domain.inventory;

import com.smartbag.commerce.common.exception.ErrorCode;
import com.smartbag.commerce.common.exception.SystemException;

import java.util.Collections;
import java.util.List;

/**
 * 문서 저장소 연산 자체를 실행하지 못한 경우 (503)
 *
 * 이 예외가 던져지는 시점에는 이미 차감된 재고의 보상이 끝나 있으므로 주문 전체를 재시도해도 안전하다.
 */
public class TransientStoreException extends SystemException implements StockReservationException {

    private final List<StockShortfall> shortfalls;

    public TransientStoreException(List<StockShortfall> shortfalls) {
        super(ErrorCode.STORE_UNAVAILABLE, "재고 차감 중 저장소 오류: " + shortfalls.size() + "건");
        this.shortfalls = List.copyOf(shortfalls);
    }

    public TransientStoreException(String detailMessage, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, detailMessage, cause);
        this.shortfalls = Collections.emptyList();
    }

    @Override
    public List<StockShortfall> getShortfalls() {
        return shortfalls;
    }
}
