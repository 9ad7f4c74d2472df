package com.smartbag.commerce.domain.inventory;

import com.smartbag.commerce.common.exception.DomainException;
import com.smartbag.commerce.common.exception.ErrorCode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 하나 이상의 주문 라인이 가용 재고를 초과할 때 발생 (409)
 * 라인별 요청 수량과 실제 가용 수량을 함께 전달한다.
 */
public class InsufficientStockException extends DomainException implements StockReservationException {

    private final List<StockShortfall> shortfalls;

    public InsufficientStockException(List<StockShortfall> shortfalls) {
        super(ErrorCode.INSUFFICIENT_STOCK, "Stock unavailable: " + shortfalls.stream()
                .map(StockShortfall::describe)
                .collect(Collectors.joining(", ")));
        this.shortfalls = List.copyOf(shortfalls);
    }

    @Override
    public List<StockShortfall> getShortfalls() {
        return shortfalls;
    }
}
