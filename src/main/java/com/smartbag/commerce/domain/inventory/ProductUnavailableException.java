package com.smartbag.commerce.domain.inventory;

import com.smartbag.commerce.common.exception.DomainException;
import com.smartbag.commerce.common.exception.ErrorCode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 주문 처리 중 상품이 비활성화된 경우 (409)
 */
public class ProductUnavailableException extends DomainException implements StockReservationException {

    private final List<StockShortfall> shortfalls;

    public ProductUnavailableException(List<StockShortfall> shortfalls) {
        super(ErrorCode.PRODUCT_UNAVAILABLE, shortfalls.stream()
                .map(StockShortfall::describe)
                .collect(Collectors.joining(", ")));
        this.shortfalls = List.copyOf(shortfalls);
    }

    @Override
    public List<StockShortfall> getShortfalls() {
        return shortfalls;
    }
}
