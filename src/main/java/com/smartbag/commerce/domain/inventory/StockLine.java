package com.smartbag.commerce.domain.inventory;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 재고 조정 대상 한 줄 {productId, quantity}
 */
@Getter
@ToString
@EqualsAndHashCode
public class StockLine {

    private final String productId;
    private final int quantity;

    private StockLine(String productId, int quantity) {
        this.productId = productId;
        this.quantity = quantity;
    }

    public static StockLine of(String productId, int quantity) {
        if (productId == null || productId.isBlank()) {
            throw new IllegalArgumentException("productId는 필수입니다");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("수량은 1 이상이어야 합니다: " + quantity);
        }
        return new StockLine(productId, quantity);
    }
}
