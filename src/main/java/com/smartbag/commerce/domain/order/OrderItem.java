package com.smartbag.commerce.domain.order;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.mongodb.core.mapping.Field;

import java.math.BigDecimal;

/**
 * 주문 라인 (주문 시점 가격 스냅샷)
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class OrderItem {

    @Field("product_id")
    private String productId;

    @Field("product_name")
    private String productName;

    private int quantity;

    private BigDecimal price;

    public BigDecimal getLineTotal() {
        return price.multiply(BigDecimal.valueOf(quantity));
    }
}
