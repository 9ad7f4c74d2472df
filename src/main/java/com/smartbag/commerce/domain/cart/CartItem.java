package com.smartbag.commerce.domain.cart;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 장바구니 항목
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CartItem {

    private String id;

    @Field("product_id")
    private String productId;

    private int quantity;

    @Field("added_at")
    private LocalDateTime addedAt;

    @Field("updated_at")
    private LocalDateTime updatedAt;

    static CartItem create(String productId, int quantity) {
        CartItem item = new CartItem();
        LocalDateTime now = LocalDateTime.now();
        item.id = UUID.randomUUID().toString();
        item.productId = productId;
        item.quantity = quantity;
        item.addedAt = now;
        item.updatedAt = now;
        return item;
    }

    void changeQuantity(int quantity) {
        this.quantity = quantity;
        this.updatedAt = LocalDateTime.now();
    }
}
