package com.smartbag.commerce.domain.cart;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Cart 도메인 엔티티
 *
 * 핵심 비즈니스 규칙:
 * - 사용자당 장바구니는 1개 (user_id unique)
 * - 같은 상품은 한 항목으로 합쳐지며 수량은 1 ~ maxQuantity
 * - 주문 완료 후에는 삭제하지 않고 항목만 비운다
 */
@Document("carts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Cart {

    @Id
    private String id;

    @Indexed(unique = true)
    @Field("user_id")
    private String userId;

    private List<CartItem> items = new ArrayList<>();

    @Field("created_at")
    private LocalDateTime createdAt;

    @Field("updated_at")
    private LocalDateTime updatedAt;

    public static Cart empty(String userId) {
        Cart cart = new Cart();
        LocalDateTime now = LocalDateTime.now();
        cart.userId = userId;
        cart.createdAt = now;
        cart.updatedAt = now;
        return cart;
    }

    /**
     * 상품 추가 (이미 있으면 수량 합산)
     *
     * @return 추가되거나 갱신된 항목
     */
    public CartItem addItem(String productId, int quantity, int maxQuantity) {
        validateQuantity(quantity, maxQuantity);
        Optional<CartItem> existing = findItemByProductId(productId);
        if (existing.isPresent()) {
            CartItem item = existing.get();
            int merged = item.getQuantity() + quantity;
            validateQuantity(merged, maxQuantity);
            item.changeQuantity(merged);
            touch();
            return item;
        }
        CartItem item = CartItem.create(productId, quantity);
        items.add(item);
        touch();
        return item;
    }

    public CartItem updateItemQuantity(String itemId, int quantity, int maxQuantity) {
        validateQuantity(quantity, maxQuantity);
        CartItem item = findItem(itemId).orElseThrow(() -> new CartItemNotFoundException(itemId));
        item.changeQuantity(quantity);
        touch();
        return item;
    }

    public void removeItem(String itemId) {
        boolean removed = items.removeIf(item -> item.getId().equals(itemId));
        if (!removed) {
            throw new CartItemNotFoundException(itemId);
        }
        touch();
    }

    public void clear() {
        items.clear();
        touch();
    }

    public Optional<CartItem> findItem(String itemId) {
        return items.stream().filter(item -> item.getId().equals(itemId)).findFirst();
    }

    public Optional<CartItem> findItemByProductId(String productId) {
        return items.stream().filter(item -> item.getProductId().equals(productId)).findFirst();
    }

    public List<CartItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    private void validateQuantity(int quantity, int maxQuantity) {
        if (quantity < CartConstants.MIN_CART_QUANTITY || quantity > maxQuantity) {
            throw new InvalidQuantityException(quantity, maxQuantity);
        }
    }

    private void touch() {
        this.updatedAt = LocalDateTime.now();
    }
}
