package com.smartbag.commerce.domain.cart;

import java.util.Optional;

/**
 * Cart Repository Interface (Domain Layer - Port)
 */
public interface CartRepository {

    Optional<Cart> findByUserId(String userId);

    Cart save(Cart cart);

    /**
     * 장바구니 항목을 비운다 (문서는 유지)
     *
     * @return 비울 장바구니가 있었으면 true
     */
    boolean clearItems(String userId);
}
