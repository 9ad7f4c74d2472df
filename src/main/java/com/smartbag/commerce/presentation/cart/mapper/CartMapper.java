package com.smartbag.commerce.presentation.cart.mapper;

import com.smartbag.commerce.domain.cart.Cart;
import com.smartbag.commerce.domain.cart.CartItem;
import com.smartbag.commerce.presentation.cart.response.CartItemResponse;
import com.smartbag.commerce.presentation.cart.response.CartResponse;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * CartMapper - 장바구니 도메인 → 응답 DTO 변환
 */
@Component
public class CartMapper {

    public CartResponse toCartResponse(Cart cart) {
        return CartResponse.builder()
                .userId(cart.getUserId())
                .items(cart.getItems().stream()
                        .map(this::toCartItemResponse)
                        .collect(Collectors.toList()))
                .totalQuantity(cart.getItems().stream().mapToInt(CartItem::getQuantity).sum())
                .updatedAt(cart.getUpdatedAt())
                .build();
    }

    public CartItemResponse toCartItemResponse(CartItem item) {
        return CartItemResponse.builder()
                .itemId(item.getId())
                .productId(item.getProductId())
                .quantity(item.getQuantity())
                .addedAt(item.getAddedAt())
                .build();
    }
}
