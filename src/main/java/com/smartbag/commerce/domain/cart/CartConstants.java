package com.smartbag.commerce.domain.cart;

/**
 * CartConstants - 장바구니 도메인 상수
 *
 * 상품별 최대 수량은 smartbag.cart.max-quantity-per-product 로 조정하며 여기의 값은 기본값이다.
 */
public final class CartConstants {

    /** 장바구니 항목 최소 수량 */
    public static final int MIN_CART_QUANTITY = 1;

    /** 장바구니 항목 최대 수량 기본값 */
    public static final int DEFAULT_MAX_QUANTITY_PER_PRODUCT = 100;

    private CartConstants() {
        throw new AssertionError("CartConstants는 인스턴스화할 수 없습니다");
    }
}
