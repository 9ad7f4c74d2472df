package com.smartbag.commerce.domain.cart;

import com.smartbag.commerce.common.exception.DomainException;
import com.smartbag.commerce.common.exception.ErrorCode;

/**
 * 장바구니 수량이 허용 범위를 벗어날 때 발생하는 예외 (400)
 */
public class InvalidQuantityException extends DomainException {

    public InvalidQuantityException(int quantity, int maxQuantity) {
        super(ErrorCode.CART_INVALID_QUANTITY,
                String.format("수량은 %d 이상 %d 이하여야 합니다 (입력값: %d)",
                        CartConstants.MIN_CART_QUANTITY, maxQuantity, quantity));
    }

    public InvalidQuantityException(String detail) {
        super(ErrorCode.CART_INVALID_QUANTITY, detail);
    }
}
