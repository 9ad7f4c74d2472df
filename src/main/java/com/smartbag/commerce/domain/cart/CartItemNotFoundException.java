package com.smartbag.commerce.domain.cart;

import com.smartbag.commerce.common.exception.DomainException;
import com.smartbag.commerce.common.exception.ErrorCode;

/**
 * 장바구니 항목을 찾을 수 없을 때 발생 (404)
 */
public class CartItemNotFoundException extends DomainException {

    public CartItemNotFoundException(String itemId) {
        super(ErrorCode.CART_ITEM_NOT_FOUND, "itemId=" + itemId);
    }
}
