package com.smartbag.commerce.domain.product;

import com.smartbag.commerce.common.exception.DomainException;
import com.smartbag.commerce.common.exception.ErrorCode;

/**
 * 주문 대상 상품이 존재하지 않거나 비활성 상태일 때 발생 (404)
 */
public class ProductNotFoundException extends DomainException {

    private final String productId;

    public ProductNotFoundException(String productId) {
        super(ErrorCode.PRODUCT_NOT_FOUND, "productId=" + productId);
        this.productId = productId;
    }

    public String getProductId() {
        return productId;
    }
}
