package com.smartbag.commerce.domain.order;

import com.smartbag.commerce.common.exception.DomainException;
import com.smartbag.commerce.common.exception.ErrorCode;

/**
 * 주문을 찾을 수 없을 때 발생 (404)
 * 다른 사용자의 주문을 조회하는 경우에도 존재를 노출하지 않기 위해 이 예외를 사용한다.
 */
public class OrderNotFoundException extends DomainException {

    public OrderNotFoundException(String orderId) {
        super(ErrorCode.ORDER_NOT_FOUND, "orderId=" + orderId);
    }
}
