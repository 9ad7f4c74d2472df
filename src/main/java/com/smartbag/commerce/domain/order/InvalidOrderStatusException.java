package com.smartbag.commerce.domain.order;

import com.smartbag.commerce.common.exception.DomainException;
import com.smartbag.commerce.common.exception.ErrorCode;

/**
 * 현재 주문 상태에서 허용되지 않는 전이를 요청했을 때 발생 (400)
 */
public class InvalidOrderStatusException extends DomainException {

    public InvalidOrderStatusException(String orderId, OrderStatus current, OrderStatus requested) {
        super(ErrorCode.INVALID_ORDER_STATUS,
                "orderId=" + orderId + ", " + current.getValue() + " → " + requested.getValue() + " 전이 불가");
    }

    public InvalidOrderStatusException(String orderId, String detail) {
        super(ErrorCode.INVALID_ORDER_STATUS, "orderId=" + orderId + ", " + detail);
    }
}
