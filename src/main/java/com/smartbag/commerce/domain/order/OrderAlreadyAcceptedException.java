package com.smartbag.commerce.domain.order;

import com.smartbag.commerce.common.exception.DomainException;
import com.smartbag.commerce.common.exception.ErrorCode;

/**
 * 같은 파트너가 이미 수락한 주문을 다시 수락할 때 발생 (409)
 */
public class OrderAlreadyAcceptedException extends DomainException {

    public OrderAlreadyAcceptedException(String orderId, String partnerId) {
        super(ErrorCode.ORDER_ALREADY_ACCEPTED, "orderId=" + orderId + ", partnerId=" + partnerId);
    }
}
