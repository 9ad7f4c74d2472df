package com.smartbag.commerce.domain.order;

import com.smartbag.commerce.common.exception.DomainException;
import com.smartbag.commerce.common.exception.ErrorCode;

/**
 * 주문 요청 데이터가 누락되었거나 잘못된 경우 (400, 자동 재시도 대상 아님)
 */
public class InvalidOrderInputException extends DomainException {

    public InvalidOrderInputException(String detail) {
        super(ErrorCode.INVALID_ORDER_INPUT, detail);
    }
}
