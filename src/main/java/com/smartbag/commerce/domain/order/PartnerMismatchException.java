package com.smartbag.commerce.domain.order;

import com.smartbag.commerce.common.exception.DomainException;
import com.smartbag.commerce.common.exception.ErrorCode;

/**
 * 배정(또는 수락)되지 않은 파트너가 배달 상태를 변경하려 할 때 발생 (403)
 */
public class PartnerMismatchException extends DomainException {

    public PartnerMismatchException(String orderId, String partnerId) {
        super(ErrorCode.PARTNER_MISMATCH, "orderId=" + orderId + ", partnerId=" + partnerId);
    }
}
