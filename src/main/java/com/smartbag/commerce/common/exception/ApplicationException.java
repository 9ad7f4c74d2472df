package com.smartbag.commerce.common.exception;

/**
 * ApplicationException - 유스케이스 처리 실패 예외
 *
 * 사용 예:
 * - 동시 수정으로 인한 주문 갱신 충돌 (낙관적 락)
 */
public class ApplicationException extends BizException {

    public ApplicationException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }

    public ApplicationException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode, detailMessage, cause);
    }
}
