package com.smartbag.commerce.common.exception;

/**
 * SystemException - 시스템/인프라 계층 오류 예외
 *
 * 역할:
 * - 문서 저장소 연결 실패 등 인프라 오류
 * - 항상 서버 오류(5XX)로 응답
 *
 * 특징:
 * - 클라이언트(또는 @Retryable)가 재시도할 수 있음
 * - 모니터링 필요
 */
public class SystemException extends BizException {

    public SystemException(ErrorCode errorCode) {
        super(errorCode);
    }

    public SystemException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }

    public SystemException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode, detailMessage, cause);
    }
}
