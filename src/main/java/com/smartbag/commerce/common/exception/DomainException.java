package com.smartbag.commerce.common.exception;

/**
 * DomainException - 도메인 규칙 위반 예외
 *
 * 역할:
 * - 비즈니스 도메인의 규칙 위반 시 발생
 * - 유효성 검증, 상태 전이 오류, 재고 부족 등
 * - 클라이언트 오류(4XX)로 응답하며 자동 재시도하지 않음
 */
public class DomainException extends BizException {

    public DomainException(ErrorCode errorCode) {
        super(errorCode);
    }

    public DomainException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
