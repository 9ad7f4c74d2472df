package com.smartbag.commerce.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 역할:
 * - 모든 비즈니스 예외의 코드와 메시지 정의
 * - HTTP 상태 코드 매핑
 * - 일관된 에러 응답 제공
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 예: DOMAIN_PRODUCT_INSUFFICIENT_STOCK, SYSTEM_STORE_UNAVAILABLE
 */
public enum ErrorCode {

    // ========== Domain Layer Errors (4XX) ==========

    // Product / Inventory Domain
    PRODUCT_NOT_FOUND("DOMAIN_PRODUCT_NOT_FOUND", "상품을 찾을 수 없습니다", 404),
    PRODUCT_UNAVAILABLE("DOMAIN_PRODUCT_UNAVAILABLE", "판매가 중지된 상품이 포함되어 있습니다", 409),
    INSUFFICIENT_STOCK("DOMAIN_PRODUCT_INSUFFICIENT_STOCK", "재고가 부족합니다", 409),

    // Order Domain
    INVALID_ORDER_INPUT("DOMAIN_ORDER_INVALID_INPUT", "유효하지 않은 주문 요청입니다", 400),
    ORDER_NOT_FOUND("DOMAIN_ORDER_NOT_FOUND", "주문을 찾을 수 없습니다", 404),
    INVALID_ORDER_STATUS("DOMAIN_ORDER_INVALID_STATUS", "유효하지 않은 주문 상태입니다", 400),
    ORDER_ALREADY_ACCEPTED("DOMAIN_ORDER_ALREADY_ACCEPTED", "이미 수락한 주문입니다", 409),
    PARTNER_MISMATCH("DOMAIN_ORDER_PARTNER_MISMATCH", "배정된 배달 파트너가 아닙니다", 403),

    // Cart Domain
    CART_ITEM_NOT_FOUND("DOMAIN_CART_ITEM_NOT_FOUND", "장바구니 항목을 찾을 수 없습니다", 404),
    CART_INVALID_QUANTITY("DOMAIN_CART_INVALID_QUANTITY", "유효하지 않은 수량입니다", 400),

    // ========== Application Layer Errors (5XX) ==========

    ORDER_CONFLICT("APP_ORDER_CONFLICT", "다른 요청에 의해 주문이 변경되었습니다. 다시 시도해주세요", 409),

    // ========== System Errors (5XX) ==========

    STORE_UNAVAILABLE("SYSTEM_STORE_UNAVAILABLE", "저장소에 일시적으로 접근할 수 없습니다", 503),
    INTERNAL_SERVER_ERROR("SYSTEM_INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다", 500);

    private final String code;
    private final String message;
    private final int statusCode;

    ErrorCode(String code, String message, int statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
