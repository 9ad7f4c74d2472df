package com.smartbag.commerce.infrastructure.config;

/**
 * Redis 키 카테고리
 *
 * 역할:
 * - Redis 키를 목적별로 분류
 * - 도메인별 관리 및 모니터링
 */
public enum RedisKeyCategory {
    CACHE("캐시", "조회 성능 향상용, DB 재조회로 항상 복구 가능"),
    INVENTORY("재고", "표시용 재고/보류 수량, 차감 판단에는 사용하지 않음"),
    RESERVATION("재고 보류", "확정 전 주문의 보류 기록, TTL로 자동 만료");

    private final String displayName;
    private final String description;

    RedisKeyCategory(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }
}
