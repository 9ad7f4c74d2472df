package com.smartbag.commerce.infrastructure.config;

import java.time.Duration;
import java.util.regex.Matcher;

/**
 * Redis 키 타입 관리 Enum
 *
 * 목표:
 * 1. 모든 캐시 키를 한 곳에서 관리
 * 2. 키 패턴 + TTL 메타데이터를 함께 보관
 *
 * 사용법:
 * - KEY: RedisKeyType.CATEGORIES.getKey()
 * - 파라미터: RedisKeyType.RECENT_ORDERS.buildKey(userId, 0)
 * - 패턴 삭제: RedisKeyType.RECENT_ORDERS.buildPattern(userId) → "recent_orders:{userId}:*"
 * - TTL: RedisKeyType.CART.getTtl()
 */
public enum RedisKeyType {

    // ===== 캐시 (Cache) =====

    PRODUCT_DETAIL(
        "product:{productId}",
        RedisKeyCategory.CACHE,
        Duration.ofHours(1),
        "상품 상세정보"
    ),

    PRODUCT_LIST(
        "products:list:{page}",
        RedisKeyCategory.CACHE,
        Duration.ofMinutes(10),
        "상품 목록"
    ),

    CATEGORIES(
        "categories:all",
        RedisKeyCategory.CACHE,
        Duration.ofHours(2),
        "카테고리 목록"
    ),

    BRANDS(
        "brands:all",
        RedisKeyCategory.CACHE,
        Duration.ofHours(2),
        "브랜드 목록"
    ),

    CART(
        "cart:{userId}",
        RedisKeyCategory.CACHE,
        Duration.ofMinutes(30),
        "장바구니"
    ),

    RECENT_ORDERS(
        "recent_orders:{userId}:page{page}",
        RedisKeyCategory.CACHE,
        Duration.ofMinutes(15),
        "최근 주문 목록"
    ),

    ORDER_DETAIL(
        "order_detail:{orderId}",
        RedisKeyCategory.CACHE,
        Duration.ofMinutes(30),
        "주문 상세"
    ),

    ACTIVE_ORDER(
        "active_order:{userId}",
        RedisKeyCategory.CACHE,
        Duration.ofSeconds(60),
        "진행 중인 주문 스냅샷"
    ),

    // ===== 재고 (Inventory) =====

    INVENTORY_STOCK(
        "inventory:stock:{productId}",
        RedisKeyCategory.INVENTORY,
        Duration.ofSeconds(30),
        "표시용 재고 수량"
    ),

    // ===== 재고 보류 (Reservation) =====

    RESERVATION(
        "reservation:{orderId}:{productId}",
        RedisKeyCategory.RESERVATION,
        Duration.ofMinutes(30),
        "주문별 재고 보류 기록"
    );

    private final String pattern;
    private final RedisKeyCategory category;
    private final Duration ttl;
    private final String name;

    RedisKeyType(String pattern, RedisKeyCategory category, Duration ttl, String name) {
        this.pattern = pattern;
        this.category = category;
        this.ttl = ttl;
        this.name = name;
    }

    /**
     * 실제 키 생성 (플레이스홀더를 순서대로 치환)
     *
     * 예: RECENT_ORDERS.buildKey("u1", 0) → "recent_orders:u1:page0"
     */
    public String buildKey(Object... values) {
        String key = this.pattern;
        for (Object value : values) {
            key = key.replaceFirst("\\{[^}]*\\}", Matcher.quoteReplacement(String.valueOf(value)));
        }
        if (key.contains("{")) {
            throw new IllegalArgumentException(String.format("%s 키 파라미터가 부족합니다: %s", name, key));
        }
        return key;
    }

    /**
     * 앞쪽 파라미터만 치환하고 나머지는 와일드카드로 바꾼 SCAN 패턴
     *
     * 예: RESERVATION.buildPattern("ORD1") → "reservation:ORD1:*"
     */
    public String buildPattern(Object... leadingValues) {
        String key = this.pattern;
        for (Object value : leadingValues) {
            key = key.replaceFirst("\\{[^}]*\\}", Matcher.quoteReplacement(String.valueOf(value)));
        }
        int placeholder = key.indexOf('{');
        if (placeholder < 0) {
            return key;
        }
        int segmentStart = key.lastIndexOf(':', placeholder) + 1;
        return key.substring(0, segmentStart) + "*";
    }

    /**
     * 정적 키 조회
     *
     * @throws IllegalStateException 파라미터가 필요한 키인 경우
     */
    public String getKey() {
        if (pattern.contains("{")) {
            throw new IllegalStateException(String.format("%s requires parameters: %s", name, pattern));
        }
        return pattern;
    }

    public String getPattern() {
        return pattern;
    }

    public RedisKeyCategory getCategory() {
        return category;
    }

    public Duration getTtl() {
        return ttl;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return String.format("[%s] %s (category=%s, ttl=%ss, pattern=%s)",
            this.name(), this.name, this.category.getDisplayName(), this.ttl.getSeconds(), this.pattern);
    }
}
