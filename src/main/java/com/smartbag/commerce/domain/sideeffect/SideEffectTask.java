package com.smartbag.commerce.domain.sideeffect;

import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * SideEffectTask - 아웃바운드 큐에 적재되는 부수 작업 메시지
 *
 * payload 키:
 * - userId: 장바구니/캐시 대상 사용자
 * - promoCode: 쿠폰 코드
 * - status: 변경된 주문 상태
 */
@Getter
@ToString
public class SideEffectTask {

    public static final String USER_ID = "userId";
    public static final String PROMO_CODE = "promoCode";
    public static final String STATUS = "status";

    private final String taskId;
    private final SideEffectType type;
    private final String orderId;
    private final Map<String, String> payload;
    private final LocalDateTime createdAt;

    private SideEffectTask(SideEffectType type, String orderId, Map<String, String> payload) {
        this.taskId = UUID.randomUUID().toString();
        this.type = type;
        this.orderId = orderId;
        this.payload = Collections.unmodifiableMap(new HashMap<>(payload));
        this.createdAt = LocalDateTime.now();
    }

    public static SideEffectTask couponUsage(String orderId, String promoCode) {
        return new SideEffectTask(SideEffectType.COUPON_USAGE, orderId, Map.of(PROMO_CODE, promoCode));
    }

    public static SideEffectTask cartClear(String orderId, String userId) {
        return new SideEffectTask(SideEffectType.CART_CLEAR, orderId, Map.of(USER_ID, userId));
    }

    public static SideEffectTask cacheInvalidation(String orderId, String userId) {
        return new SideEffectTask(SideEffectType.CACHE_INVALIDATION, orderId, Map.of(USER_ID, userId));
    }

    public static SideEffectTask orderPlaced(String orderId, String userId) {
        return new SideEffectTask(SideEffectType.ORDER_PLACED, orderId, Map.of(USER_ID, userId));
    }

    public static SideEffectTask orderStatusChanged(String orderId, String userId, String status) {
        return new SideEffectTask(SideEffectType.ORDER_STATUS_CHANGED, orderId, Map.of(USER_ID, userId, STATUS, status));
    }

    public String get(String key) {
        return payload.get(key);
    }
}
