package com.smartbag.commerce.application.order;

import com.smartbag.commerce.infrastructure.cache.TwoTierCache;
import com.smartbag.commerce.infrastructure.config.RedisKeyType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 주문 관련 캐시 무효화
 *
 * 무효화는 fail-soft 이며 실패해도 예외가 발생하지 않는다.
 * 캐시 항목은 TTL 로 결국 만료된다.
 */
@Slf4j
@Component
public class OrderCacheEvictor {

    private final TwoTierCache twoTierCache;

    public OrderCacheEvictor(TwoTierCache twoTierCache) {
        this.twoTierCache = twoTierCache;
    }

    /**
     * 주문 접수 후: 장바구니, 진행 중 주문, 최근 주문 목록
     */
    public void evictAfterPlacement(String userId) {
        twoTierCache.delete(RedisKeyType.CART.buildKey(userId));
        evictUserOrders(userId);
    }

    /**
     * 주문 상태 변경 후: 주문 상세 + 사용자 주문 캐시
     */
    public void evictOrder(String orderId, String userId) {
        twoTierCache.delete(RedisKeyType.ORDER_DETAIL.buildKey(orderId));
        evictUserOrders(userId);
    }

    private void evictUserOrders(String userId) {
        twoTierCache.delete(RedisKeyType.ACTIVE_ORDER.buildKey(userId));
        long deleted = twoTierCache.deletePattern(RedisKeyType.RECENT_ORDERS.buildPattern(userId));
        log.debug("[OrderCacheEvictor] 사용자 주문 캐시 무효화 - userId={}, recentPages={}", userId, deleted);
    }
}
