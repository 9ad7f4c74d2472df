package com.smartbag.commerce.application.sideeffect.handler;

import com.smartbag.commerce.application.sideeffect.SideEffectHandler;
import com.smartbag.commerce.domain.cart.CartRepository;
import com.smartbag.commerce.domain.sideeffect.SideEffectTask;
import com.smartbag.commerce.domain.sideeffect.SideEffectType;
import com.smartbag.commerce.infrastructure.cache.TwoTierCache;
import com.smartbag.commerce.infrastructure.config.RedisKeyType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 주문 완료 후 장바구니 비우기 (문서는 유지)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CartClearHandler implements SideEffectHandler {

    private final CartRepository cartRepository;
    private final TwoTierCache twoTierCache;

    @Override
    public SideEffectType getType() {
        return SideEffectType.CART_CLEAR;
    }

    @Override
    public void handle(SideEffectTask task) {
        String userId = task.get(SideEffectTask.USER_ID);
        boolean cleared = cartRepository.clearItems(userId);
        twoTierCache.delete(RedisKeyType.CART.buildKey(userId));
        log.debug("[CartClearHandler] 장바구니 비우기 - userId={}, cleared={}", userId, cleared);
    }
}
