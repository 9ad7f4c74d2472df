package com.smartbag.commerce.application.sideeffect.handler;

import com.smartbag.commerce.application.order.OrderCacheEvictor;
import com.smartbag.commerce.application.sideeffect.SideEffectHandler;
import com.smartbag.commerce.domain.sideeffect.SideEffectTask;
import com.smartbag.commerce.domain.sideeffect.SideEffectType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CacheInvalidationHandler implements SideEffectHandler {

    private final OrderCacheEvictor orderCacheEvictor;

    @Override
    public SideEffectType getType() {
        return SideEffectType.CACHE_INVALIDATION;
    }

    @Override
    public void handle(SideEffectTask task) {
        orderCacheEvictor.evictAfterPlacement(task.get(SideEffectTask.USER_ID));
    }
}
