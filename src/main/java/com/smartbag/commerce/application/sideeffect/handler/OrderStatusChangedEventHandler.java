package com.smartbag.commerce.application.sideeffect.handler;

import com.smartbag.commerce.application.sideeffect.SideEffectHandler;
import com.smartbag.commerce.domain.order.OrderStatus;
import com.smartbag.commerce.domain.order.event.OrderStatusChangedEvent;
import com.smartbag.commerce.domain.sideeffect.SideEffectTask;
import com.smartbag.commerce.domain.sideeffect.SideEffectType;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * order_status_changed 이벤트 발행
 */
@Component
@RequiredArgsConstructor
public class OrderStatusChangedEventHandler implements SideEffectHandler {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public SideEffectType getType() {
        return SideEffectType.ORDER_STATUS_CHANGED;
    }

    @Override
    public void handle(SideEffectTask task) {
        OrderStatus status = OrderStatus.fromString(task.get(SideEffectTask.STATUS));
        eventPublisher.publishEvent(new OrderStatusChangedEvent(
                task.getOrderId(), task.get(SideEffectTask.USER_ID), status));
    }
}
