package com.smartbag.commerce.application.sideeffect.handler;

import com.smartbag.commerce.application.sideeffect.SideEffectHandler;
import com.smartbag.commerce.domain.order.Order;
import com.smartbag.commerce.domain.order.OrderNotFoundException;
import com.smartbag.commerce.domain.order.OrderRepository;
import com.smartbag.commerce.domain.order.event.OrderPlacedEvent;
import com.smartbag.commerce.domain.sideeffect.SideEffectTask;
import com.smartbag.commerce.domain.sideeffect.SideEffectType;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * order_placed 이벤트 발행
 *
 * 구독자(알림, Kafka 릴레이)는 동기 실행되므로 구독자 실패는 이 작업의 실패로 재시도된다.
 */
@Component
@RequiredArgsConstructor
public class OrderPlacedEventHandler implements SideEffectHandler {

    private final OrderRepository orderRepository;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    public SideEffectType getType() {
        return SideEffectType.ORDER_PLACED;
    }

    @Override
    public void handle(SideEffectTask task) {
        Order order = orderRepository.findById(task.getOrderId())
                .orElseThrow(() -> new OrderNotFoundException(task.getOrderId()));
        eventPublisher.publishEvent(OrderPlacedEvent.from(order));
    }
}
