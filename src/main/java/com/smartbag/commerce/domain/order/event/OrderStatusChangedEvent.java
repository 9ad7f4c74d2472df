package com.smartbag.commerce.domain.order.event;

import com.smartbag.commerce.domain.order.OrderStatus;
import lombok.Getter;
import lombok.ToString;
import org.springframework.context.ApplicationEvent;

import java.time.LocalDateTime;

/**
 * 주문 상태 변경 이벤트 (order_status_changed)
 */
@Getter
@ToString
public class OrderStatusChangedEvent extends ApplicationEvent {

    private final String orderId;
    private final String userId;
    private final OrderStatus newStatus;
    private final LocalDateTime occurredAt;

    public OrderStatusChangedEvent(String orderId, String userId, OrderStatus newStatus) {
        super(orderId);
        this.orderId = orderId;
        this.userId = userId;
        this.newStatus = newStatus;
        this.occurredAt = LocalDateTime.now();
    }
}
