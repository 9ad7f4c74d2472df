package com.smartbag.commerce.domain.order.event;

import com.smartbag.commerce.domain.order.Order;
import lombok.Getter;
import lombok.ToString;
import org.springframework.context.ApplicationEvent;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 주문 접수 이벤트 (order_placed)
 *
 * 알림/이메일/결제 연동 모듈이 구독한다. 주문 처리 코어는 구독자의 성공 여부에 의존하지 않는다.
 */
@Getter
@ToString
public class OrderPlacedEvent extends ApplicationEvent {

    private final String orderId;
    private final String userId;
    private final BigDecimal totalAmount;
    private final int itemCount;
    private final LocalDateTime occurredAt;

    public OrderPlacedEvent(String orderId, String userId, BigDecimal totalAmount, int itemCount) {
        super(orderId);
        this.orderId = orderId;
        this.userId = userId;
        this.totalAmount = totalAmount;
        this.itemCount = itemCount;
        this.occurredAt = LocalDateTime.now();
    }

    public static OrderPlacedEvent from(Order order) {
        return new OrderPlacedEvent(order.getOrderId(), order.getUserId(), order.getTotalAmount(), order.getItems().size());
    }
}
