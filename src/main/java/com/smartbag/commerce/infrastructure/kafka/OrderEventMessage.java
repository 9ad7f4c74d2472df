package com.smartbag.commerce.infrastructure.kafka;

import com.smartbag.commerce.domain.order.OrderStatus;
import com.smartbag.commerce.domain.order.event.OrderPlacedEvent;
import com.smartbag.commerce.domain.order.event.OrderStatusChangedEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Kafka 로 릴레이되는 주문 이벤트 메시지 (JSON)
 */
@Getter
@Builder
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class OrderEventMessage {

    public static final String ORDER_PLACED = "order_placed";
    public static final String ORDER_STATUS_CHANGED = "order_status_changed";

    private String eventType;
    private String orderId;
    private String userId;
    private String status;
    private BigDecimal totalAmount;
    private Integer itemCount;
    private LocalDateTime occurredAt;

    public static OrderEventMessage from(OrderPlacedEvent event) {
        return OrderEventMessage.builder()
                .eventType(ORDER_PLACED)
                .orderId(event.getOrderId())
                .userId(event.getUserId())
                .status(OrderStatus.PREPARING.getValue())
                .totalAmount(event.getTotalAmount())
                .itemCount(event.getItemCount())
                .occurredAt(event.getOccurredAt())
                .build();
    }

    public static OrderEventMessage from(OrderStatusChangedEvent event) {
        return OrderEventMessage.builder()
                .eventType(ORDER_STATUS_CHANGED)
                .orderId(event.getOrderId())
                .userId(event.getUserId())
                .status(event.getNewStatus().getValue())
                .occurredAt(event.getOccurredAt())
                .build();
    }
}
