package com.smartbag.commerce.infrastructure.kafka;

import com.smartbag.commerce.domain.order.event.OrderPlacedEvent;
import com.smartbag.commerce.domain.order.event.OrderStatusChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * OrderEventProducer - 주문 이벤트 Kafka 릴레이
 *
 * 역할:
 * - order_placed → order.placed 토픽
 * - order_status_changed → order.status-changed 토픽
 *
 * Kafka 메시지 구조:
 * - Key: orderId → 같은 주문의 이벤트는 같은 파티션으로 전송 (순서 보장)
 * - Value: OrderEventMessage (JSON)
 *
 * 실패 처리:
 * - 전송은 비동기이며 실패는 콜백에서 로깅만 한다
 * - 부수 작업 재시도 시 같은 이벤트가 중복 전송될 수 있다 (at-least-once)
 *
 * kafka.enabled=true 일 때만 등록된다.
 */
@Component
@ConditionalOnProperty(name = "kafka.enabled", havingValue = "true")
public class OrderEventProducer {

    private static final Logger log = LoggerFactory.getLogger(OrderEventProducer.class);

    private final KafkaTemplate<String, OrderEventMessage> kafkaTemplate;
    private final String orderPlacedTopic;
    private final String statusChangedTopic;

    public OrderEventProducer(KafkaTemplate<String, OrderEventMessage> orderEventKafkaTemplate,
                              @Value("${kafka.topics.order-placed:order.placed}") String orderPlacedTopic,
                              @Value("${kafka.topics.order-status-changed:order.status-changed}") String statusChangedTopic) {
        this.kafkaTemplate = orderEventKafkaTemplate;
        this.orderPlacedTopic = orderPlacedTopic;
        this.statusChangedTopic = statusChangedTopic;
    }

    @EventListener
    public void onOrderPlaced(OrderPlacedEvent event) {
        send(orderPlacedTopic, OrderEventMessage.from(event));
    }

    @EventListener
    public void onOrderStatusChanged(OrderStatusChangedEvent event) {
        send(statusChangedTopic, OrderEventMessage.from(event));
    }

    private void send(String topic, OrderEventMessage message) {
        String key = message.getOrderId();
        log.info("[OrderEventProducer] Kafka 메시지 발행 시작 - topic={}, key={}, eventType={}",
                topic, key, message.getEventType());

        CompletableFuture<SendResult<String, OrderEventMessage>> future = kafkaTemplate.send(topic, key, message);
        future.whenComplete((result, ex) -> {
            if (ex == null) {
                var metadata = result.getRecordMetadata();
                log.info("[OrderEventProducer] Kafka 메시지 발행 성공 - topic={}, partition={}, offset={}, orderId={}",
                        metadata.topic(), metadata.partition(), metadata.offset(), key);
            } else {
                log.error("[OrderEventProducer] Kafka 메시지 발행 실패 - topic={}, key={}, error={}",
                        topic, key, ex.getMessage(), ex);
            }
        });
    }
}
