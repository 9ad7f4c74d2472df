package com.smartbag.commerce.infrastructure.kafka;

import com.smartbag.commerce.domain.order.OrderStatus;
import com.smartbag.commerce.domain.order.event.OrderPlacedEvent;
import com.smartbag.commerce.domain.order.event.OrderStatusChangedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("OrderEventProducer 단위 테스트")
class OrderEventProducerTest {

    @Mock
    private KafkaTemplate<String, OrderEventMessage> kafkaTemplate;

    private OrderEventProducer producer;

    @BeforeEach
    void setUp() {
        producer = new OrderEventProducer(kafkaTemplate, "order.placed", "order.status-changed");
    }

    @Test
    @DisplayName("order_placed 이벤트는 orderId 키로 order.placed 토픽에 발행")
    void onOrderPlaced() {
        // Given
        when(kafkaTemplate.send(anyString(), anyString(), any(OrderEventMessage.class)))
                .thenReturn(new CompletableFuture<SendResult<String, OrderEventMessage>>());

        // When
        producer.onOrderPlaced(new OrderPlacedEvent("ORD1", "u1", new BigDecimal("9000"), 2));

        // Then
        ArgumentCaptor<OrderEventMessage> captor = ArgumentCaptor.forClass(OrderEventMessage.class);
        verify(kafkaTemplate).send(eq("order.placed"), eq("ORD1"), captor.capture());
        OrderEventMessage message = captor.getValue();
        assertThat(message.getEventType()).isEqualTo(OrderEventMessage.ORDER_PLACED);
        assertThat(message.getStatus()).isEqualTo("preparing");
        assertThat(message.getTotalAmount()).isEqualByComparingTo("9000");
        assertThat(message.getItemCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("order_status_changed 이벤트는 order.status-changed 토픽에 발행")
    void onOrderStatusChanged() {
        when(kafkaTemplate.send(anyString(), anyString(), any(OrderEventMessage.class)))
                .thenReturn(new CompletableFuture<SendResult<String, OrderEventMessage>>());

        producer.onOrderStatusChanged(new OrderStatusChangedEvent("ORD1", "u1", OrderStatus.CANCELLED));

        ArgumentCaptor<OrderEventMessage> captor = ArgumentCaptor.forClass(OrderEventMessage.class);
        verify(kafkaTemplate).send(eq("order.status-changed"), eq("ORD1"), captor.capture());
        assertThat(captor.getValue().getEventType()).isEqualTo(OrderEventMessage.ORDER_STATUS_CHANGED);
        assertThat(captor.getValue().getStatus()).isEqualTo("cancelled");
    }

    @Test
    @DisplayName("비동기 전송 실패는 호출자에게 전파되지 않음")
    void sendFailure_LoggedOnly() {
        CompletableFuture<SendResult<String, OrderEventMessage>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("broker unavailable"));
        when(kafkaTemplate.send(anyString(), anyString(), any(OrderEventMessage.class))).thenReturn(failed);

        assertThatCode(() -> producer.onOrderPlaced(new OrderPlacedEvent("ORD1", "u1", BigDecimal.TEN, 1)))
                .doesNotThrowAnyException();
    }
}
