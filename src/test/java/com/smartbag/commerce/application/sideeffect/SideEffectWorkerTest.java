package com.smartbag.commerce.application.sideeffect;

import com.smartbag.commerce.application.sideeffect.handler.OrderPlacedEventHandler;
import com.smartbag.commerce.domain.order.DeliveryAddress;
import com.smartbag.commerce.domain.order.Order;
import com.smartbag.commerce.domain.order.OrderItem;
import com.smartbag.commerce.domain.order.OrderStatus;
import com.smartbag.commerce.domain.sideeffect.SideEffectTask;
import com.smartbag.commerce.domain.sideeffect.SideEffectType;
import com.smartbag.commerce.infrastructure.persistence.order.InMemoryOrderRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.retry.support.RetryTemplate;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * SideEffectWorker 테스트
 *
 * 실제 RetryTemplate(3회, 10ms) 와 용량 제한 큐로 재시도/DLQ 흐름을 검증한다.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("SideEffectWorker 테스트")
class SideEffectWorkerTest {

    @Mock
    private SideEffectDeadLetterQueue deadLetterQueue;

    private SideEffectWorker worker;

    @AfterEach
    void tearDown() {
        if (worker != null) {
            worker.stop();
        }
    }

    @Test
    @DisplayName("이벤트 구독자가 계속 실패하면 3회 시도 후 DLQ, 주문은 preparing 그대로")
    void failingSubscriber_DeadLettered_OrderUntouched() {
        // Given
        InMemoryOrderRepository orderRepository = new InMemoryOrderRepository();
        Order order = orderRepository.insert(placedOrder("ORD1"));
        AtomicInteger publishAttempts = new AtomicInteger();
        ApplicationEventPublisher failingPublisher = event -> {
            publishAttempts.incrementAndGet();
            throw new IllegalStateException("notification store down");
        };
        SideEffectQueue queue = new SideEffectQueue(10, deadLetterQueue);
        worker = new SideEffectWorker(queue,
                List.of(new OrderPlacedEventHandler(orderRepository, failingPublisher)),
                retryTemplate(), deadLetterQueue, 1);
        worker.start();

        // When
        SideEffectTask task = SideEffectTask.orderPlaced(order.getOrderId(), order.getUserId());
        assertThat(queue.enqueue(task)).isTrue();

        // Then
        verify(deadLetterQueue, timeout(2000)).publish(eq(task), eq(3), contains("notification store down"));
        assertThat(publishAttempts.get()).isEqualTo(3);

        Order stored = orderRepository.findById("ORD1").orElseThrow();
        assertThat(stored.getOrderStatus()).isEqualTo(OrderStatus.PREPARING);
        assertThat(stored.getStatusChangeHistory()).hasSize(1);
    }

    @Test
    @DisplayName("일시 실패 후 성공하면 DLQ 기록 없음")
    void transientFailure_RecoveredByRetry() {
        // Given
        SideEffectHandler handler = mock(SideEffectHandler.class);
        when(handler.getType()).thenReturn(SideEffectType.CART_CLEAR);
        AtomicInteger calls = new AtomicInteger();
        doAnswer(invocation -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("timeout");
            }
            return null;
        }).when(handler).handle(any());
        worker = new SideEffectWorker(new SideEffectQueue(10, deadLetterQueue),
                List.of(handler), retryTemplate(), deadLetterQueue, 1);

        // When
        boolean processed = worker.process(SideEffectTask.cartClear("ORD1", "u1"));

        // Then
        assertThat(processed).isTrue();
        assertThat(calls.get()).isEqualTo(2);
        verify(deadLetterQueue, never()).publish(any(), anyInt(), anyString());
    }

    @Test
    @DisplayName("처리기가 없는 작업은 곧바로 DLQ")
    void missingHandler_DeadLettered() {
        worker = new SideEffectWorker(new SideEffectQueue(10, deadLetterQueue),
                List.of(), retryTemplate(), deadLetterQueue, 1);
        SideEffectTask task = SideEffectTask.couponUsage("ORD1", "WELCOME10");

        assertThat(worker.process(task)).isFalse();
        verify(deadLetterQueue).publish(eq(task), eq(0), contains("no handler"));
    }

    @Test
    @DisplayName("큐가 가득 차면 작업을 버리지 않고 DLQ로 보냄")
    void fullQueue_DeadLettered() {
        SideEffectQueue queue = new SideEffectQueue(1, deadLetterQueue);
        SideEffectTask first = SideEffectTask.cartClear("ORD1", "u1");
        SideEffectTask second = SideEffectTask.cacheInvalidation("ORD1", "u1");

        int accepted = queue.enqueueAll(List.of(first, second));

        assertThat(accepted).isEqualTo(1);
        assertThat(queue.size()).isEqualTo(1);
        verify(deadLetterQueue).publish(eq(second), eq(0), anyString());
    }

    @Test
    @DisplayName("여러 작업을 워커 스레드가 모두 처리")
    void worker_DrainsQueue() {
        // Given
        SideEffectHandler handler = mock(SideEffectHandler.class);
        when(handler.getType()).thenReturn(SideEffectType.CACHE_INVALIDATION);
        SideEffectQueue queue = new SideEffectQueue(100, deadLetterQueue);
        worker = new SideEffectWorker(queue, List.of(handler), retryTemplate(), deadLetterQueue, 2);
        worker.start();

        // When
        for (int i = 0; i < 20; i++) {
            queue.enqueue(SideEffectTask.cacheInvalidation("ORD" + i, "u1"));
        }

        // Then
        verify(handler, timeout(2000).times(20)).handle(any());
        await().atMost(Duration.ofSeconds(2)).until(() -> queue.size() == 0);
        verify(deadLetterQueue, never()).publish(any(), anyInt(), anyString());
    }

    @Test
    @DisplayName("재시도 소진 시 예외 대신 false 반환")
    void exhaustedRetries_ReturnsFalse() {
        SideEffectHandler handler = mock(SideEffectHandler.class);
        when(handler.getType()).thenReturn(SideEffectType.COUPON_USAGE);
        doThrow(new IllegalStateException("boom")).when(handler).handle(any());
        worker = new SideEffectWorker(new SideEffectQueue(10, deadLetterQueue),
                List.of(handler), retryTemplate(), deadLetterQueue, 1);

        assertThat(worker.process(SideEffectTask.couponUsage("ORD1", "WELCOME10"))).isFalse();
        verify(handler, times(3)).handle(any());
        verify(deadLetterQueue).publish(any(), eq(3), contains("boom"));
    }

    private RetryTemplate retryTemplate() {
        return RetryTemplate.builder()
                .maxAttempts(3)
                .fixedBackoff(10)
                .build();
    }

    private Order placedOrder(String orderId) {
        return Order.place(orderId, "u1", "홍길동",
                List.of(new OrderItem("P1", "사과", 1, new BigDecimal("1500"))),
                DeliveryAddress.builder().street("테헤란로 1").city("서울").build(),
                BigDecimal.ZERO, null, null, null);
    }
}
