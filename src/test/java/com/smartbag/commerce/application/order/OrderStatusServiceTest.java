package com.smartbag.commerce.application.order;

import com.smartbag.commerce.application.inventory.InventoryCoordinator;
import com.smartbag.commerce.application.sideeffect.SideEffectQueue;
import com.smartbag.commerce.common.exception.ApplicationException;
import com.smartbag.commerce.common.exception.ErrorCode;
import com.smartbag.commerce.domain.inventory.StockLine;
import com.smartbag.commerce.domain.order.DeliveryAddress;
import com.smartbag.commerce.domain.order.InvalidOrderStatusException;
import com.smartbag.commerce.domain.order.Order;
import com.smartbag.commerce.domain.order.OrderItem;
import com.smartbag.commerce.domain.order.OrderNotFoundException;
import com.smartbag.commerce.domain.order.OrderRepository;
import com.smartbag.commerce.domain.order.OrderStatus;
import com.smartbag.commerce.domain.order.PartnerMismatchException;
import com.smartbag.commerce.domain.sideeffect.SideEffectTask;
import com.smartbag.commerce.domain.sideeffect.SideEffectType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * OrderStatusService 단위 테스트
 *
 * 각 전이는 저장 → 캐시 무효화 → 상태 변경 작업 적재 순서로 처리된다.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("OrderStatusService 단위 테스트")
class OrderStatusServiceTest {

    private static final String ORDER_ID = "ORD20250101ABCDEF";

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private InventoryCoordinator inventoryCoordinator;

    @Mock
    private OrderCacheEvictor orderCacheEvictor;

    @Mock
    private SideEffectQueue sideEffectQueue;

    private OrderStatusService orderStatusService;

    private Order order;

    @BeforeEach
    void setUp() {
        orderStatusService = new OrderStatusService(orderRepository, inventoryCoordinator, orderCacheEvictor, sideEffectQueue);
        order = Order.place(ORDER_ID, "u1", "홍길동",
                List.of(new OrderItem("P1", "사과", 2, new BigDecimal("1500"))),
                DeliveryAddress.builder().street("테헤란로 1").city("서울").build(),
                new BigDecimal("3000"), null, null, null);
    }

    @Test
    @DisplayName("주문 수락 - ASSIGNING, 캐시 무효화, 상태 변경 작업 적재")
    void acceptOrder_Success() {
        // Given
        givenStoredOrder();

        // When
        Order accepted = orderStatusService.acceptOrder(ORDER_ID, "partner-1", "김배달");

        // Then
        assertThat(accepted.getOrderStatus()).isEqualTo(OrderStatus.ASSIGNING);
        assertThat(accepted.getAcceptedPartners()).containsExactly("partner-1");
        verify(orderCacheEvictor).evictOrder(ORDER_ID, "u1");

        ArgumentCaptor<SideEffectTask> captor = ArgumentCaptor.forClass(SideEffectTask.class);
        verify(sideEffectQueue).enqueue(captor.capture());
        assertThat(captor.getValue().getType()).isEqualTo(SideEffectType.ORDER_STATUS_CHANGED);
        assertThat(captor.getValue().get(SideEffectTask.STATUS)).isEqualTo("ASSIGNING");
    }

    @Test
    @DisplayName("배정 → 배달 시작 → 도착 → 완료")
    void deliveryTransitions() {
        givenStoredOrder();

        orderStatusService.acceptOrder(ORDER_ID, "partner-1", "김배달");
        orderStatusService.assignPartner(ORDER_ID, "partner-1", "dispatcher");
        orderStatusService.startDelivery(ORDER_ID, "partner-1", "김배달");
        orderStatusService.markArrived(ORDER_ID, "partner-1", "김배달");
        Order delivered = orderStatusService.markDelivered(ORDER_ID, "partner-1", "김배달");

        assertThat(delivered.getOrderStatus()).isEqualTo(OrderStatus.DELIVERED);
        assertThat(delivered.getStatusChangeHistory()).hasSize(6);
        verify(inventoryCoordinator, never()).restore(anyList());
    }

    @Test
    @DisplayName("배정되지 않은 파트너의 배달 시작 → PartnerMismatchException, 저장 없음")
    void startDelivery_WrongPartner() {
        givenStoredOrder();
        orderStatusService.acceptOrder(ORDER_ID, "partner-1", "김배달");
        orderStatusService.assignPartner(ORDER_ID, "partner-1", "dispatcher");

        assertThatThrownBy(() -> orderStatusService.startDelivery(ORDER_ID, "partner-2", "이배달"))
                .isInstanceOf(PartnerMismatchException.class);
        assertThat(order.getOrderStatus()).isEqualTo(OrderStatus.ASSIGNED);
    }

    @Test
    @DisplayName("없는 주문 → OrderNotFoundException")
    void acceptOrder_NotFound() {
        when(orderRepository.findById("ORD404")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> orderStatusService.acceptOrder("ORD404", "partner-1", "김배달"))
                .isInstanceOf(OrderNotFoundException.class);
    }

    @Test
    @DisplayName("고객 취소 - CANCELLED, 재고 복구")
    void cancelOrder_RestoresStock() {
        givenStoredOrder();

        Order cancelled = orderStatusService.cancelOrder(ORDER_ID, "u1", "홍길동", "변심");

        assertThat(cancelled.getOrderStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(cancelled.getStatusChangeHistory().get(1).getMessage()).isEqualTo("변심");
        verify(inventoryCoordinator).restore(List.of(StockLine.of("P1", 2)));
    }

    @Test
    @DisplayName("다른 사용자의 주문 취소 → OrderNotFoundException, 재고 유지")
    void cancelOrder_OtherUser() {
        when(orderRepository.findById(ORDER_ID)).thenReturn(Optional.of(order));

        assertThatThrownBy(() -> orderStatusService.cancelOrder(ORDER_ID, "u2", "타인", null))
                .isInstanceOf(OrderNotFoundException.class);
        verify(inventoryCoordinator, never()).restore(anyList());
    }

    @Test
    @DisplayName("종료 상태 주문 취소 → InvalidOrderStatusException")
    void cancelOrder_Terminal() {
        givenStoredOrder();
        orderStatusService.refundOrder(ORDER_ID, "admin", "품절");

        assertThatThrownBy(() -> orderStatusService.cancelOrder(ORDER_ID, "u1", "홍길동", null))
                .isInstanceOf(InvalidOrderStatusException.class);
    }

    @Test
    @DisplayName("동시 수정 충돌 → ORDER_CONFLICT, 후속 처리 없음")
    void save_OptimisticLockFailure() {
        when(orderRepository.findById(ORDER_ID)).thenReturn(Optional.of(order));
        when(orderRepository.save(any(Order.class))).thenThrow(new OptimisticLockingFailureException("version"));

        assertThatThrownBy(() -> orderStatusService.acceptOrder(ORDER_ID, "partner-1", "김배달"))
                .isInstanceOf(ApplicationException.class)
                .satisfies(e -> assertThat(((ApplicationException) e).getErrorCode()).isEqualTo(ErrorCode.ORDER_CONFLICT));
        verify(orderCacheEvictor, never()).evictOrder(any(), any());
        verify(sideEffectQueue, never()).enqueue(any());
    }

    private void givenStoredOrder() {
        when(orderRepository.findById(ORDER_ID)).thenReturn(Optional.of(order));
        when(orderRepository.save(any(Order.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }
}
