package com.smartbag.commerce.application.order;

import com.smartbag.commerce.application.order.dto.OrderPage;
import com.smartbag.commerce.domain.order.DeliveryAddress;
import com.smartbag.commerce.domain.order.Order;
import com.smartbag.commerce.domain.order.OrderItem;
import com.smartbag.commerce.domain.order.OrderNotFoundException;
import com.smartbag.commerce.domain.order.OrderRepository;
import com.smartbag.commerce.domain.order.OrderStatus;
import com.smartbag.commerce.infrastructure.cache.TwoTierCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("OrderQueryService 단위 테스트")
class OrderQueryServiceTest {

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private TwoTierCache twoTierCache;

    private OrderQueryService orderQueryService;

    @BeforeEach
    void setUp() {
        orderQueryService = new OrderQueryService(orderRepository, twoTierCache);
    }

    @Test
    @DisplayName("주문 상세 - 캐시 미스 시 저장소 조회 후 L2 에만 적재")
    void getOrderDetail_CacheMiss() {
        // Given
        Order order = order("ORD1", "u1");
        when(twoTierCache.get("order_detail:ORD1", Order.class, false)).thenReturn(Optional.empty());
        when(orderRepository.findById("ORD1")).thenReturn(Optional.of(order));

        // When
        Order result = orderQueryService.getOrderDetail("u1", "ORD1");

        // Then
        assertThat(result).isSameAs(order);
        verify(twoTierCache).populate(eq("order_detail:ORD1"), eq(order), any(), eq(false), anyLong());
    }

    @Test
    @DisplayName("주문 상세 - 다른 사용자의 주문은 없는 주문으로 응답")
    void getOrderDetail_OtherUser() {
        when(twoTierCache.get("order_detail:ORD1", Order.class, false)).thenReturn(Optional.of(order("ORD1", "u1")));

        assertThatThrownBy(() -> orderQueryService.getOrderDetail("u2", "ORD1"))
                .isInstanceOf(OrderNotFoundException.class);
    }

    @Test
    @DisplayName("진행 중 주문 - 없으면 캐시에 쓰지 않음")
    void getActiveOrder_None() {
        when(twoTierCache.get("active_order:u1", Order.class, true)).thenReturn(Optional.empty());
        when(orderRepository.findLatestByUserIdAndStatusIn("u1", OrderStatus.ACTIVE)).thenReturn(Optional.empty());

        assertThat(orderQueryService.getActiveOrder("u1")).isEmpty();
        verify(twoTierCache, never()).populate(anyString(), any(), any(), anyBoolean(), anyLong());
    }

    @Test
    @DisplayName("최근 주문 - size+1 건 조회로 다음 페이지 판단")
    void getRecentOrders_HasNext() {
        // Given
        when(orderRepository.findByUserId("u1", 2, 3))
                .thenReturn(List.of(order("ORD5", "u1"), order("ORD4", "u1"), order("ORD3", "u1")));

        // When
        OrderPage page = orderQueryService.getRecentOrders("u1", 1, 2);

        // Then
        assertThat(page.getOrders()).extracting(Order::getOrderId).containsExactly("ORD5", "ORD4");
        assertThat(page.isHasNext()).isTrue();
        verify(twoTierCache, never()).populate(anyString(), any(), any(), anyBoolean(), anyLong());
    }

    @Test
    @DisplayName("최근 주문 첫 페이지(기본 크기)는 캐시 사용")
    void getRecentOrders_FirstPageCached() {
        when(twoTierCache.get("recent_orders:u1:page0", OrderPage.class, false)).thenReturn(Optional.empty());
        when(orderRepository.findByUserId("u1", 0, OrderQueryService.DEFAULT_PAGE_SIZE + 1))
                .thenReturn(List.of(order("ORD1", "u1")));

        OrderPage page = orderQueryService.getRecentOrders("u1", 0, OrderQueryService.DEFAULT_PAGE_SIZE);

        assertThat(page.isHasNext()).isFalse();
        verify(twoTierCache).populate(eq("recent_orders:u1:page0"), any(OrderPage.class), any(), eq(false), anyLong());
    }

    @Test
    @DisplayName("잘못된 페이지 인자 → IllegalArgumentException")
    void getRecentOrders_InvalidArguments() {
        assertThatThrownBy(() -> orderQueryService.getRecentOrders("u1", -1, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> orderQueryService.getRecentOrders("u1", 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private Order order(String orderId, String userId) {
        return Order.place(orderId, userId, null,
                List.of(new OrderItem("P1", "사과", 1, new BigDecimal("1500"))),
                DeliveryAddress.builder().street("테헤란로 1").city("서울").build(),
                BigDecimal.ZERO, null, null, null);
    }
}
