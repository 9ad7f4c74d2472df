package com.smartbag.commerce.presentation.order;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartbag.commerce.application.order.OrderPlacementService;
import com.smartbag.commerce.application.order.OrderQueryService;
import com.smartbag.commerce.application.order.OrderStatusService;
import com.smartbag.commerce.application.order.dto.OrderPage;
import com.smartbag.commerce.application.order.dto.PlaceOrderCommand;
import com.smartbag.commerce.domain.inventory.InsufficientStockException;
import com.smartbag.commerce.domain.inventory.StockShortfall;
import com.smartbag.commerce.domain.order.DeliveryAddress;
import com.smartbag.commerce.domain.order.InvalidOrderStatusException;
import com.smartbag.commerce.domain.order.Order;
import com.smartbag.commerce.domain.order.OrderItem;
import com.smartbag.commerce.domain.order.OrderNotFoundException;
import com.smartbag.commerce.domain.order.OrderStatus;
import com.smartbag.commerce.domain.order.PaymentMethod;
import com.smartbag.commerce.presentation.common.GlobalExceptionHandler;
import com.smartbag.commerce.presentation.order.mapper.OrderMapper;
import com.smartbag.commerce.presentation.order.request.CreateOrderRequest;
import com.smartbag.commerce.presentation.order.request.DeliveryAddressRequest;
import com.smartbag.commerce.presentation.order.request.OrderItemRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * OrderControllerTest - Presentation Layer Unit Test
 *
 * 테스트 대상: OrderController + GlobalExceptionHandler
 * - POST /orders - 주문 생성 (201, 재고 부족 409 + details)
 * - GET /orders/active - 진행 중 주문 (200 / 204)
 * - GET /orders - 최근 주문 페이지
 * - POST /orders/{order_id}/cancel - 주문 취소
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("OrderController 단위 테스트")
class OrderControllerTest {

    private static final String USER_ID = "u1";

    @Mock
    private OrderPlacementService orderPlacementService;

    @Mock
    private OrderStatusService orderStatusService;

    @Mock
    private OrderQueryService orderQueryService;

    private MockMvc mockMvc;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setup() {
        OrderController controller = new OrderController(
                orderPlacementService, orderStatusService, orderQueryService, new OrderMapper());
        this.mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    // ========== 주문 생성 (POST /orders) ==========

    @Test
    @DisplayName("주문 생성 - 201, preparing 상태와 이력 1건")
    void createOrder_Success() throws Exception {
        // Given
        when(orderPlacementService.placeOrder(any(PlaceOrderCommand.class))).thenReturn(order("ORD1"));

        // When & Then
        mockMvc.perform(post("/orders")
                        .header("X-USER-ID", USER_ID)
                        .header("X-USER-NAME", "홍길동")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(createRequest("cod"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.order_id").value("ORD1"))
                .andExpect(jsonPath("$.order_status").value("preparing"))
                .andExpect(jsonPath("$.status_change_history.length()").value(1));

        ArgumentCaptor<PlaceOrderCommand> captor = ArgumentCaptor.forClass(PlaceOrderCommand.class);
        verify(orderPlacementService).placeOrder(captor.capture());
        assertThat(captor.getValue().getUserId()).isEqualTo(USER_ID);
        assertThat(captor.getValue().getPaymentMethod()).isEqualTo(PaymentMethod.COD);
        assertThat(captor.getValue().getItems()).hasSize(1);
    }

    @Test
    @DisplayName("주문 생성 - 재고 부족 시 409와 상품별 details")
    void createOrder_InsufficientStock() throws Exception {
        // Given
        when(orderPlacementService.placeOrder(any(PlaceOrderCommand.class)))
                .thenThrow(new InsufficientStockException(List.of(
                        StockShortfall.insufficient("P1", "우유", 3, 10))));

        // When & Then
        mockMvc.perform(post("/orders")
                        .header("X-USER-ID", USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(createRequest(null))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_PRODUCT_INSUFFICIENT_STOCK"))
                .andExpect(jsonPath("$.details[0].product_id").value("P1"))
                .andExpect(jsonPath("$.details[0].requested").value(10))
                .andExpect(jsonPath("$.details[0].available").value(3));
    }

    @Test
    @DisplayName("주문 생성 - X-USER-ID 헤더 누락 시 400")
    void createOrder_MissingHeader() throws Exception {
        mockMvc.perform(post("/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(createRequest(null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_REQUEST"));

        verify(orderPlacementService, never()).placeOrder(any());
    }

    @Test
    @DisplayName("주문 생성 - 알 수 없는 결제 수단은 400")
    void createOrder_UnknownPaymentMethod() throws Exception {
        mockMvc.perform(post("/orders")
                        .header("X-USER-ID", USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(createRequest("bitcoin"))))
                .andExpect(status().isBadRequest());

        verify(orderPlacementService, never()).placeOrder(any());
    }

    // ========== 조회 ==========

    @Test
    @DisplayName("진행 중 주문 없음 - 204")
    void getActiveOrder_NoContent() throws Exception {
        when(orderQueryService.getActiveOrder(USER_ID)).thenReturn(Optional.empty());

        mockMvc.perform(get("/orders/active").header("X-USER-ID", USER_ID))
                .andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("주문 상세 - 다른 사용자 주문이면 404")
    void getOrderDetail_NotFound() throws Exception {
        when(orderQueryService.getOrderDetail(USER_ID, "ORD9")).thenThrow(new OrderNotFoundException("ORD9"));

        mockMvc.perform(get("/orders/ORD9").header("X-USER-ID", USER_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_ORDER_NOT_FOUND"));
    }

    @Test
    @DisplayName("최근 주문 - 페이지 정보 포함")
    void getOrderList() throws Exception {
        when(orderQueryService.getRecentOrders(USER_ID, 1, 2))
                .thenReturn(new OrderPage(List.of(order("ORD3"), order("ORD2")), 1, 2, true));

        mockMvc.perform(get("/orders").param("page", "1").param("size", "2").header("X-USER-ID", USER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.orders.length()").value(2))
                .andExpect(jsonPath("$.page").value(1))
                .andExpect(jsonPath("$.has_next").value(true));
    }

    // ========== 취소 ==========

    @Test
    @DisplayName("주문 취소 - 본문 없이도 가능, 취소자는 사용자 ID")
    void cancelOrder_WithoutBody() throws Exception {
        Order cancelled = order("ORD1");
        cancelled.cancel(USER_ID, null);
        when(orderStatusService.cancelOrder(eq("ORD1"), eq(USER_ID), eq(USER_ID), isNull())).thenReturn(cancelled);

        mockMvc.perform(post("/orders/ORD1/cancel").header("X-USER-ID", USER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.order_status").value(OrderStatus.CANCELLED.getValue()));
    }

    @Test
    @DisplayName("종료된 주문 취소 - 400")
    void cancelOrder_Terminal() throws Exception {
        when(orderStatusService.cancelOrder(eq("ORD1"), eq(USER_ID), eq(USER_ID), isNull()))
                .thenThrow(new InvalidOrderStatusException("ORD1", OrderStatus.DELIVERED, OrderStatus.CANCELLED));

        mockMvc.perform(post("/orders/ORD1/cancel").header("X-USER-ID", USER_ID))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_ORDER_INVALID_STATUS"));
    }

    private CreateOrderRequest createRequest(String paymentMethod) {
        return CreateOrderRequest.builder()
                .items(List.of(OrderItemRequest.builder().productId("P1").quantity(2).build()))
                .deliveryAddress(DeliveryAddressRequest.builder()
                        .recipient("홍길동")
                        .street("테헤란로 1")
                        .city("서울")
                        .build())
                .deliveryCharge(new BigDecimal("3000"))
                .paymentMethod(paymentMethod)
                .build();
    }

    private Order order(String orderId) {
        return Order.place(orderId, USER_ID, "홍길동",
                List.of(new OrderItem("P1", "사과", 2, new BigDecimal("1500"))),
                DeliveryAddress.builder().street("테헤란로 1").city("서울").build(),
                new BigDecimal("3000"), null, null, PaymentMethod.COD);
    }
}
