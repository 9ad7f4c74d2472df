package com.smartbag.commerce.presentation.order;

import com.smartbag.commerce.application.order.OrderPlacementService;
import com.smartbag.commerce.application.order.OrderQueryService;
import com.smartbag.commerce.application.order.OrderStatusService;
import com.smartbag.commerce.domain.order.Order;
import com.smartbag.commerce.presentation.order.mapper.OrderMapper;
import com.smartbag.commerce.presentation.order.request.CancelOrderRequest;
import com.smartbag.commerce.presentation.order.request.CreateOrderRequest;
import com.smartbag.commerce.presentation.order.response.OrderListResponse;
import com.smartbag.commerce.presentation.order.response.OrderResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * OrderController - 고객 주문 API 엔드포인트
 *
 * 사용자 식별은 X-USER-ID 헤더로 한다 (인증은 범위 밖).
 */
@RestController
@RequestMapping("/orders")
public class OrderController {

    private final OrderPlacementService orderPlacementService;
    private final OrderStatusService orderStatusService;
    private final OrderQueryService orderQueryService;
    private final OrderMapper orderMapper;

    public OrderController(OrderPlacementService orderPlacementService,
                           OrderStatusService orderStatusService,
                           OrderQueryService orderQueryService,
                           OrderMapper orderMapper) {
        this.orderPlacementService = orderPlacementService;
        this.orderStatusService = orderStatusService;
        this.orderQueryService = orderQueryService;
        this.orderMapper = orderMapper;
    }

    /**
     * 주문 생성 (POST /orders)
     *
     * @return 201 Created: 생성된 주문
     */
    @PostMapping
    public ResponseEntity<OrderResponse> createOrder(
            @RequestHeader("X-USER-ID") String userId,
            @RequestHeader(value = "X-USER-NAME", required = false) String userName,
            @RequestBody CreateOrderRequest request) {
        var command = orderMapper.toPlaceOrderCommand(userId, userName, request);
        Order order = orderPlacementService.placeOrder(command);
        return ResponseEntity.status(HttpStatus.CREATED).body(orderMapper.toOrderResponse(order));
    }

    /**
     * 진행 중인 주문 조회 (GET /orders/active)
     *
     * @return 200 OK, 진행 중인 주문이 없으면 204 No Content
     */
    @GetMapping("/active")
    public ResponseEntity<OrderResponse> getActiveOrder(@RequestHeader("X-USER-ID") String userId) {
        return orderQueryService.getActiveOrder(userId)
                .map(order -> ResponseEntity.ok(orderMapper.toOrderResponse(order)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/{order_id}")
    public ResponseEntity<OrderResponse> getOrderDetail(
            @RequestHeader("X-USER-ID") String userId,
            @PathVariable("order_id") String orderId) {
        Order order = orderQueryService.getOrderDetail(userId, orderId);
        return ResponseEntity.ok(orderMapper.toOrderResponse(order));
    }

    @GetMapping
    public ResponseEntity<OrderListResponse> getOrderList(
            @RequestHeader("X-USER-ID") String userId,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "10") int size) {
        var orderPage = orderQueryService.getRecentOrders(userId, page, size);
        return ResponseEntity.ok(orderMapper.toOrderListResponse(orderPage));
    }

    /**
     * 주문 취소 (POST /orders/{order_id}/cancel)
     *
     * 종료 상태가 아닌 주문만 취소할 수 있으며 재고는 복구된다.
     */
    @PostMapping("/{order_id}/cancel")
    public ResponseEntity<OrderResponse> cancelOrder(
            @RequestHeader("X-USER-ID") String userId,
            @RequestHeader(value = "X-USER-NAME", required = false) String userName,
            @PathVariable("order_id") String orderId,
            @RequestBody(required = false) CancelOrderRequest request) {
        String reason = request != null ? request.getReason() : null;
        String cancelledBy = userName != null && !userName.isBlank() ? userName : userId;
        Order order = orderStatusService.cancelOrder(orderId, userId, cancelledBy, reason);
        return ResponseEntity.ok(orderMapper.toOrderResponse(order));
    }
}
