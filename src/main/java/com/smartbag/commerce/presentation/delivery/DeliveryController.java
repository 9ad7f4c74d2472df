package com.smartbag.commerce.presentation.delivery;

import com.smartbag.commerce.application.order.OrderQueryService;
import com.smartbag.commerce.application.order.OrderStatusService;
import com.smartbag.commerce.domain.order.Order;
import com.smartbag.commerce.presentation.delivery.request.AssignPartnerRequest;
import com.smartbag.commerce.presentation.order.mapper.OrderMapper;
import com.smartbag.commerce.presentation.order.response.OrderResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * DeliveryController - 배달 파트너용 주문 API
 *
 * 역할:
 * - 주문 수락/배정/배달 시작/도착/완료 상태 전이 요청 처리
 * - 파트너 기준 주문 목록 조회
 *
 * 파트너 식별: X-PARTNER-ID, X-PARTNER-NAME 헤더
 *
 * HTTP 상태 코드:
 * - 200 OK: 상태 전이 성공
 * - 400 Bad Request: 허용되지 않는 상태 전이 (INVALID_ORDER_STATUS)
 * - 403 Forbidden: 배정된 파트너가 아님 (PARTNER_MISMATCH)
 * - 404 Not Found: 주문 없음
 * - 409 Conflict: 이미 수락한 주문, 동시 수정 충돌
 */
@RestController
@RequestMapping("/delivery/orders")
public class DeliveryController {

    private final OrderStatusService orderStatusService;
    private final OrderQueryService orderQueryService;
    private final OrderMapper orderMapper;

    public DeliveryController(OrderStatusService orderStatusService,
                              OrderQueryService orderQueryService,
                              OrderMapper orderMapper) {
        this.orderStatusService = orderStatusService;
        this.orderQueryService = orderQueryService;
        this.orderMapper = orderMapper;
    }

    @PostMapping("/{order_id}/accept")
    public ResponseEntity<OrderResponse> acceptOrder(
            @RequestHeader("X-PARTNER-ID") String partnerId,
            @RequestHeader(value = "X-PARTNER-NAME", required = false) String partnerName,
            @PathVariable("order_id") String orderId) {
        Order order = orderStatusService.acceptOrder(orderId, partnerId, displayName(partnerId, partnerName));
        return ResponseEntity.ok(orderMapper.toOrderResponse(order));
    }

    /**
     * 수락한 파트너 중 한 명을 배정
     * 본문의 partner_id 가 없으면 요청한 파트너 자신을 배정한다.
     */
    @PostMapping("/{order_id}/assign")
    public ResponseEntity<OrderResponse> assignPartner(
            @RequestHeader("X-PARTNER-ID") String partnerId,
            @RequestHeader(value = "X-PARTNER-NAME", required = false) String partnerName,
            @PathVariable("order_id") String orderId,
            @RequestBody(required = false) AssignPartnerRequest request) {
        String target = request != null && request.getPartnerId() != null ? request.getPartnerId() : partnerId;
        Order order = orderStatusService.assignPartner(orderId, target, displayName(partnerId, partnerName));
        return ResponseEntity.ok(orderMapper.toOrderResponse(order));
    }

    @PostMapping("/{order_id}/start")
    public ResponseEntity<OrderResponse> startDelivery(
            @RequestHeader("X-PARTNER-ID") String partnerId,
            @RequestHeader(value = "X-PARTNER-NAME", required = false) String partnerName,
            @PathVariable("order_id") String orderId) {
        Order order = orderStatusService.startDelivery(orderId, partnerId, displayName(partnerId, partnerName));
        return ResponseEntity.ok(orderMapper.toOrderResponse(order));
    }

    @PostMapping("/{order_id}/arrive")
    public ResponseEntity<OrderResponse> markArrived(
            @RequestHeader("X-PARTNER-ID") String partnerId,
            @RequestHeader(value = "X-PARTNER-NAME", required = false) String partnerName,
            @PathVariable("order_id") String orderId) {
        Order order = orderStatusService.markArrived(orderId, partnerId, displayName(partnerId, partnerName));
        return ResponseEntity.ok(orderMapper.toOrderResponse(order));
    }

    @PostMapping("/{order_id}/deliver")
    public ResponseEntity<OrderResponse> markDelivered(
            @RequestHeader("X-PARTNER-ID") String partnerId,
            @RequestHeader(value = "X-PARTNER-NAME", required = false) String partnerName,
            @PathVariable("order_id") String orderId) {
        Order order = orderStatusService.markDelivered(orderId, partnerId, displayName(partnerId, partnerName));
        return ResponseEntity.ok(orderMapper.toOrderResponse(order));
    }

    /**
     * 배정 대기 중인 주문 목록 (PREPARING, ASSIGNING)
     */
    @GetMapping("/available")
    public ResponseEntity<List<OrderResponse>> getAvailableOrders(
            @RequestParam(value = "limit", defaultValue = "" + OrderQueryService.DEFAULT_PARTNER_LIMIT) int limit) {
        return ResponseEntity.ok(orderMapper.toOrderResponses(orderQueryService.getAvailableOrders(limit)));
    }

    @GetMapping("/assigned")
    public ResponseEntity<List<OrderResponse>> getAssignedOrders(
            @RequestHeader("X-PARTNER-ID") String partnerId,
            @RequestParam(value = "limit", defaultValue = "" + OrderQueryService.DEFAULT_PARTNER_LIMIT) int limit) {
        return ResponseEntity.ok(orderMapper.toOrderResponses(orderQueryService.getAssignedOrders(partnerId, limit)));
    }

    @GetMapping("/delivered")
    public ResponseEntity<List<OrderResponse>> getDeliveredOrders(
            @RequestHeader("X-PARTNER-ID") String partnerId,
            @RequestParam(value = "limit", defaultValue = "" + OrderQueryService.DEFAULT_PARTNER_LIMIT) int limit) {
        return ResponseEntity.ok(orderMapper.toOrderResponses(orderQueryService.getDeliveredOrders(partnerId, limit)));
    }

    private String displayName(String partnerId, String partnerName) {
        return partnerName != null && !partnerName.isBlank() ? partnerName : partnerId;
    }
}
