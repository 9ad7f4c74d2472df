package com.smartbag.commerce.application.order;

import com.smartbag.commerce.application.inventory.InventoryCoordinator;
import com.smartbag.commerce.application.sideeffect.SideEffectQueue;
import com.smartbag.commerce.common.exception.ApplicationException;
import com.smartbag.commerce.common.exception.ErrorCode;
import com.smartbag.commerce.domain.inventory.StockLine;
import com.smartbag.commerce.domain.order.Order;
import com.smartbag.commerce.domain.order.OrderNotFoundException;
import com.smartbag.commerce.domain.order.OrderRepository;
import com.smartbag.commerce.domain.sideeffect.SideEffectTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * OrderStatusService - 주문 상태 전이 유스케이스
 *
 * 공통 흐름:
 * 1. 주문 조회 (없으면 OrderNotFoundException)
 * 2. 도메인 전이 메서드 호출 (규칙 위반 시 도메인 예외)
 * 3. 낙관적 락으로 저장 (충돌 시 ORDER_CONFLICT)
 * 4. 주문 캐시 무효화
 * 5. order_status_changed 작업 적재
 *
 * 취소/환불은 저장 후 재고를 복구한다.
 */
@Slf4j
@Service
public class OrderStatusService {

    private final OrderRepository orderRepository;
    private final InventoryCoordinator inventoryCoordinator;
    private final OrderCacheEvictor orderCacheEvictor;
    private final SideEffectQueue sideEffectQueue;

    public OrderStatusService(OrderRepository orderRepository,
                              InventoryCoordinator inventoryCoordinator,
                              OrderCacheEvictor orderCacheEvictor,
                              SideEffectQueue sideEffectQueue) {
        this.orderRepository = orderRepository;
        this.inventoryCoordinator = inventoryCoordinator;
        this.orderCacheEvictor = orderCacheEvictor;
        this.sideEffectQueue = sideEffectQueue;
    }

    /**
     * 배달 파트너 주문 수락 (PREPARING|ASSIGNING → ASSIGNING)
     */
    public Order acceptOrder(String orderId, String partnerId, String partnerName) {
        return apply(orderId, order -> order.accept(partnerId, partnerName));
    }

    /**
     * 수락한 파트너 배정 (ASSIGNING → ASSIGNED)
     */
    public Order assignPartner(String orderId, String partnerId, String assignedBy) {
        return apply(orderId, order -> order.assignPartner(partnerId, assignedBy));
    }

    public Order startDelivery(String orderId, String partnerId, String partnerName) {
        return apply(orderId, order -> order.startDelivery(partnerId, partnerName));
    }

    public Order markArrived(String orderId, String partnerId, String partnerName) {
        return apply(orderId, order -> order.markArrived(partnerId, partnerName));
    }

    /**
     * 배달 완료 (ASSIGNED|OUT_FOR_DELIVERY|ARRIVED → DELIVERED, COD 결제 완료)
     */
    public Order markDelivered(String orderId, String partnerId, String partnerName) {
        return apply(orderId, order -> order.markDelivered(partnerId, partnerName));
    }

    /**
     * 고객 주문 취소 (본인 주문만, 재고 복구)
     */
    public Order cancelOrder(String orderId, String userId, String cancelledBy, String reason) {
        Order order = load(orderId);
        if (!order.isOwnedBy(userId)) {
            throw new OrderNotFoundException(orderId);
        }
        order.cancel(cancelledBy, reason);
        Order saved = save(order);
        restoreStock(saved);
        afterTransition(saved);
        return saved;
    }

    /**
     * 환불 (재고 복구, 결제 상태 REFUNDED)
     */
    public Order refundOrder(String orderId, String refundedBy, String reason) {
        Order order = load(orderId);
        order.refund(refundedBy, reason);
        Order saved = save(order);
        restoreStock(saved);
        afterTransition(saved);
        return saved;
    }

    private Order apply(String orderId, Consumer<Order> transition) {
        Order order = load(orderId);
        transition.accept(order);
        Order saved = save(order);
        afterTransition(saved);
        return saved;
    }

    private Order load(String orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    private Order save(Order order) {
        try {
            return orderRepository.save(order);
        } catch (OptimisticLockingFailureException e) {
            log.warn("[OrderStatusService] 동시 수정 충돌 - orderId={}, status={}",
                    order.getOrderId(), order.getOrderStatus());
            throw new ApplicationException(ErrorCode.ORDER_CONFLICT, "orderId=" + order.getOrderId(), e);
        }
    }

    private void restoreStock(Order order) {
        List<StockLine> lines = order.getItems().stream()
                .map(item -> StockLine.of(item.getProductId(), item.getQuantity()))
                .collect(Collectors.toList());
        int restored = inventoryCoordinator.restore(lines);
        log.info("[OrderStatusService] 재고 복구 - orderId={}, restored={}/{}",
                order.getOrderId(), restored, lines.size());
    }

    private void afterTransition(Order order) {
        orderCacheEvictor.evictOrder(order.getOrderId(), order.getUserId());
        sideEffectQueue.enqueue(SideEffectTask.orderStatusChanged(
                order.getOrderId(), order.getUserId(), order.getOrderStatus().name()));
        log.info("[OrderStatusService] 상태 변경 - orderId={}, status={}",
                order.getOrderId(), order.getOrderStatus());
    }
}
