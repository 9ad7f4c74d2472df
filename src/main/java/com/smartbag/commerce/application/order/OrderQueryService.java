package com.smartbag.commerce.application.order;

import com.smartbag.commerce.application.order.dto.OrderPage;
import com.smartbag.commerce.domain.order.Order;
import com.smartbag.commerce.domain.order.OrderNotFoundException;
import com.smartbag.commerce.domain.order.OrderRepository;
import com.smartbag.commerce.domain.order.OrderStatus;
import com.smartbag.commerce.infrastructure.cache.TwoTierCache;
import com.smartbag.commerce.infrastructure.config.RedisKeyType;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * OrderQueryService - 주문 조회 (캐시 우선)
 *
 * 캐시 전략:
 * - 주문 상세: L2 (30분)
 * - 진행 중 주문: L1 + L2 (60초)
 * - 최근 주문 첫 페이지(기본 크기): L2 (15분)
 * - 배달 파트너 목록: 캐시 없음
 */
@Service
public class OrderQueryService {

    public static final int DEFAULT_PAGE_SIZE = 10;
    public static final int DEFAULT_PARTNER_LIMIT = 50;

    private static final Set<OrderStatus> AVAILABLE_FOR_PARTNER = EnumSet.of(OrderStatus.PREPARING, OrderStatus.ASSIGNING);
    private static final Set<OrderStatus> IN_DELIVERY = EnumSet.of(
            OrderStatus.ASSIGNED, OrderStatus.OUT_FOR_DELIVERY, OrderStatus.ARRIVED);

    private final OrderRepository orderRepository;
    private final TwoTierCache twoTierCache;

    public OrderQueryService(OrderRepository orderRepository, TwoTierCache twoTierCache) {
        this.orderRepository = orderRepository;
        this.twoTierCache = twoTierCache;
    }

    /**
     * 주문 상세 (본인 주문이 아니면 존재하지 않는 것으로 응답)
     */
    public Order getOrderDetail(String userId, String orderId) {
        String key = RedisKeyType.ORDER_DETAIL.buildKey(orderId);
        long generation = twoTierCache.invalidationGeneration();
        Order order = twoTierCache.get(key, Order.class, false)
                .orElseGet(() -> {
                    Order loaded = orderRepository.findById(orderId)
                            .orElseThrow(() -> new OrderNotFoundException(orderId));
                    twoTierCache.populate(key, loaded, RedisKeyType.ORDER_DETAIL.getTtl(), false, generation);
                    return loaded;
                });
        if (!order.isOwnedBy(userId)) {
            throw new OrderNotFoundException(orderId);
        }
        return order;
    }

    /**
     * 가장 최근의 진행 중 주문
     */
    public Optional<Order> getActiveOrder(String userId) {
        String key = RedisKeyType.ACTIVE_ORDER.buildKey(userId);
        long generation = twoTierCache.invalidationGeneration();
        Optional<Order> cached = twoTierCache.get(key, Order.class, true);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<Order> active = orderRepository.findLatestByUserIdAndStatusIn(userId, OrderStatus.ACTIVE);
        active.ifPresent(order -> twoTierCache.populate(key, order, RedisKeyType.ACTIVE_ORDER.getTtl(), true, generation));
        return active;
    }

    /**
     * 최근 주문 목록 (최신순)
     */
    public OrderPage getRecentOrders(String userId, int page, int size) {
        if (page < 0 || size < 1) {
            throw new IllegalArgumentException("page는 0 이상, size는 1 이상이어야 합니다");
        }
        boolean cacheable = page == 0 && size == DEFAULT_PAGE_SIZE;
        String key = RedisKeyType.RECENT_ORDERS.buildKey(userId, page);
        long generation = twoTierCache.invalidationGeneration();
        if (cacheable) {
            Optional<OrderPage> cached = twoTierCache.get(key, OrderPage.class, false);
            if (cached.isPresent()) {
                return cached.get();
            }
        }

        List<Order> fetched = orderRepository.findByUserId(userId, page * size, size + 1);
        boolean hasNext = fetched.size() > size;
        OrderPage result = new OrderPage(hasNext ? fetched.subList(0, size) : fetched, page, size, hasNext);
        if (cacheable) {
            twoTierCache.populate(key, result, RedisKeyType.RECENT_ORDERS.getTtl(), false, generation);
        }
        return result;
    }

    /**
     * 배달 파트너가 수락할 수 있는 주문 (PREPARING|ASSIGNING, 미배정)
     */
    public List<Order> getAvailableOrders(int limit) {
        return orderRepository.findUnassignedByStatusIn(AVAILABLE_FOR_PARTNER, limit);
    }

    /**
     * 파트너에게 배정되어 배달 중인 주문
     */
    public List<Order> getAssignedOrders(String partnerId, int limit) {
        return orderRepository.findByDeliveryPartnerAndStatusIn(partnerId, IN_DELIVERY, limit);
    }

    public List<Order> getDeliveredOrders(String partnerId, int limit) {
        return orderRepository.findByDeliveryPartnerAndStatusIn(partnerId, EnumSet.of(OrderStatus.DELIVERED), limit);
    }
}
