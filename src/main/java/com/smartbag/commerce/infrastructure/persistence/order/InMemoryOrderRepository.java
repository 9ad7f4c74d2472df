package com.smartbag.commerce.infrastructure.persistence.order;

import com.smartbag.commerce.domain.order.Order;
import com.smartbag.commerce.domain.order.OrderRepository;
import com.smartbag.commerce.domain.order.OrderStatus;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * InMemory Order Repository 구현
 * ConcurrentHashMap 기반의 인메모리 저장소 (버전 검사는 하지 않음)
 */
@Repository
public class InMemoryOrderRepository implements OrderRepository {

    private static final Comparator<Order> NEWEST_FIRST = Comparator.comparing(Order::getCreatedAt).reversed();

    private final ConcurrentMap<String, Order> orders = new ConcurrentHashMap<>();

    @Override
    public Order insert(Order order) {
        if (orders.putIfAbsent(order.getOrderId(), order) != null) {
            throw new DuplicateKeyException("이미 존재하는 주문 ID: " + order.getOrderId());
        }
        return order;
    }

    @Override
    public Order save(Order order) {
        orders.put(order.getOrderId(), order);
        return order;
    }

    @Override
    public Optional<Order> findById(String orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    @Override
    public boolean existsById(String orderId) {
        return orders.containsKey(orderId);
    }

    @Override
    public Optional<Order> findLatestByUserIdAndStatusIn(String userId, Collection<OrderStatus> statuses) {
        return find(order -> order.isOwnedBy(userId) && statuses.contains(order.getOrderStatus()), 0, 1)
                .stream()
                .findFirst();
    }

    @Override
    public List<Order> findByUserId(String userId, int offset, int limit) {
        return find(order -> order.isOwnedBy(userId), offset, limit);
    }

    @Override
    public List<Order> findUnassignedByStatusIn(Collection<OrderStatus> statuses, int limit) {
        return find(order -> order.getDeliveryPartner() == null && statuses.contains(order.getOrderStatus()), 0, limit);
    }

    @Override
    public List<Order> findByDeliveryPartnerAndStatusIn(String partnerId, Collection<OrderStatus> statuses, int limit) {
        return find(order -> partnerId.equals(order.getDeliveryPartner()) && statuses.contains(order.getOrderStatus()),
                0, limit);
    }

    private List<Order> find(Predicate<Order> condition, int offset, int limit) {
        return orders.values().stream()
                .filter(condition)
                .sorted(NEWEST_FIRST)
                .skip(offset)
                .limit(limit)
                .collect(Collectors.toList());
    }
}
