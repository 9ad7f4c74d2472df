package com.smartbag.commerce.infrastructure.persistence.order;

import com.smartbag.commerce.domain.order.Order;
import com.smartbag.commerce.domain.order.OrderRepository;
import com.smartbag.commerce.domain.order.OrderStatus;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

/**
 * MongoDB 기반 Order Repository 구현
 *
 * - insert: 중복 ID 는 DuplicateKeyException
 * - save: @Version 필드로 낙관적 락 (충돌 시 OptimisticLockingFailureException)
 */
@Repository
@Primary
public class MongoOrderRepository implements OrderRepository {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final MongoTemplate mongoTemplate;

    public MongoOrderRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Order insert(Order order) {
        return mongoTemplate.insert(order);
    }

    @Override
    public Order save(Order order) {
        return mongoTemplate.save(order);
    }

    @Override
    public Optional<Order> findById(String orderId) {
        return Optional.ofNullable(mongoTemplate.findById(orderId, Order.class));
    }

    @Override
    public boolean existsById(String orderId) {
        return mongoTemplate.exists(query(where("orderId").is(orderId)), Order.class);
    }

    @Override
    public Optional<Order> findLatestByUserIdAndStatusIn(String userId, Collection<OrderStatus> statuses) {
        Query query = query(where("userId").is(userId).and("orderStatus").in(statuses))
                .with(NEWEST_FIRST)
                .limit(1);
        return Optional.ofNullable(mongoTemplate.findOne(query, Order.class));
    }

    @Override
    public List<Order> findByUserId(String userId, int offset, int limit) {
        Query query = query(where("userId").is(userId))
                .with(NEWEST_FIRST)
                .skip(offset)
                .limit(limit);
        return mongoTemplate.find(query, Order.class);
    }

    @Override
    public List<Order> findUnassignedByStatusIn(Collection<OrderStatus> statuses, int limit) {
        Query query = query(where("orderStatus").in(statuses).and("deliveryPartner").is(null))
                .with(NEWEST_FIRST)
                .limit(limit);
        return mongoTemplate.find(query, Order.class);
    }

    @Override
    public List<Order> findByDeliveryPartnerAndStatusIn(String partnerId, Collection<OrderStatus> statuses, int limit) {
        Query query = query(where("deliveryPartner").is(partnerId).and("orderStatus").in(statuses))
                .with(NEWEST_FIRST)
                .limit(limit);
        return mongoTemplate.find(query, Order.class);
    }
}
