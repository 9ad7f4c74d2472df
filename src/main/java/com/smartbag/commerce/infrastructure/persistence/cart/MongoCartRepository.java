package com.smartbag.commerce.infrastructure.persistence.cart;

import com.smartbag.commerce.domain.cart.Cart;
import com.smartbag.commerce.domain.cart.CartRepository;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

/**
 * MongoDB 기반 Cart Repository 구현 (사용자당 1개, user_id 유니크)
 */
@Repository
public class MongoCartRepository implements CartRepository {

    private final MongoTemplate mongoTemplate;

    public MongoCartRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Optional<Cart> findByUserId(String userId) {
        return Optional.ofNullable(mongoTemplate.findOne(query(where("userId").is(userId)), Cart.class));
    }

    @Override
    public Cart save(Cart cart) {
        return mongoTemplate.save(cart);
    }

    @Override
    public boolean clearItems(String userId) {
        Update update = new Update()
                .set("items", new ArrayList<>())
                .set("updatedAt", LocalDateTime.now());
        return mongoTemplate.updateFirst(query(where("userId").is(userId)), update, Cart.class)
                .getMatchedCount() > 0;
    }
}
