package com.smartbag.commerce.infrastructure.persistence.coupon;

import com.smartbag.commerce.domain.coupon.Coupon;
import com.smartbag.commerce.domain.coupon.CouponRepository;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

@Repository
public class MongoCouponRepository implements CouponRepository {

    private final MongoTemplate mongoTemplate;

    public MongoCouponRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Optional<Coupon> findByCode(String code) {
        return Optional.ofNullable(mongoTemplate.findOne(query(where("code").is(code)), Coupon.class));
    }

    @Override
    public Coupon save(Coupon coupon) {
        return mongoTemplate.save(coupon);
    }

    /**
     * db.coupons.updateOne({code, usage_limit: {$gt: 0}}, {$inc: {usage_limit: -1}})
     */
    @Override
    public boolean decrementUsageIfPositive(String code) {
        return mongoTemplate.updateFirst(
                query(where("code").is(code).and("usageLimit").gt(0)),
                new Update().inc("usageLimit", -1),
                Coupon.class
        ).getMatchedCount() > 0;
    }
}
