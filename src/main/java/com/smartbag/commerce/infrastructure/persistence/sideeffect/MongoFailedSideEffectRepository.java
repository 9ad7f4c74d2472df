package com.smartbag.commerce.infrastructure.persistence.sideeffect;

import com.smartbag.commerce.domain.sideeffect.FailedSideEffect;
import com.smartbag.commerce.domain.sideeffect.FailedSideEffectRepository;
import com.smartbag.commerce.domain.sideeffect.FailedSideEffectStatus;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

/**
 * MongoDB 기반 부수 작업 DLQ 저장소
 */
@Repository
public class MongoFailedSideEffectRepository implements FailedSideEffectRepository {

    private static final Sort OLDEST_FIRST = Sort.by(Sort.Direction.ASC, "failedAt");

    private final MongoTemplate mongoTemplate;

    public MongoFailedSideEffectRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public FailedSideEffect save(FailedSideEffect failedSideEffect) {
        return mongoTemplate.save(failedSideEffect);
    }

    @Override
    public List<FailedSideEffect> findByOrderId(String orderId) {
        return mongoTemplate.find(query(where("orderId").is(orderId)).with(OLDEST_FIRST), FailedSideEffect.class);
    }

    @Override
    public List<FailedSideEffect> findAllPending() {
        return mongoTemplate.find(
                query(where("status").is(FailedSideEffectStatus.PENDING)).with(OLDEST_FIRST),
                FailedSideEffect.class);
    }
}
