package com.smartbag.commerce.infrastructure.persistence.notification;

import com.smartbag.commerce.domain.notification.Notification;
import com.smartbag.commerce.domain.notification.NotificationRepository;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

@Repository
public class MongoNotificationRepository implements NotificationRepository {

    private final MongoTemplate mongoTemplate;

    public MongoNotificationRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Notification save(Notification notification) {
        return mongoTemplate.save(notification);
    }

    @Override
    public List<Notification> findByUserId(String userId) {
        return mongoTemplate.find(
                query(where("userId").is(userId)).with(Sort.by(Sort.Direction.DESC, "createdAt")),
                Notification.class);
    }
}
