package com.smartbag.commerce.domain.notification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.LocalDateTime;

/**
 * 사용자 알림 기록
 */
@Document("notifications")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notification {

    @Id
    private String id;

    @Indexed
    @Field("user_id")
    private String userId;

    @Field("order_id")
    private String orderId;

    private NotificationType type;

    private String title;

    private String message;

    private boolean read;

    @Field("created_at")
    private LocalDateTime createdAt;
}
