package com.smartbag.commerce.domain.notification;

import java.util.List;

public interface NotificationRepository {

    Notification save(Notification notification);

    List<Notification> findByUserId(String userId);
}
