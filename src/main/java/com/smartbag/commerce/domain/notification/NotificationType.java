package com.smartbag.commerce.domain.notification;

public enum NotificationType {
    ORDER_PLACED,
    ORDER_STATUS
}
