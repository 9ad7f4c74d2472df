package com.smartbag.commerce.domain.order;

public enum PaymentStatus {
    PENDING,
    COMPLETED,
    REFUNDED
}
