package com.smartbag.commerce.domain.order;

public enum PaymentMethod {
    COD,
    ONLINE
}
