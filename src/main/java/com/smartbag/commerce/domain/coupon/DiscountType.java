package com.smartbag.commerce.domain.coupon;

public enum DiscountType {
    PERCENTAGE,
    FIXED
}
