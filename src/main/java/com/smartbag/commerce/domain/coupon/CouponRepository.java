package com.smartbag.commerce.domain.coupon;

import java.util.Optional;

/**
 * Coupon Repository Interface (Domain Layer - Port)
 */
public interface CouponRepository {

    Optional<Coupon> findByCode(String code);

    Coupon save(Coupon coupon);

    /**
     * usage_limit > 0 인 경우에만 1 감소 (단일 원자 연산)
     *
     * @return 감소되었으면 true
     */
    boolean decrementUsageIfPositive(String code);
}
