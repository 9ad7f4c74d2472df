package com.smartbag.commerce.domain.coupon;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

/**
 * Coupon 도메인 엔티티 (프로모션 코드)
 *
 * 핵심 비즈니스 규칙:
 * - usageLimit 은 남은 사용 가능 횟수이며 주문 완료 후 조건부(> 0)로만 1 감소
 * - 정률 할인은 maxDiscount 로 상한, 어떤 경우에도 소계를 넘지 않음
 */
@Document("coupons")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Coupon {

    @Id
    private String id;

    @Indexed(unique = true)
    private String code;

    @Field("discount_type")
    private DiscountType discountType;

    @Field("discount_value")
    private BigDecimal discountValue;

    @Field("min_order_amount")
    private BigDecimal minOrderAmount;

    @Field("max_discount")
    private BigDecimal maxDiscount;

    @Field("usage_limit")
    private int usageLimit;

    @Field("is_active")
    private boolean active;

    @Field("valid_from")
    private LocalDateTime validFrom;

    @Field("valid_until")
    private LocalDateTime validUntil;

    /**
     * 주어진 소계와 시각에 사용할 수 있는지 여부
     */
    public boolean isApplicable(BigDecimal subtotal, LocalDateTime now) {
        if (!active || usageLimit <= 0) {
            return false;
        }
        if (validFrom != null && now.isBefore(validFrom)) {
            return false;
        }
        if (validUntil != null && now.isAfter(validUntil)) {
            return false;
        }
        return minOrderAmount == null || subtotal.compareTo(minOrderAmount) >= 0;
    }

    public BigDecimal calculateDiscount(BigDecimal subtotal) {
        BigDecimal discount;
        if (discountType == DiscountType.PERCENTAGE) {
            discount = subtotal.multiply(discountValue)
                    .divide(BigDecimal.valueOf(100), 2, RoundingMode.HALF_UP);
            if (maxDiscount != null && discount.compareTo(maxDiscount) > 0) {
                discount = maxDiscount;
            }
        } else {
            discount = discountValue;
        }
        return discount.min(subtotal).max(BigDecimal.ZERO);
    }
}
