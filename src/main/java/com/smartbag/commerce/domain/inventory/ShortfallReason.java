package com.smartbag.commerce.domain.inventory;

/**
 * 재고 차감 실패 사유
 *
 * 우선순위(높은 순): TRANSIENT_STORE_ERROR > PRODUCT_UNAVAILABLE > INSUFFICIENT_STOCK
 */
public enum ShortfallReason {
    INSUFFICIENT_STOCK(1),
    PRODUCT_UNAVAILABLE(2),
    TRANSIENT_STORE_ERROR(3);

    private final int severity;

    ShortfallReason(int severity) {
        this.severity = severity;
    }

    public boolean isMoreSevereThan(ShortfallReason other) {
        return other == null || this.severity > other.severity;
    }
}
