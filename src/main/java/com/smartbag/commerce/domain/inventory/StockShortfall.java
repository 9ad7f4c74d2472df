package com.smartbag.commerce.domain.inventory;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 상품 한 건의 재고 차감 실패 정보
 *
 * available 은 조건부 차감 실패 직후 다시 읽은 값이다.
 * 실패 감지와 원자적으로 묶여 있지 않으므로 고경합 상황에서는 이미 달라져 있을 수 있다.
 */
@Getter
@ToString
@EqualsAndHashCode
public class StockShortfall {

    private final String productId;
    private final String productName;
    private final int available;
    private final int requested;
    private final ShortfallReason reason;

    public StockShortfall(String productId, String productName, int available, int requested, ShortfallReason reason) {
        this.productId = productId;
        this.productName = productName;
        this.available = Math.max(0, available);
        this.requested = requested;
        this.reason = reason;
    }

    public static StockShortfall insufficient(String productId, String productName, int available, int requested) {
        return new StockShortfall(productId, productName, available, requested, ShortfallReason.INSUFFICIENT_STOCK);
    }

    public static StockShortfall unavailable(String productId, String productName, int requested) {
        return new StockShortfall(productId, productName, 0, requested, ShortfallReason.PRODUCT_UNAVAILABLE);
    }

    public static StockShortfall transientError(String productId, int requested) {
        return new StockShortfall(productId, null, 0, requested, ShortfallReason.TRANSIENT_STORE_ERROR);
    }

    /**
     * "상품명: only X available (requested Y)" 형식의 사용자 메시지
     */
    public String describe() {
        String label = productName != null ? productName : productId;
        switch (reason) {
            case PRODUCT_UNAVAILABLE:
                return label + ": 판매 중지된 상품입니다";
            case TRANSIENT_STORE_ERROR:
                return label + ": 재고를 확인할 수 없습니다 (requested " + requested + ")";
            default:
                return label + ": only " + available + " available (requested " + requested + ")";
        }
    }
}
