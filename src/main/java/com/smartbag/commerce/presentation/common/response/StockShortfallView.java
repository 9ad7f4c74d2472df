package com.smartbag.commerce.presentation.common.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.smartbag.commerce.domain.inventory.StockShortfall;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 상품별 재고 부족 정보 (에러 응답 details 항목)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockShortfallView {
    @JsonProperty("product_id")
    private String productId;

    @JsonProperty("product_name")
    private String productName;

    private int requested;

    private int available;

    private String reason;

    public static StockShortfallView from(StockShortfall shortfall) {
        return StockShortfallView.builder()
                .productId(shortfall.getProductId())
                .productName(shortfall.getProductName())
                .requested(shortfall.getRequested())
                .available(shortfall.getAvailable())
                .reason(shortfall.getReason().name())
                .build();
    }
}
