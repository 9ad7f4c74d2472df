package com.smartbag.commerce.presentation.inventory.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * InventoryResponse - 상품별 주문 가능 재고
 *
 * JSON 예시:
 * {
 *   "available_stock": {"P1": 12, "P2": 0}
 * }
 *
 * 재고 = max(0, 저장된 재고 - 예약 수량). 존재하지 않는 상품은 포함되지 않는다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryResponse {
    @JsonProperty("available_stock")
    private Map<String, Integer> availableStock;
}
