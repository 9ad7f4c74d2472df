package com.smartbag.commerce.presentation.inventory;

import com.smartbag.commerce.application.inventory.InventoryCoordinator;
import com.smartbag.commerce.presentation.inventory.response.InventoryResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * InventoryController - Presentation 계층
 *
 * 역할:
 * - 상품 재고 현황 조회 API의 HTTP 요청 처리
 *
 * API:
 * - GET /inventory?productIds=P1,P2
 *   - 응답: InventoryResponse (200 OK)
 *   - 오류: 400 Bad Request (productIds 누락)
 */
@RestController
@RequestMapping("/inventory")
public class InventoryController {

    private final InventoryCoordinator inventoryCoordinator;

    public InventoryController(InventoryCoordinator inventoryCoordinator) {
        this.inventoryCoordinator = inventoryCoordinator;
    }

    @GetMapping
    public ResponseEntity<InventoryResponse> getAvailableStock(
            @RequestParam("productIds") List<String> productIds) {
        InventoryResponse response = InventoryResponse.builder()
                .availableStock(inventoryCoordinator.getAvailableStock(productIds))
                .build();
        return ResponseEntity.ok(response);
    }
}
