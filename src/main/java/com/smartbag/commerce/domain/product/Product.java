package com.smartbag.commerce.domain.product;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Product 도메인 엔티티
 *
 * 책임:
 * - 상품 정보 (이름, 카테고리, 브랜드, 가격) 보관
 * - 판매 가능 재고(stock)의 권위 있는 값 보관
 *
 * 핵심 비즈니스 규칙:
 * - stock >= 0 은 항상 유지
 * - stock 감소는 재고 조건부 원자 연산(ProductRepository.decrementStockIfAvailable)으로만 수행
 * - 상품의 생성/수정은 외부 카탈로그 관리 시스템이 담당
 * - 보류 재고(reserved)는 캐시에만 존재하며 여기에는 저장하지 않음
 */
@Document("products")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product {

    @Id
    private String id;

    private String name;

    @Indexed
    private String category;

    private String brand;

    private BigDecimal price;

    private int stock;

    @Field("is_active")
    private boolean active;

    @Field("created_at")
    private LocalDateTime createdAt;

    @Field("updated_at")
    private LocalDateTime updatedAt;

    /**
     * 요청 수량을 지금 판매할 수 있는지 여부 (표시/사전 검증용, 최종 판단은 조건부 차감)
     */
    public boolean canSupply(int quantity) {
        return active && stock >= quantity;
    }

    /**
     * 재고 차감 (조건을 만족하지 않으면 false)
     * 호출자는 검사와 차감을 하나의 원자 구간에서 수행해야 한다.
     */
    public boolean tryDecreaseStock(int quantity) {
        if (!canSupply(quantity)) {
            return false;
        }
        this.stock -= quantity;
        this.updatedAt = LocalDateTime.now();
        return true;
    }

    /**
     * 재고 복구 (보상/취소)
     */
    public void increaseStock(int quantity) {
        this.stock += quantity;
        this.updatedAt = LocalDateTime.now();
    }
}
