package com.smartbag.commerce.domain.inventory;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * 확정 전 주문의 재고 보류 기록 (캐시 전용, TTL로 자동 만료)
 *
 * 키: reservation:{orderId}:{productId}
 */
@Getter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class ReservationRecord {

    private String orderId;
    private String productId;
    private int quantity;
    private LocalDateTime reservedAt;
}
