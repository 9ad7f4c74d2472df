package com.smartbag.commerce.domain.order;

import lombok.Getter;

import java.util.EnumSet;
import java.util.Set;

/**
 * OrderStatus - 주문 생명주기 상태
 *
 * 상태 전환 규칙:
 * PREPARING → ASSIGNING → ASSIGNED → OUT_FOR_DELIVERY → ARRIVED → DELIVERED
 * ASSIGNING → ASSIGNING (다른 파트너의 추가 수락)
 * ASSIGNED | OUT_FOR_DELIVERY → DELIVERED
 * 종료되지 않은 모든 상태 → CANCELLED | REFUNDED
 *
 * 종료 상태: DELIVERED, CANCELLED, REFUNDED (이후 전이 없음)
 */
@Getter
public enum OrderStatus {
    PREPARING("preparing", "상품 준비 중"),
    ASSIGNING("assigning", "배달 파트너 배정 중"),
    ASSIGNED("assigned", "배달 파트너 배정 완료"),
    OUT_FOR_DELIVERY("out_for_delivery", "배달 중"),
    ARRIVED("arrived", "배달 도착"),
    DELIVERED("delivered", "배달 완료"),
    CANCELLED("cancelled", "주문 취소"),
    REFUNDED("refunded", "환불 완료");

    /**
     * 진행 중인 주문 (활성 주문 조회 대상)
     */
    public static final Set<OrderStatus> ACTIVE = EnumSet.of(PREPARING, ASSIGNING, ASSIGNED, OUT_FOR_DELIVERY, ARRIVED);

    private final String value;
    private final String displayName;

    OrderStatus(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    public boolean isTerminal() {
        return this == DELIVERED || this == CANCELLED || this == REFUNDED;
    }

    public boolean canTransitionTo(OrderStatus next) {
        if (isTerminal()) {
            return false;
        }
        if (next == CANCELLED || next == REFUNDED) {
            return true;
        }
        switch (this) {
            case PREPARING:
                return next == ASSIGNING;
            case ASSIGNING:
                return next == ASSIGNING || next == ASSIGNED;
            case ASSIGNED:
                return next == OUT_FOR_DELIVERY || next == DELIVERED;
            case OUT_FOR_DELIVERY:
                return next == ARRIVED || next == DELIVERED;
            case ARRIVED:
                return next == DELIVERED;
            default:
                return false;
        }
    }

    /**
     * "preparing" 또는 "PREPARING" 형식의 문자열을 변환
     */
    public static OrderStatus fromString(String status) {
        for (OrderStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(status) || candidate.name().equalsIgnoreCase(status)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("유효하지 않은 주문 상태입니다: " + status);
    }
}
