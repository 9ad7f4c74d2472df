package com.smartbag.commerce.domain.sideeffect;

/**
 * 주문 커밋 이후 수행하는 부수 작업 종류
 */
public enum SideEffectType {
    /** 프로모션 코드 사용 횟수 차감 */
    COUPON_USAGE,
    /** 장바구니 비우기 */
    CART_CLEAR,
    /** 장바구니/최근 주문/활성 주문 캐시 무효화 */
    CACHE_INVALIDATION,
    /** order_placed 이벤트 발행 (주문 확인 알림) */
    ORDER_PLACED,
    /** order_status_changed 이벤트 발행 */
    ORDER_STATUS_CHANGED
}
