package com.smartbag.commerce.application.sideeffect.handler;

import com.smartbag.commerce.application.sideeffect.SideEffectHandler;
import com.smartbag.commerce.domain.coupon.CouponRepository;
import com.smartbag.commerce.domain.sideeffect.SideEffectTask;
import com.smartbag.commerce.domain.sideeffect.SideEffectType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 쿠폰 사용 횟수 차감 (usage_limit > 0 인 경우에만)
 *
 * 이미 소진된 쿠폰은 재시도 대상이 아니므로 경고만 남긴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CouponUsageHandler implements SideEffectHandler {

    private final CouponRepository couponRepository;

    @Override
    public SideEffectType getType() {
        return SideEffectType.COUPON_USAGE;
    }

    @Override
    public void handle(SideEffectTask task) {
        String promoCode = task.get(SideEffectTask.PROMO_CODE);
        if (!couponRepository.decrementUsageIfPositive(promoCode)) {
            log.warn("[CouponUsageHandler] 쿠폰 사용 횟수 차감 불가 (소진 또는 없음) - orderId={}, promoCode={}",
                    task.getOrderId(), promoCode);
        }
    }
}
