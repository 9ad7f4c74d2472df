package com.smartbag.commerce.domain.inventory;

import java.util.Collections;
import java.util.List;

/**
 * InventoryResult - 재고 일괄 차감 결과
 *
 * 성공: 차감된 모든 라인 (요청 순서 유지)
 * 실패: 실패한 모든 라인의 부족 정보. 실패 결과가 반환되는 시점에는 성공했던 라인의 롤백이 이미 끝나 있다.
 */
public final class InventoryResult {

    private final List<StockLine> decremented;
    private final List<StockShortfall> shortfalls;

    private InventoryResult(List<StockLine> decremented, List<StockShortfall> shortfalls) {
        this.decremented = decremented;
        this.shortfalls = shortfalls;
    }

    public static InventoryResult success(List<StockLine> decremented) {
        return new InventoryResult(List.copyOf(decremented), Collections.emptyList());
    }

    public static InventoryResult failure(List<StockShortfall> shortfalls) {
        if (shortfalls == null || shortfalls.isEmpty()) {
            throw new IllegalArgumentException("실패 결과에는 최소 1건의 부족 정보가 필요합니다");
        }
        return new InventoryResult(Collections.emptyList(), List.copyOf(shortfalls));
    }

    public boolean isSuccess() {
        return shortfalls.isEmpty();
    }

    public List<StockLine> getDecremented() {
        return decremented;
    }

    public List<StockShortfall> getShortfalls() {
        return shortfalls;
    }

    /**
     * 실패 라인 중 가장 심각한 사유 (성공이면 null)
     */
    public ShortfallReason getDominantReason() {
        ShortfallReason dominant = null;
        for (StockShortfall shortfall : shortfalls) {
            if (shortfall.getReason().isMoreSevereThan(dominant)) {
                dominant = shortfall.getReason();
            }
        }
        return dominant;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "InventoryResult.Success" + decremented
                : "InventoryResult.Failure" + shortfalls;
    }
}
