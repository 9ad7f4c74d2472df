package com.smartbag.commerce.infrastructure.cache;

import lombok.Getter;
import lombok.ToString;

/**
 * 2단계 캐시 통계 스냅샷
 */
@Getter
@ToString
public class TwoTierCacheStats {

    private final long l1Hits;
    private final long l1Misses;
    private final long l1Size;
    private final long l2Hits;
    private final long l2Misses;

    public TwoTierCacheStats(long l1Hits, long l1Misses, long l1Size, long l2Hits, long l2Misses) {
        this.l1Hits = l1Hits;
        this.l1Misses = l1Misses;
        this.l1Size = l1Size;
        this.l2Hits = l2Hits;
        this.l2Misses = l2Misses;
    }

    public double getHitRate() {
        long hits = l1Hits + l2Hits;
        long total = hits + l2Misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
