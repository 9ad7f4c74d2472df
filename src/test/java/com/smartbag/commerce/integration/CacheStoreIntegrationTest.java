package com.smartbag.commerce.integration;

import com.smartbag.commerce.domain.inventory.ReservationRecord;
import com.smartbag.commerce.infrastructure.cache.CacheStore;
import com.smartbag.commerce.infrastructure.cache.TwoTierCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Redis 캐시 저장소 통합 테스트
 */
@DisplayName("캐시 저장소 통합 테스트")
class CacheStoreIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private CacheStore cacheStore;

    @Autowired
    private TwoTierCache twoTierCache;

    private String prefix;

    @BeforeEach
    void setUp() {
        prefix = "it:" + UUID.randomUUID() + ":";
    }

    @Test
    @DisplayName("객체 저장/조회 - 타입 유지, TTL 적용")
    void setAndGet_Object() {
        // Given
        ReservationRecord record = new ReservationRecord("ORD1", "P1", 3, LocalDateTime.now());

        // When
        boolean written = cacheStore.set(prefix + "record", record, Duration.ofMinutes(5));

        // Then
        assertThat(written).isTrue();
        ReservationRecord loaded = cacheStore.get(prefix + "record", ReservationRecord.class).orElseThrow();
        assertThat(loaded.getOrderId()).isEqualTo("ORD1");
        assertThat(loaded.getQuantity()).isEqualTo(3);
        assertThat(cacheStore.remainingTtl(prefix + "record")).hasValueSatisfying(ttl ->
                assertThat(ttl).isLessThanOrEqualTo(Duration.ofMinutes(5)).isPositive());
    }

    @Test
    @DisplayName("카운터 증감 - 없는 키는 0에서 시작")
    void increment() {
        assertThat(cacheStore.increment(prefix + "counter", 5)).contains(5L);
        assertThat(cacheStore.increment(prefix + "counter", -2)).contains(3L);
        assertThat(cacheStore.get(prefix + "counter", Number.class).map(Number::intValue)).contains(3);
    }

    @Test
    @DisplayName("일괄 저장/조회 - 없는 키는 결과에서 제외")
    void setManyAndGetMany() {
        cacheStore.setMany(Map.of(prefix + "a", 1, prefix + "b", "two"), Duration.ofMinutes(1));

        Map<String, Object> values = cacheStore.getMany(List.of(prefix + "a", prefix + "b", prefix + "missing"));

        assertThat(values).hasSize(2);
        assertThat(values.get(prefix + "b")).isEqualTo("two");
    }

    @Test
    @DisplayName("패턴 삭제 - 일치하는 키만 삭제")
    void deletePattern() {
        cacheStore.set(prefix + "recent:page0", "x", Duration.ofMinutes(1));
        cacheStore.set(prefix + "recent:page1", "y", Duration.ofMinutes(1));
        cacheStore.set(prefix + "other", "z", Duration.ofMinutes(1));

        long deleted = cacheStore.deletePattern(prefix + "recent:*");

        assertThat(deleted).isEqualTo(2);
        assertThat(cacheStore.get(prefix + "other")).contains("z");
    }

    @Test
    @DisplayName("2단계 캐시 - 삭제 후 어느 계층에서도 읽히지 않음")
    void twoTier_DeleteRemovesBothTiers() {
        // Given
        String key = prefix + "cart";
        twoTierCache.set(key, "cached-cart", Duration.ofMinutes(1), true);
        assertThat(twoTierCache.get(key, true)).contains("cached-cart");

        // When
        twoTierCache.delete(key);

        // Then
        assertThat(twoTierCache.get(key, true)).isEmpty();
        assertThat(cacheStore.get(key)).isEmpty();
    }
}
