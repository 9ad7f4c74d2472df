package com.smartbag.commerce.infrastructure.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * TwoTierCache - L1(Caffeine, 프로세스 내) + L2(CacheStore, 공유) 캐시 파사드
 *
 * 읽기 (read-through):
 * 1. L1 히트 → 즉시 반환
 * 2. L1 미스 → L2 조회, 히트 시 L1 채움 (만료 = min(now + l1MaxTtl, L2 만료))
 * 3. 모두 미스 → 비어 있음
 *
 * 쓰기:
 * - L2 에 먼저 쓰고, 성공한 경우에만 L1 에 쓴다
 *
 * 무효화:
 * - L1 을 먼저 지우고 L2 를 지운다 (L2 삭제 실패와 무관하게 L1 은 항상 비워짐)
 * - 무효화마다 세대(invalidation generation)를 올린다. L2 조회나 원본 로드 전에 읽어 둔 세대가
 *   바뀌었으면 읽은 값으로 캐시를 채우지 않는다 (삭제된 값의 부활 방지)
 *
 * 주의:
 * - L1 은 객체 참조를 그대로 보관하므로 캐시된 값은 불변으로 취급해야 한다
 * - 다른 인스턴스의 L1 은 무효화되지 않으며 최대 l1MaxTtl 동안 이전 값을 볼 수 있다
 */
@Slf4j
@Component
public class TwoTierCache {

    private final CacheStore l2;
    private final Ticker ticker;
    private final Duration l1MaxTtl;
    private final Cache<String, L1Entry> l1;

    private final AtomicLong l1Hits = new AtomicLong();
    private final AtomicLong l1Misses = new AtomicLong();
    private final AtomicLong l2Hits = new AtomicLong();
    private final AtomicLong l2Misses = new AtomicLong();
    private final AtomicLong invalidations = new AtomicLong();

    public TwoTierCache(CacheStore l2,
                        Ticker cacheTicker,
                        @Value("${smartbag.cache.l1.max-size:1000}") long l1MaxSize,
                        @Value("${smartbag.cache.l1.max-ttl:60s}") Duration l1MaxTtl) {
        this.l2 = l2;
        this.ticker = cacheTicker;
        this.l1MaxTtl = l1MaxTtl;
        this.l1 = Caffeine.newBuilder()
                .maximumSize(l1MaxSize)
                .ticker(cacheTicker)
                .expireAfter(new AbsoluteExpiry())
                .build();
    }

    public Optional<Object> get(String key, boolean useL1) {
        if (useL1) {
            L1Entry entry = l1.getIfPresent(key);
            if (entry != null) {
                l1Hits.incrementAndGet();
                return Optional.of(entry.value);
            }
            l1Misses.incrementAndGet();
        }

        long generation = invalidations.get();
        Optional<Object> value = l2.get(key);
        if (value.isEmpty()) {
            l2Misses.incrementAndGet();
            return Optional.empty();
        }
        l2Hits.incrementAndGet();

        if (useL1) {
            populateFromL2(key, value.get(), generation);
        }
        return value;
    }

    public <T> Optional<T> get(String key, Class<T> type, boolean useL1) {
        return get(key, useL1).filter(type::isInstance).map(type::cast);
    }

    public boolean set(String key, Object value, Duration ttl, boolean useL1) {
        boolean written = l2.set(key, value, ttl);
        if (!written) {
            // L2 에 없는 값을 L1 에만 남기지 않는다
            l1.invalidate(key);
            log.warn("[TwoTierCache] L2 쓰기 실패, L1 미반영 - key={}", key);
            return false;
        }
        if (useL1) {
            populateL1(key, value, ttl);
        } else {
            l1.invalidate(key);
        }
        return true;
    }

    /**
     * 현재 무효화 세대. cache-aside 로드 전에 읽어 {@link #populate} 에 넘긴다.
     */
    public long invalidationGeneration() {
        return invalidations.get();
    }

    /**
     * cache-aside 채우기: 원본에서 읽은 값을 캐시에 쓰되, 읽기 시작 이후 무효화가 있었으면 쓰지 않는다.
     *
     * 쓰기 직후 세대를 다시 확인해서 쓰기와 겹친 무효화가 있었으면 방금 쓴 키를 지운다.
     *
     * @param generation 원본 조회 전에 {@link #invalidationGeneration()} 으로 읽은 값
     * @return 캐시에 남았으면 true
     */
    public boolean populate(String key, Object value, Duration ttl, boolean useL1, long generation) {
        if (invalidations.get() != generation) {
            log.debug("[TwoTierCache] 로드 중 무효화 발생, 캐시 채우기 생략 - key={}", key);
            return false;
        }
        if (!set(key, value, ttl, useL1)) {
            return false;
        }
        if (invalidations.get() != generation) {
            log.debug("[TwoTierCache] 쓰기 중 무효화 발생, 방금 쓴 값 제거 - key={}", key);
            l1.invalidate(key);
            l2.delete(key);
            return false;
        }
        return true;
    }

    public boolean delete(String key) {
        invalidations.incrementAndGet();
        l1.invalidate(key);
        return l2.delete(key);
    }

    /**
     * 패턴 삭제 (glob: *, ?)
     *
     * @return L2 에서 삭제된 키 수
     */
    public long deletePattern(String pattern) {
        invalidations.incrementAndGet();
        Pattern regex = globToRegex(pattern);
        List<String> l1Keys = new ArrayList<>();
        for (String key : l1.asMap().keySet()) {
            if (regex.matcher(key).matches()) {
                l1Keys.add(key);
            }
        }
        l1.invalidateAll(l1Keys);
        return l2.deletePattern(pattern);
    }

    public Map<String, Object> getMany(Collection<String> keys, boolean useL1) {
        if (keys == null || keys.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        List<String> remaining = new ArrayList<>();
        for (String key : keys) {
            L1Entry entry = useL1 ? l1.getIfPresent(key) : null;
            if (entry != null) {
                l1Hits.incrementAndGet();
                result.put(key, entry.value);
            } else {
                if (useL1) {
                    l1Misses.incrementAndGet();
                }
                remaining.add(key);
            }
        }
        if (remaining.isEmpty()) {
            return result;
        }

        long generation = invalidations.get();
        Map<String, Object> fromL2 = l2.getMany(remaining);
        l2Hits.addAndGet(fromL2.size());
        l2Misses.addAndGet(remaining.size() - fromL2.size());
        fromL2.forEach((key, value) -> {
            if (useL1) {
                populateFromL2(key, value, generation);
            }
            result.put(key, value);
        });
        return result;
    }

    public TwoTierCacheStats stats() {
        l1.cleanUp();
        return new TwoTierCacheStats(
                l1Hits.get(), l1Misses.get(), l1.estimatedSize(),
                l2Hits.get(), l2Misses.get()
        );
    }

    /**
     * L2 에서 읽은 값으로 L1 채우기
     *
     * 남은 TTL 을 알 수 없으면 (이미 삭제/만료되었거나 TTL 없음) 채우지 않는다.
     */
    private void populateFromL2(String key, Object value, long generation) {
        if (invalidations.get() != generation) {
            return;
        }
        Optional<Duration> remaining = l2.remainingTtl(key);
        if (remaining.isEmpty()) {
            return;
        }
        L1Entry entry = populateL1(key, value, remaining.get());
        if (entry != null && invalidations.get() != generation) {
            l1.asMap().remove(key, entry);
        }
    }

    private L1Entry populateL1(String key, Object value, Duration ttl) {
        Duration effective = ttl.compareTo(l1MaxTtl) < 0 ? ttl : l1MaxTtl;
        if (effective.isZero() || effective.isNegative()) {
            return null;
        }
        L1Entry entry = new L1Entry(value, ticker.read() + effective.toNanos());
        l1.put(key, entry);
        return entry;
    }

    private static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*':
                    regex.append(".*");
                    break;
                case '?':
                    regex.append('.');
                    break;
                default:
                    regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }

    private static final class L1Entry {
        private final Object value;
        private final long expiresAtNanos;

        private L1Entry(Object value, long expiresAtNanos) {
            this.value = value;
            this.expiresAtNanos = expiresAtNanos;
        }
    }

    /**
     * 엔트리에 저장된 절대 만료 시각까지 남은 시간을 그대로 수명으로 사용
     */
    private static final class AbsoluteExpiry implements Expiry<String, L1Entry> {

        @Override
        public long expireAfterCreate(String key, L1Entry entry, long currentTime) {
            return Math.max(0, entry.expiresAtNanos - currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, L1Entry entry, long currentTime, long currentDuration) {
            return Math.max(0, entry.expiresAtNanos - currentTime);
        }

        @Override
        public long expireAfterRead(String key, L1Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
