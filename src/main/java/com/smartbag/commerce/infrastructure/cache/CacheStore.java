package com.smartbag.commerce.infrastructure.cache;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * CacheStore - TTL 기반 공유 키-값 저장소 (L2)
 *
 * 실패 정책 (fail-soft):
 * - 어떤 연산도 예외를 호출자에게 던지지 않는다
 * - 조회 실패/역직렬화 실패 → 비어 있음(캐시 미스)
 * - 쓰기/삭제 실패 → false
 * - 캐시는 결코 유일한 원천 데이터가 아니므로 미스는 항상 저장소 재조회로 복구 가능해야 한다
 */
public interface CacheStore {

    Optional<Object> get(String key);

    /**
     * 타입 지정 조회 (다른 타입의 값이 저장되어 있으면 미스로 취급)
     */
    default <T> Optional<T> get(String key, Class<T> type) {
        return get(key).filter(type::isInstance).map(type::cast);
    }

    boolean set(String key, Object value, Duration ttl);

    boolean delete(String key);

    /**
     * 다건 조회 (없는 키는 결과에서 빠짐)
     */
    Map<String, Object> getMany(Collection<String> keys);

    boolean setMany(Map<String, ?> values, Duration ttl);

    /**
     * 서버 측 원자적 증가 (INCRBY)
     *
     * @return 증가 후 값, 실패 시 비어 있음
     */
    Optional<Long> increment(String key, long amount);

    boolean expire(String key, Duration ttl);

    /**
     * 남은 TTL (키가 없거나 TTL 이 없거나 조회 실패 시 비어 있음)
     */
    Optional<Duration> remainingTtl(String key);

    /**
     * SCAN 기반 키 조회
     */
    List<String> keys(String pattern);

    /**
     * SCAN 기반 패턴 삭제
     *
     * @return 삭제한 키 수 (실패 시 0)
     */
    long deletePattern(String pattern);
}
