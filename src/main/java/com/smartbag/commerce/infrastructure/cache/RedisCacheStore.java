package com.smartbag.commerce.infrastructure.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.serializer.StringRedisSerializer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * RedisCacheStore - Redis 기반 CacheStore 구현 (L2)
 *
 * 역할:
 * - 모든 Redis 호출을 감싸 예외를 로그로 남기고 미스/false 로 변환
 * - 값 인코딩은 CacheValueCodec(JSON 우선, 바이너리 대체)에 위임
 *
 * 특징:
 * - increment 는 INCRBY 단일 명령 (클라이언트 측 read-modify-write 없음)
 * - 패턴 조회/삭제는 KEYS 대신 SCAN 사용
 * - 다건 쓰기는 파이프라인으로 왕복 1회
 */
@Slf4j
@Component
public class RedisCacheStore implements CacheStore {

    private static final long SCAN_COUNT = 100;

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final CacheValueCodec codec;

    public RedisCacheStore(@Qualifier("cacheStoreRedisTemplate") RedisTemplate<String, byte[]> redisTemplate,
                           CacheValueCodec codec) {
        this.redisTemplate = redisTemplate;
        this.codec = codec;
    }

    @Override
    public Optional<Object> get(String key) {
        byte[] bytes;
        try {
            bytes = redisTemplate.opsForValue().get(key);
        } catch (RuntimeException e) {
            log.warn("[RedisCacheStore] 조회 실패, 캐시 미스로 처리 - key={}, error={}", key, e.getMessage());
            return Optional.empty();
        }
        if (bytes == null) {
            return Optional.empty();
        }
        return decodeSafely(key, bytes);
    }

    @Override
    public boolean set(String key, Object value, Duration ttl) {
        if (value == null) {
            log.warn("[RedisCacheStore] null 값은 저장하지 않음 - key={}", key);
            return false;
        }
        try {
            byte[] bytes = codec.encode(value);
            redisTemplate.opsForValue().set(key, bytes, ttl);
            return true;
        } catch (CacheCodecException e) {
            log.warn("[RedisCacheStore] 직렬화 실패 - key={}, error={}", key, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.warn("[RedisCacheStore] 저장 실패 - key={}, error={}", key, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            return Boolean.TRUE.equals(redisTemplate.delete(key));
        } catch (RuntimeException e) {
            log.warn("[RedisCacheStore] 삭제 실패 - key={}, error={}", key, e.getMessage());
            return false;
        }
    }

    @Override
    public Map<String, Object> getMany(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return Collections.emptyMap();
        }
        List<String> orderedKeys = new ArrayList<>(keys);
        List<byte[]> values;
        try {
            values = redisTemplate.opsForValue().multiGet(orderedKeys);
        } catch (RuntimeException e) {
            log.warn("[RedisCacheStore] 다건 조회 실패, 전체 미스로 처리 - keys={}, error={}", orderedKeys.size(), e.getMessage());
            return Collections.emptyMap();
        }
        if (values == null) {
            return Collections.emptyMap();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < orderedKeys.size() && i < values.size(); i++) {
            byte[] bytes = values.get(i);
            if (bytes == null) {
                continue;
            }
            String key = orderedKeys.get(i);
            decodeSafely(key, bytes).ifPresent(value -> result.put(key, value));
        }
        return result;
    }

    @Override
    public boolean setMany(Map<String, ?> values, Duration ttl) {
        if (values == null || values.isEmpty()) {
            return true;
        }
        Map<byte[], byte[]> encoded = new LinkedHashMap<>();
        try {
            values.forEach((key, value) -> encoded.put(StringRedisSerializer.UTF_8.serialize(key), codec.encode(value)));
        } catch (CacheCodecException e) {
            log.warn("[RedisCacheStore] 다건 저장 직렬화 실패 - error={}", e.getMessage());
            return false;
        }
        try {
            long seconds = Math.max(1, ttl.getSeconds());
            redisTemplate.executePipelined((RedisCallback<Object>) connection -> {
                encoded.forEach((key, value) -> connection.stringCommands().setEx(key, seconds, value));
                return null;
            });
            return true;
        } catch (RuntimeException e) {
            log.warn("[RedisCacheStore] 다건 저장 실패 - keys={}, error={}", values.size(), e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<Long> increment(String key, long amount) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().increment(key, amount));
        } catch (RuntimeException e) {
            log.warn("[RedisCacheStore] 증가 실패 - key={}, amount={}, error={}", key, amount, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        try {
            return Boolean.TRUE.equals(redisTemplate.expire(key, ttl));
        } catch (RuntimeException e) {
            log.warn("[RedisCacheStore] TTL 설정 실패 - key={}, error={}", key, e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<Duration> remainingTtl(String key) {
        try {
            Long millis = redisTemplate.getExpire(key, TimeUnit.MILLISECONDS);
            // -2: 키 없음, -1: TTL 없음
            if (millis == null || millis < 0) {
                return Optional.empty();
            }
            return Optional.of(Duration.ofMillis(millis));
        } catch (RuntimeException e) {
            log.warn("[RedisCacheStore] TTL 조회 실패 - key={}, error={}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<String> keys(String pattern) {
        List<String> keys = new ArrayList<>();
        ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_COUNT).build();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            cursor.forEachRemaining(keys::add);
            return keys;
        } catch (RuntimeException e) {
            log.warn("[RedisCacheStore] SCAN 실패 - pattern={}, error={}", pattern, e.getMessage());
            return Collections.emptyList();
        }
    }

    @Override
    public long deletePattern(String pattern) {
        List<String> keys = keys(pattern);
        if (keys.isEmpty()) {
            return 0;
        }
        try {
            Long deleted = redisTemplate.delete(keys);
            log.debug("[RedisCacheStore] 패턴 삭제 - pattern={}, deleted={}", pattern, deleted);
            return deleted != null ? deleted : 0;
        } catch (RuntimeException e) {
            log.warn("[RedisCacheStore] 패턴 삭제 실패 - pattern={}, error={}", pattern, e.getMessage());
            return 0;
        }
    }

    private Optional<Object> decodeSafely(String key, byte[] bytes) {
        try {
            return Optional.ofNullable(codec.decode(bytes));
        } catch (CacheCodecException e) {
            log.warn("[RedisCacheStore] 역직렬화 실패, 캐시 미스로 처리 - key={}, error={}", key, e.getMessage());
            return Optional.empty();
        }
    }
}
