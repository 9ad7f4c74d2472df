package com.smartbag.commerce.infrastructure.config;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * 캐시 설정 (L1: Caffeine, L2: Redis)
 *
 * 구성:
 * 1. cacheObjectMapper: 캐시 값 JSON 직렬화 전용 (타입 정보 포함, 필드 기반)
 *    - API 응답용 ObjectMapper(JacksonConfig)와 분리하여 서로 영향을 주지 않음
 * 2. cacheStoreRedisTemplate: Key=String, Value=byte[]
 *    - 값의 인코딩(JSON 우선, 실패 시 JDK 바이너리)은 CacheValueCodec 이 담당
 * 3. cacheTicker: L1 만료 계산용 시간원 (테스트에서 교체 가능)
 */
@Configuration
public class CacheConfig {

    /**
     * 캐시 전용 ObjectMapper
     *
     * - 게터가 아닌 필드 기준으로 직렬화 (도메인 객체의 파생 게터가 섞이지 않도록)
     * - NON_FINAL 기본 타이핑으로 역직렬화 시 원래 타입 복원
     * - LocalDateTime 등 java.time 지원
     */
    @Bean
    public ObjectMapper cacheObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE);
        mapper.setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
        mapper.activateDefaultTyping(
                BasicPolymorphicTypeValidator.builder()
                        .allowIfBaseType(Object.class)
                        .build(),
                ObjectMapper.DefaultTyping.NON_FINAL,
                JsonTypeInfo.As.PROPERTY
        );
        return mapper;
    }

    /**
     * CacheStore 전용 RedisTemplate (값은 이미 인코딩된 byte[])
     */
    @Bean(name = "cacheStoreRedisTemplate")
    public RedisTemplate<String, byte[]> cacheStoreRedisTemplate(RedisConnectionFactory redisConnectionFactory) {
        RedisTemplate<String, byte[]> template = new RedisTemplate<>();
        template.setConnectionFactory(redisConnectionFactory);

        StringRedisSerializer stringSerializer = new StringRedisSerializer();
        template.setKeySerializer(stringSerializer);
        template.setValueSerializer(RedisSerializer.byteArray());
        template.setHashKeySerializer(stringSerializer);
        template.setHashValueSerializer(RedisSerializer.byteArray());

        template.afterPropertiesSet();
        return template;
    }

    @Bean
    public Ticker cacheTicker() {
        return Ticker.systemTicker();
    }
}
