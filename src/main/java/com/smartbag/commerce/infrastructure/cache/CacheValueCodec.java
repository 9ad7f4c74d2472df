package com.smartbag.commerce.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.redis.serializer.JdkSerializationRedisSerializer;
import org.springframework.data.redis.serializer.SerializationException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Serializable;

/**
 * CacheValueCodec - 캐시 값 인코딩/디코딩
 *
 * 인코딩 규칙:
 * 1. JSON (cacheObjectMapper, 타입 정보 포함) 우선
 * 2. JSON 으로 표현할 수 없는 값은 JDK 직렬화 바이너리로 대체 (Serializable 필요)
 *
 * 디코딩 시 JDK 직렬화 스트림 매직 넘버(0xACED)로 형식을 판별한다.
 * UTF-8 JSON 텍스트는 0xAC 로 시작할 수 없으므로 두 형식이 겹치지 않는다.
 */
@Slf4j
@Component
public class CacheValueCodec {

    private static final byte STREAM_MAGIC_HIGH = (byte) 0xAC;
    private static final byte STREAM_MAGIC_LOW = (byte) 0xED;

    private final ObjectMapper cacheObjectMapper;
    private final JdkSerializationRedisSerializer binarySerializer = new JdkSerializationRedisSerializer();

    public CacheValueCodec(@Qualifier("cacheObjectMapper") ObjectMapper cacheObjectMapper) {
        this.cacheObjectMapper = cacheObjectMapper;
    }

    /**
     * @throws CacheCodecException JSON/바이너리 모두 불가능한 값
     */
    public byte[] encode(Object value) {
        try {
            return cacheObjectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException jsonFailure) {
            if (!(value instanceof Serializable)) {
                throw new CacheCodecException("JSON/바이너리 직렬화 모두 불가능한 값: " + value.getClass().getName(), jsonFailure);
            }
            log.debug("[CacheValueCodec] JSON 직렬화 불가, 바이너리로 대체 - type={}, reason={}",
                    value.getClass().getName(), jsonFailure.getOriginalMessage());
            try {
                return binarySerializer.serialize(value);
            } catch (SerializationException binaryFailure) {
                throw new CacheCodecException("바이너리 직렬화 실패: " + value.getClass().getName(), binaryFailure);
            }
        }
    }

    /**
     * @throws CacheCodecException 해석할 수 없는 데이터
     */
    public Object decode(byte[] bytes) {
        if (isBinary(bytes)) {
            try {
                return binarySerializer.deserialize(bytes);
            } catch (SerializationException e) {
                throw new CacheCodecException("바이너리 역직렬화 실패", e);
            }
        }
        try {
            return cacheObjectMapper.readValue(bytes, Object.class);
        } catch (IOException e) {
            throw new CacheCodecException("JSON 역직렬화 실패", e);
        }
    }

    public boolean isBinary(byte[] bytes) {
        return bytes != null && bytes.length >= 2
                && bytes[0] == STREAM_MAGIC_HIGH && bytes[1] == STREAM_MAGIC_LOW;
    }
}
