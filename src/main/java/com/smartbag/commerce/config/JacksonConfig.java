package com.smartbag.commerce.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

/**
 * API 응답/요청용 ObjectMapper 설정
 *
 * 캐시 전용 ObjectMapper(cacheObjectMapper, 타입 정보 포함)가 따로 등록되어 있으므로
 * 이 빈을 @Primary 로 두어 MVC 메시지 컨버터가 타입 정보 없는 매퍼를 사용하도록 한다.
 *
 * 설정 내용:
 * - JavaTimeModule 등록 (LocalDateTime, Instant)
 * - 날짜는 ISO-8601 문자열로 직렬화
 * - 알 수 없는 JSON 속성 무시
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper(Jackson2ObjectMapperBuilder builder) {
        ObjectMapper objectMapper = builder
                .createXmlMapper(false)
                .build();

        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        return objectMapper;
    }
}
