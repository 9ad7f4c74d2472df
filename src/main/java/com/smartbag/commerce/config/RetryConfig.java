package com.smartbag.commerce.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;

/**
 * RetryConfig - Spring Retry 설정 클래스
 *
 * 역할:
 * - @Retryable 어노테이션 활성화 (주문 접수의 일시적 저장소 오류 재시도)
 * - 부수 작업 워커용 RetryTemplate 제공
 *
 * 작동 원리:
 * 1. @EnableRetry가 AOP를 활성화
 * 2. @Retryable이 붙은 메서드 호출 시 프록시를 통해 가로채기
 * 3. 지정된 예외 발생 시 maxAttempts까지 재시도
 * 4. 소진 시 마지막 예외를 그대로 전파
 */
@Configuration
@EnableRetry
public class RetryConfig {

    /**
     * 부수 작업 재시도 템플릿 (기본 3회, 100ms 고정 대기)
     */
    @Bean
    public RetryTemplate sideEffectRetryTemplate(
            @Value("${smartbag.side-effect.max-attempts:3}") int maxAttempts,
            @Value("${smartbag.side-effect.backoff:100ms}") Duration backoff) {
        return RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .fixedBackoff(backoff.toMillis())
                .build();
    }
}
