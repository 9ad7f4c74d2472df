package com.smartbag.commerce;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * SmartBag 커머스 애플리케이션 메인 클래스
 *
 * 활성화된 기능:
 * - @EnableAspectJAutoProxy: AOP Aspect 자동 프록시 생성 (@Retryable 프록시)
 * - 재시도 설정은 RetryConfig 참조
 */
@EnableAspectJAutoProxy
@SpringBootApplication
public class SmartBagApplication {

    public static void main(String[] args) {
        SpringApplication.run(SmartBagApplication.class, args);
    }

}
