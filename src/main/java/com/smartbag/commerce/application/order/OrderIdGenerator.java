package com.smartbag.commerce.application.order;

import com.smartbag.commerce.domain.order.OrderRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * 사람이 읽을 수 있는 주문 ID 생성기
 *
 * 형식: ORD + yyyyMMdd + 6자리 (혼동되는 문자 0/O/1/I 제외)
 * 예: ORD20250115K7QX2M
 *
 * 충돌 시 최대 5회 재생성, 그래도 충돌하면 타임스탬프 기반 ID 사용
 */
@Slf4j
@Component
public class OrderIdGenerator {

    private static final String PREFIX = "ORD";
    private static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    private static final int RANDOM_LENGTH = 6;
    private static final int MAX_ATTEMPTS = 5;
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final SecureRandom random = new SecureRandom();
    private final OrderRepository orderRepository;

    public OrderIdGenerator(OrderRepository orderRepository) {
        this.orderRepository = orderRepository;
    }

    public String nextId() {
        String datePart = LocalDate.now().format(DATE_FORMAT);
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String candidate = PREFIX + datePart + randomPart();
            if (!orderRepository.existsById(candidate)) {
                return candidate;
            }
        }
        log.warn("[OrderIdGenerator] {}회 연속 ID 충돌, 타임스탬프 기반 ID 사용", MAX_ATTEMPTS);
        return PREFIX + datePart + System.currentTimeMillis() % 1_000_000_000L + randomPart().substring(0, 2);
    }

    private String randomPart() {
        StringBuilder sb = new StringBuilder(RANDOM_LENGTH);
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
