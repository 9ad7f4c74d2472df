package com.smartbag.commerce.domain.order;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.LocalDateTime;

/**
 * 주문 상태 변경 이력 한 건 (불변 값 객체)
 *
 * 이력 목록은 추가만 가능하며 기존 항목은 절대 수정되지 않는다.
 */
@Getter
@ToString
@EqualsAndHashCode
public class StatusChange {

    private final OrderStatus status;

    @Field("changed_at")
    private final LocalDateTime changedAt;

    @Field("changed_by")
    private final String changedBy;

    @Field("partner_id")
    private final String partnerId;

    private final String message;

    @JsonCreator
    public StatusChange(@JsonProperty("status") OrderStatus status,
                        @JsonProperty("changedAt") LocalDateTime changedAt,
                        @JsonProperty("changedBy") String changedBy,
                        @JsonProperty("partnerId") String partnerId,
                        @JsonProperty("message") String message) {
        this.status = status;
        this.changedAt = changedAt;
        this.changedBy = changedBy;
        this.partnerId = partnerId;
        this.message = message;
    }
}
