package com.smartbag.commerce.domain.sideeffect;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 재시도 후에도 실패한 부수 작업 (Dead Letter 기록)
 *
 * 운영자가 조회 후 수동 처리하고 RESOLVED 로 표시한다.
 */
@Document("failed_side_effects")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailedSideEffect {

    @Id
    private String taskId;

    private SideEffectType type;

    @Indexed
    @Field("order_id")
    private String orderId;

    private Map<String, String> payload;

    private int attempts;

    @Field("error_message")
    private String errorMessage;

    @Indexed
    private FailedSideEffectStatus status;

    @Field("failed_at")
    private LocalDateTime failedAt;

    @Field("resolved_at")
    private LocalDateTime resolvedAt;

    public static FailedSideEffect of(SideEffectTask task, int attempts, String errorMessage) {
        return FailedSideEffect.builder()
                .taskId(task.getTaskId())
                .type(task.getType())
                .orderId(task.getOrderId())
                .payload(task.getPayload())
                .attempts(attempts)
                .errorMessage(errorMessage)
                .status(FailedSideEffectStatus.PENDING)
                .failedAt(LocalDateTime.now())
                .build();
    }

    public void markAsResolved() {
        this.status = FailedSideEffectStatus.RESOLVED;
        this.resolvedAt = LocalDateTime.now();
    }
}
