package com.smartbag.commerce.application.sideeffect;

import com.smartbag.commerce.domain.sideeffect.FailedSideEffect;
import com.smartbag.commerce.domain.sideeffect.FailedSideEffectRepository;
import com.smartbag.commerce.domain.sideeffect.FailedSideEffectStatus;
import com.smartbag.commerce.domain.sideeffect.SideEffectTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * SideEffectDeadLetterQueue - 부수 작업 실패 Dead Letter Queue (문서 저장소 영구 저장)
 *
 * 역할:
 * - 재시도를 모두 소진한 부수 작업을 failed_side_effects 에 PENDING 으로 기록
 * - 수동 재처리를 위한 조회/해결 처리 인터페이스 제공
 *
 * 사용 흐름:
 * 1. SideEffectWorker 가 재시도 소진 시 publish() 호출 (큐가 가득 찬 경우 SideEffectQueue 도 호출)
 * 2. 운영자가 getAllPending() 조회
 * 3. 수동 재처리 후 markAsResolved() 호출 (RESOLVED 상태로 변경)
 *
 * 주의:
 * - publish() 는 예외를 던지지 않는다. 저장 실패 시 작업 내용을 ERROR 로그에 남긴다.
 */
@Slf4j
@Component
public class SideEffectDeadLetterQueue {

    private final FailedSideEffectRepository failedSideEffectRepository;

    public SideEffectDeadLetterQueue(FailedSideEffectRepository failedSideEffectRepository) {
        this.failedSideEffectRepository = failedSideEffectRepository;
    }

    /**
     * 실패한 부수 작업을 DLQ에 발행
     *
     * @param task 실패한 작업
     * @param attempts 시도 횟수
     * @param errorMessage 마지막 오류 메시지
     */
    public void publish(SideEffectTask task, int attempts, String errorMessage) {
        log.error("[SideEffectDLQ] 부수 작업 DLQ 발행 - taskId={}, type={}, orderId={}, attempts={}, error={}",
                task.getTaskId(), task.getType(), task.getOrderId(), attempts, errorMessage);
        try {
            failedSideEffectRepository.save(FailedSideEffect.of(task, attempts, errorMessage));
        } catch (DataAccessException e) {
            log.error("[SideEffectDLQ] DLQ 저장 실패, 작업 유실 - taskId={}, type={}, orderId={}, payload={}",
                    task.getTaskId(), task.getType(), task.getOrderId(), task.getPayload(), e);
        }
    }

    public List<FailedSideEffect> getFailedSideEffects(String orderId) {
        return failedSideEffectRepository.findByOrderId(orderId);
    }

    /**
     * 모든 PENDING 상태의 실패 작업 조회 (관리자용)
     */
    public List<FailedSideEffect> getAllPending() {
        List<FailedSideEffect> pending = failedSideEffectRepository.findAllPending();
        log.info("[SideEffectDLQ] 전체 PENDING 실패 작업 조회 - 총 {}개", pending.size());
        return pending;
    }

    /**
     * 주문의 실패 작업 해결 표시 (수동 처리 후)
     *
     * @return RESOLVED 로 변경된 건수
     */
    public int markAsResolved(String orderId) {
        List<FailedSideEffect> failed = failedSideEffectRepository.findByOrderId(orderId);
        if (failed.isEmpty()) {
            log.warn("[SideEffectDLQ] 해결 요청되었으나 DLQ에 없음 - orderId={}", orderId);
            return 0;
        }

        int resolved = 0;
        for (FailedSideEffect entry : failed) {
            if (entry.getStatus() == FailedSideEffectStatus.PENDING) {
                entry.markAsResolved();
                failedSideEffectRepository.save(entry);
                resolved++;
            }
        }
        log.info("[SideEffectDLQ] 실패 작업 해결 처리 완료 - orderId={}, resolved={}", orderId, resolved);
        return resolved;
    }

    public int getSize() {
        return failedSideEffectRepository.findAllPending().size();
    }
}
