package com.smartbag.commerce.application.sideeffect;

import com.smartbag.commerce.domain.sideeffect.SideEffectTask;
import com.smartbag.commerce.domain.sideeffect.SideEffectType;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * SideEffectWorker - 아웃바운드 큐 소비자
 *
 * 역할:
 * - N개의 워커 스레드가 SideEffectQueue 를 비움
 * - 작업 유형별 SideEffectHandler 로 위임
 * - RetryTemplate 로 제한 횟수 재시도, 소진 시 DLQ 기록
 *
 * 주의:
 * - 작업 실패는 로그와 DLQ 로만 남고 주문 처리 흐름으로 전파되지 않는다
 */
@Slf4j
@Component
public class SideEffectWorker {

    private static final long POLL_TIMEOUT_MILLIS = 500;

    private final SideEffectQueue queue;
    private final Map<SideEffectType, SideEffectHandler> handlers = new EnumMap<>(SideEffectType.class);
    private final RetryTemplate retryTemplate;
    private final SideEffectDeadLetterQueue deadLetterQueue;
    private final int workerCount;

    private ExecutorService executor;
    private volatile boolean running;

    public SideEffectWorker(SideEffectQueue queue,
                            List<SideEffectHandler> handlers,
                            @Qualifier("sideEffectRetryTemplate") RetryTemplate retryTemplate,
                            SideEffectDeadLetterQueue deadLetterQueue,
                            @Value("${smartbag.side-effect.workers:2}") int workerCount) {
        this.queue = queue;
        this.retryTemplate = retryTemplate;
        this.deadLetterQueue = deadLetterQueue;
        this.workerCount = workerCount;
        for (SideEffectHandler handler : handlers) {
            this.handlers.put(handler.getType(), handler);
        }
    }

    @PostConstruct
    public void start() {
        AtomicInteger sequence = new AtomicInteger();
        executor = Executors.newFixedThreadPool(workerCount, runnable -> {
            Thread thread = new Thread(runnable, "side-effect-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        running = true;
        for (int i = 0; i < workerCount; i++) {
            executor.submit(this::drain);
        }
        log.info("[SideEffectWorker] 워커 시작 - workers={}, handlers={}", workerCount, handlers.keySet());
    }

    @PreDestroy
    public void stop() {
        running = false;
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[SideEffectWorker] 워커 종료 대기 시간 초과 - remaining={}", queue.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[SideEffectWorker] 워커 종료 - 미처리 작업={}", queue.size());
    }

    /**
     * 작업 1건 처리 (재시도 포함)
     *
     * @return 성공 여부 (실패 시 DLQ 기록 완료)
     */
    public boolean process(SideEffectTask task) {
        SideEffectHandler handler = handlers.get(task.getType());
        if (handler == null) {
            log.error("[SideEffectWorker] 처리기 없음 - taskId={}, type={}", task.getTaskId(), task.getType());
            deadLetterQueue.publish(task, 0, "no handler for " + task.getType());
            return false;
        }

        return retryTemplate.execute(
                context -> {
                    if (context.getRetryCount() > 0) {
                        log.info("[SideEffectWorker] 재시도 - taskId={}, type={}, attempt={}",
                                task.getTaskId(), task.getType(), context.getRetryCount() + 1);
                    }
                    handler.handle(task);
                    return true;
                },
                context -> {
                    Throwable last = context.getLastThrowable();
                    String message = last != null ? last.getClass().getSimpleName() + ": " + last.getMessage() : "unknown";
                    log.error("[SideEffectWorker] 재시도 소진 - taskId={}, type={}, orderId={}, attempts={}",
                            task.getTaskId(), task.getType(), task.getOrderId(), context.getRetryCount(), last);
                    deadLetterQueue.publish(task, context.getRetryCount(), message);
                    return false;
                });
    }

    private void drain() {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                SideEffectTask task = queue.poll(POLL_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
                if (task != null) {
                    process(task);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                log.error("[SideEffectWorker] 예기치 못한 오류, 워커 계속 실행", e);
            }
        }
    }
}
