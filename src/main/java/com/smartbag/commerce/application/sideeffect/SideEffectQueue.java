package com.smartbag.commerce.application.sideeffect;

import com.smartbag.commerce.domain.sideeffect.SideEffectTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * SideEffectQueue - 주문 커밋 이후 부수 작업의 프로세스 내 아웃바운드 큐
 *
 * - 용량 제한 큐이며, 가득 차면 작업을 버리지 않고 DLQ로 보낸다
 * - enqueue 는 호출자(주문 처리)를 실패시키지 않는다
 */
@Slf4j
@Component
public class SideEffectQueue {

    private final BlockingQueue<SideEffectTask> queue;
    private final SideEffectDeadLetterQueue deadLetterQueue;

    public SideEffectQueue(@Value("${smartbag.side-effect.queue-capacity:10000}") int capacity,
                           SideEffectDeadLetterQueue deadLetterQueue) {
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.deadLetterQueue = deadLetterQueue;
    }

    /**
     * @return 큐에 들어갔으면 true, 가득 차서 DLQ로 보냈으면 false
     */
    public boolean enqueue(SideEffectTask task) {
        if (queue.offer(task)) {
            log.debug("[SideEffectQueue] 작업 적재 - taskId={}, type={}, orderId={}",
                    task.getTaskId(), task.getType(), task.getOrderId());
            return true;
        }
        log.error("[SideEffectQueue] 큐 포화, DLQ로 이동 - taskId={}, type={}, orderId={}",
                task.getTaskId(), task.getType(), task.getOrderId());
        deadLetterQueue.publish(task, 0, "side-effect queue is full");
        return false;
    }

    /**
     * @return 큐에 들어간 작업 수
     */
    public int enqueueAll(List<SideEffectTask> tasks) {
        int accepted = 0;
        for (SideEffectTask task : tasks) {
            if (enqueue(task)) {
                accepted++;
            }
        }
        return accepted;
    }

    SideEffectTask poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public int size() {
        return queue.size();
    }
}
