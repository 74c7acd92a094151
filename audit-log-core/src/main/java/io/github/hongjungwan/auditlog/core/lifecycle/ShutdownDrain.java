package io.github.hongjungwan.auditlog.core.lifecycle;

import io.github.hongjungwan.auditlog.api.AuditLogPipeline;
import io.github.hongjungwan.auditlog.core.internal.BatchFlushScheduler;
import io.github.hongjungwan.auditlog.core.internal.BoundedLogQueue;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * 종료 시 큐 드레인. 큐가 빌 때까지 배치 플러시를 반복한 뒤 진행 중인 배치를 기다린다.
 */
@Slf4j
public class ShutdownDrain {

    private final BoundedLogQueue queue;
    private final BatchFlushScheduler scheduler;
    private final Duration drainInterval;

    public ShutdownDrain(BoundedLogQueue queue, BatchFlushScheduler scheduler, Duration drainInterval) {
        this.queue = queue;
        this.scheduler = scheduler;
        this.drainInterval = drainInterval;
    }

    /** 큐가 빌 때까지 플러시. 인터럽트 시 플래그 복원 후 남은 건수 로그 */
    public void drain() {
        int initial = queue.size();
        if (initial > 0) {
            log.info("Draining {} pending log entries", initial);
        }
        try {
            while (queue.size() > 0) {
                scheduler.flushBatch().join();
                Thread.sleep(drainInterval.toMillis());
            }
            scheduler.awaitIdle();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Drain interrupted, {} log entries remain in queue", queue.size());
            return;
        }
        if (initial > 0) {
            log.info("Drain completed");
        }
    }

    /**
     * pipeline.stop() 을 호출하는 JVM shutdown hook 등록. 등록된 스레드 반환.
     */
    public static Thread registerShutdownHook(AuditLogPipeline pipeline) {
        Thread hook = new Thread(pipeline::stop, "audit-log-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }
}
