package io.github.hongjungwan.auditlog.core.internal;

import io.github.hongjungwan.auditlog.api.AuditLogPipeline.BatchResult;
import io.github.hongjungwan.auditlog.api.domain.AuditLogEntry;
import io.github.hongjungwan.auditlog.spi.LogSink;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 주기적 배치 플러시. 큐에서 최대 batchSize개를 꺼내 엔트리마다 파일/Record Store 쓰기를 병렬 실행.
 *
 * <p>single-flight: 이전 배치의 모든 쓰기가 끝나기 전에는 새 배치를 시작하지 않는다.</p>
 */
@Slf4j
public class BatchFlushScheduler {

    private final BoundedLogQueue queue;
    private final LogSink fileSink;
    private final LogSink storeSink;
    private final int batchSize;
    private final Executor sinkExecutor;

    private final AtomicBoolean processing = new AtomicBoolean(false);
    private volatile CompletableFuture<BatchResult> inFlight = CompletableFuture.completedFuture(BatchResult.EMPTY);
    private ScheduledFuture<?> tickHandle;

    public BatchFlushScheduler(BoundedLogQueue queue, LogSink fileSink, LogSink storeSink,
                               int batchSize, Executor sinkExecutor) {
        this.queue = queue;
        this.fileSink = fileSink;
        this.storeSink = storeSink;
        this.batchSize = batchSize;
        this.sinkExecutor = sinkExecutor;
    }

    /** 고정 주기 tick 등록 */
    public synchronized void start(ScheduledExecutorService ticker, Duration interval) {
        if (tickHandle != null && !tickHandle.isDone()) {
            return;
        }
        long periodMillis = interval.toMillis();
        tickHandle = ticker.scheduleAtFixedRate(this::tick, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        log.debug("Batch flush scheduled every {} ms, batch size {}", periodMillis, batchSize);
    }

    /** 이후 tick 취소. 진행 중인 배치는 중단하지 않는다 */
    public synchronized void stop() {
        if (tickHandle != null) {
            tickHandle.cancel(false);
            tickHandle = null;
        }
    }

    private void tick() {
        try {
            flushBatch();
        } catch (RuntimeException e) {
            // 예외가 전파되면 scheduleAtFixedRate 가 이후 tick 을 멈춘다
            log.error("Unexpected error in batch flush tick", e);
        }
    }

    /**
     * 배치 1회 플러시. 진행 중이면 SKIPPED, 큐가 비어 있으면 EMPTY 즉시 완료.
     */
    public CompletableFuture<BatchResult> flushBatch() {
        if (!processing.compareAndSet(false, true)) {
            return CompletableFuture.completedFuture(BatchResult.SKIPPED);
        }

        // dequeue 전에 게시해야 큐가 비어 보이는 시점에 awaitIdle 이 이 배치를 기다린다
        CompletableFuture<BatchResult> pending = new CompletableFuture<>();
        inFlight = pending;

        List<AuditLogEntry> batch;
        try {
            batch = queue.dequeueBatch(batchSize);
        } catch (RuntimeException e) {
            settle(pending, BatchResult.EMPTY);
            throw e;
        }
        if (batch.isEmpty()) {
            settle(pending, BatchResult.EMPTY);
            return pending;
        }

        AtomicInteger fileWrites = new AtomicInteger();
        AtomicInteger storeWrites = new AtomicInteger();
        AtomicInteger lost = new AtomicInteger();

        List<CompletableFuture<Void>> attempts = new ArrayList<>(batch.size());
        for (AuditLogEntry entry : batch) {
            CompletableFuture<Boolean> file = attempt(fileSink, entry);
            CompletableFuture<Boolean> store = attempt(storeSink, entry);
            attempts.add(file.thenCombine(store, (fileOk, storeOk) -> {
                if (fileOk) {
                    fileWrites.incrementAndGet();
                }
                if (storeOk) {
                    storeWrites.incrementAndGet();
                }
                if (!fileOk && !storeOk) {
                    lost.incrementAndGet();
                    log.error("Failed to save log entry: {}", entry.getId());
                }
                return null;
            }));
        }

        CompletableFuture
                .allOf(attempts.toArray(new CompletableFuture[0]))
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        log.error("Unexpected error while settling batch", error);
                    }
                    settle(pending, new BatchResult(batch.size(), fileWrites.get(), storeWrites.get(), lost.get(), false));
                });
        return pending;
    }

    // 플래그 해제 후 완료
    private void settle(CompletableFuture<BatchResult> pending, BatchResult result) {
        processing.set(false);
        pending.complete(result);
    }

    private CompletableFuture<Boolean> attempt(LogSink sink, AuditLogEntry entry) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> sink.write(entry), sinkExecutor)
                    .exceptionally(e -> {
                        log.error("Sink '{}' failed for entry {}", sink.getName(), entry.getId(), e);
                        return false;
                    });
        } catch (RuntimeException e) {
            // executor 가 종료되어 작업을 거부한 경우
            log.error("Sink '{}' rejected entry {}", sink.getName(), entry.getId(), e);
            return CompletableFuture.completedFuture(false);
        }
    }

    /** 진행 중인 배치가 끝날 때까지 대기 */
    public void awaitIdle() throws InterruptedException {
        try {
            inFlight.get();
        } catch (ExecutionException e) {
            log.error("In-flight batch completed exceptionally", e.getCause());
        }
    }

    public boolean isProcessing() {
        return processing.get();
    }

    public int getBatchSize() {
        return batchSize;
    }
}
