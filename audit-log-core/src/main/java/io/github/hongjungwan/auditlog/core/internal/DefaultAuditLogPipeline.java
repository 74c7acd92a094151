package io.github.hongjungwan.auditlog.core.internal;

import io.github.hongjungwan.auditlog.api.AuditLogPipeline;
import io.github.hongjungwan.auditlog.api.config.AuditLogConfig;
import io.github.hongjungwan.auditlog.api.domain.AuditLogEntry;
import io.github.hongjungwan.auditlog.api.stats.PipelineStats;
import io.github.hongjungwan.auditlog.api.stats.RetentionSummary;
import io.github.hongjungwan.auditlog.core.lifecycle.ShutdownDrain;
import io.github.hongjungwan.auditlog.core.retention.LogRetentionManager;
import io.github.hongjungwan.auditlog.core.retention.RetentionPolicyExecutor;
import io.github.hongjungwan.auditlog.core.sink.FileLogSink;
import io.github.hongjungwan.auditlog.core.sink.RecordStoreSink;
import io.github.hongjungwan.auditlog.spi.RecordStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 기본 파이프라인 구현.
 *
 * <p>스레드 구성:</p>
 * <ul>
 *   <li>audit-log-dispatcher: 요청 스레드가 넘긴 엔트리를 큐에 넣는 유일한 생산자</li>
 *   <li>audit-log-flush: 주기 배치 플러시 tick</li>
 *   <li>audit-log-sink-N: 파일/Record Store 쓰기</li>
 *   <li>audit-log-maintenance: 보존 정책 주기 실행 (옵션)</li>
 * </ul>
 */
@Slf4j
public class DefaultAuditLogPipeline implements AuditLogPipeline {

    private static final long EXECUTOR_TIMEOUT_SECONDS = 5;

    private final AuditLogConfig config;

    private final BoundedLogQueue queue;
    private final FileLogSink fileSink;
    private final RecordStoreSink storeSink;
    private final BatchFlushScheduler scheduler;
    private final PipelineStatsReporter statsReporter;
    private final LogRetentionManager retentionManager;
    private final RetentionPolicyExecutor retentionPolicy;
    private final ShutdownDrain shutdownDrain;

    private final ExecutorService dispatcher;
    private final ExecutorService sinkExecutor;
    private final ScheduledExecutorService ticker;
    private final ScheduledExecutorService maintenance;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public DefaultAuditLogPipeline(AuditLogConfig config, RecordStore recordStore) {
        this(config, recordStore, Clock.systemUTC());
    }

    public DefaultAuditLogPipeline(AuditLogConfig config, RecordStore recordStore, Clock clock) {
        this.config = config.validate();

        AuditLogSerializer serializer = new AuditLogSerializer();
        this.queue = new BoundedLogQueue(config.getMaxQueueSize());
        this.fileSink = new FileLogSink(config.getLogsDirectory(), serializer);
        this.storeSink = new RecordStoreSink(recordStore, config.isRecordStoreEnabled());
        if (config.isRecordStoreEnabled() && recordStore == null) {
            log.warn("Record store enabled but no RecordStore provided; entries go to files only");
        }

        this.dispatcher = Executors.newSingleThreadExecutor(NamedThreadFactory.single("audit-log-dispatcher"));
        this.sinkExecutor = Executors.newFixedThreadPool(config.getSinkThreads(),
                NamedThreadFactory.pool("audit-log-sink"));
        this.ticker = Executors.newSingleThreadScheduledExecutor(NamedThreadFactory.single("audit-log-flush"));
        this.maintenance = config.isRetentionScheduleEnabled()
                ? Executors.newSingleThreadScheduledExecutor(NamedThreadFactory.single("audit-log-maintenance"))
                : null;

        this.scheduler = new BatchFlushScheduler(queue, fileSink, storeSink, config.getBatchSize(), sinkExecutor);
        this.statsReporter = new PipelineStatsReporter(queue, scheduler, fileSink, storeSink);
        this.retentionManager = new LogRetentionManager(fileSink, storeSink, clock);
        this.retentionPolicy = new RetentionPolicyExecutor(config, fileSink, storeSink, clock);
        this.shutdownDrain = new ShutdownDrain(queue, scheduler, config.getDrainInterval());
    }

    @Override
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("Pipeline already stopped");
        }
        if (running.compareAndSet(false, true)) {
            scheduler.start(ticker, config.getFlushInterval());
            if (maintenance != null) {
                long period = config.getRetentionInterval().toMillis();
                maintenance.scheduleAtFixedRate(this::runScheduledRetention, period, period, TimeUnit.MILLISECONDS);
            }
            log.info("Audit log pipeline started (queue: {}, batch: {}, interval: {}, logs: {}, record store: {})",
                    config.getMaxQueueSize(), config.getBatchSize(), config.getFlushInterval(),
                    config.getLogsDirectory(), storeSink.isEnabled() ? "enabled" : "disabled");
        }
    }

    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Audit log pipeline stopping...");

        scheduler.stop();
        ticker.shutdown();
        if (maintenance != null) {
            maintenance.shutdownNow();
        }

        // 대기 중인 enqueue 가 큐에 반영된 뒤 드레인
        dispatcher.shutdown();
        awaitTermination(dispatcher, "dispatcher");

        shutdownDrain.drain();

        sinkExecutor.shutdown();
        awaitTermination(sinkExecutor, "sink");

        running.set(false);
        log.info("Audit log pipeline stopped. Remaining: {}, evicted: {}", queue.size(), queue.evictedCount());
    }

    private void awaitTermination(ExecutorService executor, String name) {
        try {
            if (!executor.awaitTermination(EXECUTOR_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Timeout waiting for {} executor to terminate", name);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void submit(AuditLogEntry entry) {
        if (entry == null) {
            return;
        }
        if (stopped.get()) {
            writeDirectly(entry);
            return;
        }
        try {
            dispatcher.execute(() -> queue.enqueue(entry));
        } catch (RejectedExecutionException e) {
            writeDirectly(entry);
        }
    }

    // 종료 후에는 플러시가 없으므로 호출 스레드에서 바로 저장
    private void writeDirectly(AuditLogEntry entry) {
        log.warn("Pipeline stopped, writing entry {} synchronously", entry.getId());
        boolean fileOk = fileSink.write(entry);
        boolean storeOk = storeSink.write(entry);
        if (!fileOk && !storeOk) {
            log.error("Failed to save log entry: {}", entry.getId());
        }
    }

    @Override
    public CompletableFuture<BatchResult> flushBatch() {
        return scheduler.flushBatch();
    }

    @Override
    public void drain() {
        shutdownDrain.drain();
    }

    @Override
    public PipelineStats getStats() {
        return statsReporter.getStats();
    }

    @Override
    public int cleanup(int olderThanDays) {
        return retentionManager.cleanup(olderThanDays);
    }

    @Override
    public RetentionSummary applyRetentionPolicy() {
        return retentionPolicy.execute();
    }

    private void runScheduledRetention() {
        try {
            retentionPolicy.execute();
        } catch (RuntimeException e) {
            log.error("Scheduled retention policy failed", e);
        }
    }

    @Override
    public int queueSize() {
        return queue.size();
    }

    public FileLogSink getFileSink() {
        return fileSink;
    }

    public AuditLogConfig getConfig() {
        return config;
    }
}
