package io.github.hongjungwan.auditlog.core.internal;

import io.github.hongjungwan.auditlog.api.stats.FileStats;
import io.github.hongjungwan.auditlog.api.stats.PipelineStats;
import io.github.hongjungwan.auditlog.api.stats.QueueStats;
import io.github.hongjungwan.auditlog.core.sink.FileLogSink;
import io.github.hongjungwan.auditlog.core.sink.RecordStoreSink;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * 파이프라인 상태 스냅샷 생성 (큐, 로그 파일, Record Store, 가동 시간).
 */
@Slf4j
public class PipelineStatsReporter {

    private final BoundedLogQueue queue;
    private final BatchFlushScheduler scheduler;
    private final FileLogSink fileSink;
    private final RecordStoreSink storeSink;
    private final LongSupplier uptimeMillis;

    public PipelineStatsReporter(BoundedLogQueue queue, BatchFlushScheduler scheduler,
                                 FileLogSink fileSink, RecordStoreSink storeSink) {
        this(queue, scheduler, fileSink, storeSink, () -> ManagementFactory.getRuntimeMXBean().getUptime());
    }

    PipelineStatsReporter(BoundedLogQueue queue, BatchFlushScheduler scheduler,
                          FileLogSink fileSink, RecordStoreSink storeSink, LongSupplier uptimeMillis) {
        this.queue = queue;
        this.scheduler = scheduler;
        this.fileSink = fileSink;
        this.storeSink = storeSink;
        this.uptimeMillis = uptimeMillis;
    }

    /** 상태 스냅샷. 예상치 못한 실패 시 ERROR 로그 후 null */
    public PipelineStats getStats() {
        try {
            QueueStats queueStats = new QueueStats(
                    queue.size(),
                    queue.capacity(),
                    scheduler.isProcessing(),
                    scheduler.getBatchSize(),
                    queue.evictedCount());
            return new PipelineStats(queueStats, fileStats(), storeSink.count(), uptimeMillis.getAsLong() / 1000.0);
        } catch (Exception e) {
            log.error("Failed to collect pipeline stats", e);
            return null;
        }
    }

    private FileStats fileStats() {
        try {
            List<Path> files = fileSink.listLogFiles();
            long totalSize = 0;
            for (Path file : files) {
                totalSize += Files.size(file);
            }
            return FileStats.of(files.size(), totalSize);
        } catch (IOException e) {
            log.warn("Failed to read log files in {}: {}", fileSink.getLogsDirectory(), e.toString());
            return FileStats.failed("Unable to read log files");
        }
    }
}
