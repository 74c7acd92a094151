package io.github.hongjungwan.auditlog.core.retention;

import io.github.hongjungwan.auditlog.core.sink.FileLogSink;
import io.github.hongjungwan.auditlog.core.sink.RecordStoreSink;
import io.github.hongjungwan.auditlog.spi.RecordFilter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 보존 기간이 지난 일자별 로그 파일과 Record Store 레코드 삭제.
 */
@Slf4j
public class LogRetentionManager {

    private final FileLogSink fileSink;
    private final RecordStoreSink storeSink;
    private final Clock clock;

    public LogRetentionManager(FileLogSink fileSink, RecordStoreSink storeSink, Clock clock) {
        this.fileSink = fileSink;
        this.storeSink = storeSink;
        this.clock = clock;
    }

    /**
     * olderThanDays 보다 오래 수정되지 않은 *.log 파일 삭제. 삭제한 파일 수 반환.
     */
    public int cleanup(int olderThanDays) {
        if (olderThanDays < 0) {
            throw new IllegalArgumentException("olderThanDays must not be negative, got: " + olderThanDays);
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(olderThanDays));

        List<Path> files;
        try {
            files = fileSink.listLogFiles();
        } catch (IOException e) {
            log.error("Failed to list log files for cleanup", e);
            return 0;
        }

        int deleted = 0;
        for (Path file : files) {
            try {
                if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff)) {
                    Files.deleteIfExists(file);
                    deleted++;
                    log.debug("Deleted old log file: {}", file.getFileName());
                }
            } catch (IOException e) {
                log.error("Failed to delete log file: " + file, e);
            }
        }

        if (storeSink.isEnabled()) {
            try {
                long records = storeSink.deleteMany(RecordFilter.olderThan(cutoff));
                log.info("Deleted {} records older than {} days", records, olderThanDays);
            } catch (Exception e) {
                log.error("Failed to delete old records from record store", e);
            }
        }

        log.info("Cleanup completed: {} log files older than {} days deleted", deleted, olderThanDays);
        return deleted;
    }
}
