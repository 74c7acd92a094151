package io.github.hongjungwan.auditlog.core.retention;

import com.github.luben.zstd.ZstdOutputStream;
import io.github.hongjungwan.auditlog.api.config.AuditLogConfig;
import io.github.hongjungwan.auditlog.api.stats.RetentionSummary;
import io.github.hongjungwan.auditlog.api.stats.RetentionSummary.CleanupResult;
import io.github.hongjungwan.auditlog.core.sink.FileLogSink;
import io.github.hongjungwan.auditlog.core.sink.RecordStoreSink;
import io.github.hongjungwan.auditlog.spi.RecordFilter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 계층형 보존 정책.
 *
 * <ul>
 *   <li>파일: fileRetentionDays 지난 일자별 로그를 archives/ 로 이동 (옵션: Zstd 압축),
 *       archiveRetentionDays 지난 아카이브 삭제</li>
 *   <li>Record Store: 상태 코드 등급별 보존 (정상 &lt; 400, 클라이언트 오류 400-499, 서버 오류 &gt;= 500)</li>
 * </ul>
 */
@Slf4j
public class RetentionPolicyExecutor {

    public static final String ARCHIVE_DIRECTORY = "archives";
    public static final String COMPRESSED_SUFFIX = ".zst";

    private final AuditLogConfig config;
    private final FileLogSink fileSink;
    private final RecordStoreSink storeSink;
    private final Clock clock;
    private final Path archiveDirectory;

    public RetentionPolicyExecutor(AuditLogConfig config, FileLogSink fileSink,
                                   RecordStoreSink storeSink, Clock clock) {
        this.config = config;
        this.fileSink = fileSink;
        this.storeSink = storeSink;
        this.clock = clock;
        this.archiveDirectory = fileSink.getLogsDirectory().resolve(ARCHIVE_DIRECTORY);
    }

    public RetentionSummary execute() {
        log.info("Executing log retention policy");
        CleanupResult files = cleanupFiles();
        CleanupResult records = cleanupRecords();
        RetentionSummary summary = new RetentionSummary(files, records, clock.instant());
        log.info("Retention policy completed: files={}, records={}", files, records);
        return summary;
    }

    CleanupResult cleanupFiles() {
        Instant now = clock.instant();
        Instant archiveCutoff = now.minus(Duration.ofDays(config.getFileRetentionDays()));
        Instant deleteCutoff = now.minus(Duration.ofDays(config.getArchiveRetentionDays()));

        try {
            Files.createDirectories(archiveDirectory);

            int archived = 0;
            for (Path file : fileSink.listLogFiles()) {
                FileTime modified = Files.getLastModifiedTime(file);
                if (modified.toInstant().isBefore(archiveCutoff)) {
                    try {
                        archive(file, modified);
                        archived++;
                    } catch (IOException e) {
                        log.error("Failed to archive log file: " + file, e);
                    }
                }
            }

            int deleted = 0;
            try (DirectoryStream<Path> archives = Files.newDirectoryStream(archiveDirectory)) {
                for (Path archive : archives) {
                    if (Files.isRegularFile(archive)
                            && Files.getLastModifiedTime(archive).toInstant().isBefore(deleteCutoff)) {
                        try {
                            Files.deleteIfExists(archive);
                            deleted++;
                        } catch (IOException e) {
                            log.error("Failed to delete archive: " + archive, e);
                        }
                    }
                }
            }

            log.info("File retention completed: {} archived, {} deleted", archived, deleted);
            return CleanupResult.files(archived, deleted);
        } catch (IOException e) {
            log.error("Failed to apply file retention policy", e);
            return CleanupResult.failed(e.getMessage());
        }
    }

    private void archive(Path file, FileTime modified) throws IOException {
        Path target = archiveDirectory.resolve(file.getFileName());
        if (!config.isCompressArchives()) {
            Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
            return;
        }

        Path compressed = archiveDirectory.resolve(file.getFileName() + COMPRESSED_SUFFIX);
        try (InputStream in = Files.newInputStream(file);
             OutputStream out = new ZstdOutputStream(Files.newOutputStream(compressed),
                     config.getArchiveCompressionLevel())) {
            in.transferTo(out);
        }
        // 아카이브 만료 판정이 원본 수정 시각 기준이 되도록 유지
        Files.setLastModifiedTime(compressed, modified);
        Files.delete(file);
    }

    CleanupResult cleanupRecords() {
        if (!storeSink.isEnabled()) {
            return CleanupResult.records(0);
        }
        Instant now = clock.instant();
        try {
            long deleted = 0;
            deleted += storeSink.deleteMany(RecordFilter.builder()
                    .timestampBefore(now.minus(Duration.ofDays(config.getNormalRecordRetentionDays())))
                    .maxStatusExclusive(400)
                    .build());
            deleted += storeSink.deleteMany(RecordFilter.builder()
                    .timestampBefore(now.minus(Duration.ofDays(config.getErrorRecordRetentionDays())))
                    .minStatus(400)
                    .maxStatusExclusive(500)
                    .build());
            deleted += storeSink.deleteMany(RecordFilter.builder()
                    .timestampBefore(now.minus(Duration.ofDays(config.getCriticalRecordRetentionDays())))
                    .minStatus(500)
                    .build());
            log.info("Record retention completed: {} records deleted", deleted);
            return CleanupResult.records(deleted);
        } catch (Exception e) {
            log.error("Failed to apply record retention policy", e);
            return CleanupResult.failed(e.getMessage());
        }
    }

    public Path getArchiveDirectory() {
        return archiveDirectory;
    }
}
