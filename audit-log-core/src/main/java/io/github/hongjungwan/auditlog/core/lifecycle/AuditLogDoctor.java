package io.github.hongjungwan.auditlog.core.lifecycle;

import io.github.hongjungwan.auditlog.api.config.AuditLogConfig;
import io.github.hongjungwan.auditlog.spi.RecordFilter;
import io.github.hongjungwan.auditlog.spi.RecordStore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * 시작 시 자가 진단. 로그 디렉토리 쓰기, Record Store 연결, 큐/배치 크기 검사.
 *
 * <p>실패는 WARN 으로만 보고하고 시작을 막지 않는다.</p>
 */
@Slf4j
public class AuditLogDoctor {

    private final AuditLogConfig config;
    private final RecordStore recordStore;

    public AuditLogDoctor(AuditLogConfig config, RecordStore recordStore) {
        this.config = config;
        this.recordStore = recordStore;
    }

    /** 모든 진단 검사 실행 */
    public DiagnosticReport diagnose() {
        log.info("Running audit log diagnostic checks...");

        List<DiagnosticResult> results = new ArrayList<>();
        results.add(checkLogsDirectory());
        results.add(checkRecordStore());
        results.add(checkSizing());

        DiagnosticReport report = new DiagnosticReport(results);
        if (report.hasFailures()) {
            log.warn("Diagnostic failures detected:");
            report.getFailedChecks().forEach(result ->
                    log.warn("  - {}: {}", result.name(), result.message()));
        } else {
            log.info("All diagnostic checks passed successfully");
        }
        return report;
    }

    /** 검사 1: 로그 디렉토리 쓰기/읽기/삭제 */
    private DiagnosticResult checkLogsDirectory() {
        try {
            Path logsDir = Paths.get(config.getLogsDirectory());
            Files.createDirectories(logsDir);

            Path probe = logsDir.resolve(".audit-log-probe");
            Files.writeString(probe, "probe");
            String content = Files.readString(probe);
            Files.deleteIfExists(probe);

            if ("probe".equals(content)) {
                return DiagnosticResult.success("Logs Directory", "Logs directory writable: " + logsDir);
            }
            return DiagnosticResult.failure("Logs Directory", "Write verification failed");
        } catch (IOException | RuntimeException e) {
            return DiagnosticResult.failure("Logs Directory",
                    "Cannot write to logs directory: " + e.getMessage());
        }
    }

    /** 검사 2: Record Store 연결 */
    private DiagnosticResult checkRecordStore() {
        if (!config.isRecordStoreEnabled()) {
            return DiagnosticResult.success("Record Store", "Record store disabled");
        }
        if (recordStore == null) {
            return DiagnosticResult.failure("Record Store", "Record store enabled but not configured");
        }
        try {
            long count = recordStore.count(RecordFilter.all());
            return DiagnosticResult.success("Record Store", "Record store reachable, " + count + " records");
        } catch (Exception e) {
            return DiagnosticResult.failure("Record Store", "Record store unreachable: " + e.getMessage());
        }
    }

    /** 검사 3: 배치 크기 &lt;= 큐 용량 */
    private DiagnosticResult checkSizing() {
        if (config.getBatchSize() > config.getMaxQueueSize()) {
            return DiagnosticResult.warning("Queue Sizing",
                    "Batch size " + config.getBatchSize() + " exceeds queue capacity " + config.getMaxQueueSize());
        }
        return DiagnosticResult.success("Queue Sizing",
                "Queue capacity " + config.getMaxQueueSize() + ", batch size " + config.getBatchSize());
    }

    /** 진단 결과 */
    public record DiagnosticResult(String name, Status status, String message) {

        public enum Status {
            SUCCESS, WARNING, FAILURE
        }

        public static DiagnosticResult success(String name, String message) {
            return new DiagnosticResult(name, Status.SUCCESS, message);
        }

        public static DiagnosticResult warning(String name, String message) {
            return new DiagnosticResult(name, Status.WARNING, message);
        }

        public static DiagnosticResult failure(String name, String message) {
            return new DiagnosticResult(name, Status.FAILURE, message);
        }

        public boolean isFailure() {
            return status != Status.SUCCESS;
        }
    }

    /** 진단 리포트 */
    public static class DiagnosticReport {
        private final List<DiagnosticResult> results;

        public DiagnosticReport(List<DiagnosticResult> results) {
            this.results = List.copyOf(results);
        }

        public boolean hasFailures() {
            return results.stream().anyMatch(DiagnosticResult::isFailure);
        }

        public List<DiagnosticResult> getFailedChecks() {
            return results.stream()
                    .filter(DiagnosticResult::isFailure)
                    .toList();
        }

        public List<DiagnosticResult> getAllResults() {
            return results;
        }
    }
}
