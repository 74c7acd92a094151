package io.github.hongjungwan.auditlog.starter;

import io.github.hongjungwan.auditlog.api.config.AuditLogConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 감사 로그 설정 Properties (prefix: audit-log).
 */
@Data
@ConfigurationProperties(prefix = "audit-log")
public class AuditLogProperties {

    /** 감사 로그 활성화 여부 */
    private boolean enabled = true;

    /** 수집 큐 최대 크기 */
    private int maxQueueSize = 1000;

    /** 플러시 1회당 엔트리 수 */
    private int batchSize = 10;

    /** 배치 플러시 주기 */
    private Duration flushInterval = Duration.ofSeconds(5);

    /** 종료 시 드레인 반복 간격 */
    private Duration drainInterval = Duration.ofMillis(100);

    /** 싱크 쓰기 스레드 수 */
    private int sinkThreads = 2;

    /** 일자별 로그 파일 디렉토리 */
    private String logsDirectory = ".logs";

    /** cleanup 기본 보존 일수 */
    private int retentionDays = 30;

    /** Correlation ID 헤더명 */
    private String correlationHeader = "X-Correlation-ID";

    private RedactionProperties redaction = new RedactionProperties();

    private RecordStoreProperties recordStore = new RecordStoreProperties();

    private CaptureProperties capture = new CaptureProperties();

    private RetentionProperties retention = new RetentionProperties();

    @Data
    public static class RedactionProperties {
        private List<String> sensitiveFields = new ArrayList<>(AuditLogConfig.DEFAULT_SENSITIVE_FIELDS);
        private String marker = "***HIDDEN***";
    }

    @Data
    public static class RecordStoreProperties {
        /** Record Store (MongoDB) 싱크 활성화 여부 */
        private boolean enabled = false;

        /** 저장 컬렉션 */
        private String collection = "logs";
    }

    @Data
    public static class CaptureProperties {
        /** 캡처 필터 순서 */
        private int filterOrder = -100;

        /** 감사 대상에서 제외할 경로 (Ant 패턴) */
        private List<String> excludePatterns = new ArrayList<>(List.of("/actuator/**"));
    }

    @Data
    public static class RetentionProperties {
        /** 보존 정책 주기 실행 여부 */
        private boolean scheduleEnabled = false;
        private Duration interval = Duration.ofHours(24);
        private int fileDays = 7;
        private int archiveDays = 90;
        private boolean compressArchives = false;
        private int compressionLevel = 3;
        private int normalDays = 7;
        private int errorDays = 30;
        private int criticalDays = 90;
    }

    /** 코어 설정으로 변환 */
    public AuditLogConfig toConfig() {
        return AuditLogConfig.builder()
                .maxQueueSize(maxQueueSize)
                .batchSize(batchSize)
                .flushInterval(flushInterval)
                .drainInterval(drainInterval)
                .sinkThreads(sinkThreads)
                .logsDirectory(logsDirectory)
                .retentionDays(retentionDays)
                .recordStoreEnabled(recordStore.isEnabled())
                .sensitiveFields(List.copyOf(redaction.getSensitiveFields()))
                .redactionMarker(redaction.getMarker())
                .correlationHeader(correlationHeader)
                .fileRetentionDays(retention.getFileDays())
                .archiveRetentionDays(retention.getArchiveDays())
                .compressArchives(retention.isCompressArchives())
                .archiveCompressionLevel(retention.getCompressionLevel())
                .normalRecordRetentionDays(retention.getNormalDays())
                .errorRecordRetentionDays(retention.getErrorDays())
                .criticalRecordRetentionDays(retention.getCriticalDays())
                .retentionScheduleEnabled(retention.isScheduleEnabled())
                .retentionInterval(retention.getInterval())
                .build();
    }
}
