package io.github.hongjungwan.auditlog.api.config;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.util.List;

/**
 * 감사 로그 파이프라인 설정. 큐 크기, 배치, 플러시 주기, 싱크, 보존 정책 포함.
 */
@Getter
@Builder
public class AuditLogConfig {

    /** 기본 민감 필드 (키에 포함되면 마스킹) */
    public static final List<String> DEFAULT_SENSITIVE_FIELDS = List.of(
            "password", "token", "secret", "key", "authorization", "cookie", "set-cookie");

    /** 수집 큐 최대 크기. 초과 시 가장 오래된 엔트리 제거 */
    @Builder.Default
    private final int maxQueueSize = 1000;

    /** 플러시 1회당 처리 엔트리 수 */
    @Builder.Default
    private final int batchSize = 10;

    /** 배치 플러시 주기 */
    @Builder.Default
    private final Duration flushInterval = Duration.ofSeconds(5);

    /** 종료 시 드레인 반복 간격 */
    @Builder.Default
    private final Duration drainInterval = Duration.ofMillis(100);

    /** 싱크 쓰기 스레드 수 */
    @Builder.Default
    private final int sinkThreads = 2;

    /** 일자별 로그 파일 디렉토리 */
    @Builder.Default
    private final String logsDirectory = ".logs";

    /** cleanup() 기본 보존 일수 */
    @Builder.Default
    private final int retentionDays = 30;

    /** Record Store 싱크 활성화 */
    @Builder.Default
    private final boolean recordStoreEnabled = false;

    /** 마스킹 대상 키 (소문자 부분 일치) */
    @Builder.Default
    private final List<String> sensitiveFields = DEFAULT_SENSITIVE_FIELDS;

    /** 마스킹 치환 문자열 */
    @Builder.Default
    private final String redactionMarker = "***HIDDEN***";

    /** Correlation ID 헤더명 */
    @Builder.Default
    private final String correlationHeader = "X-Correlation-ID";

    /** 일자별 로그 파일을 archives/ 로 옮기기까지의 일수 */
    @Builder.Default
    private final int fileRetentionDays = 7;

    /** 아카이브 파일 삭제까지의 일수 */
    @Builder.Default
    private final int archiveRetentionDays = 90;

    /** 아카이브 Zstd 압축 여부 */
    @Builder.Default
    private final boolean compressArchives = false;

    /** 아카이브 Zstd 압축 레벨 (1-22) */
    @Builder.Default
    private final int archiveCompressionLevel = 3;

    /** Record Store 보존 일수: 정상 응답 (status < 400) */
    @Builder.Default
    private final int normalRecordRetentionDays = 7;

    /** Record Store 보존 일수: 클라이언트 오류 (400-499) */
    @Builder.Default
    private final int errorRecordRetentionDays = 30;

    /** Record Store 보존 일수: 서버 오류 (status >= 500) */
    @Builder.Default
    private final int criticalRecordRetentionDays = 90;

    /** 보존 정책 주기 실행 여부 */
    @Builder.Default
    private final boolean retentionScheduleEnabled = false;

    /** 보존 정책 실행 주기 */
    @Builder.Default
    private final Duration retentionInterval = Duration.ofHours(24);

    /** 설정값 검증. 잘못된 값이면 IllegalArgumentException */
    public AuditLogConfig validate() {
        requirePositive(maxQueueSize, "maxQueueSize");
        requirePositive(batchSize, "batchSize");
        requirePositive(sinkThreads, "sinkThreads");
        requirePositive(flushInterval, "flushInterval");
        requirePositive(drainInterval, "drainInterval");
        if (retentionScheduleEnabled) {
            requirePositive(retentionInterval, "retentionInterval");
        }
        if (logsDirectory == null || logsDirectory.isBlank()) {
            throw new IllegalArgumentException("logsDirectory must not be blank");
        }
        if (archiveCompressionLevel < 1 || archiveCompressionLevel > 22) {
            throw new IllegalArgumentException(
                    "Zstd compression level must be between 1 and 22, got: " + archiveCompressionLevel);
        }
        if (retentionDays < 0 || fileRetentionDays < 0 || archiveRetentionDays < 0) {
            throw new IllegalArgumentException("Retention days must not be negative");
        }
        return this;
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration, got: " + value);
        }
    }

    /** 개발용 기본 설정 */
    public static AuditLogConfig defaultConfig() {
        return AuditLogConfig.builder().build();
    }
}
