package io.github.hongjungwan.auditlog.api;

import io.github.hongjungwan.auditlog.api.domain.AuditLogEntry;
import io.github.hongjungwan.auditlog.api.stats.PipelineStats;
import io.github.hongjungwan.auditlog.api.stats.RetentionSummary;

import java.util.concurrent.CompletableFuture;

/**
 * 감사 로그 파이프라인. 프로세스당 하나를 명시적으로 생성하고 필요한 곳에 전달한다.
 *
 * <p>생명주기: {@link #start()} 후 {@link #submit(AuditLogEntry)}로 엔트리를 넣고,
 * 종료 시 {@link #stop()}이 큐를 모두 비운 뒤 반환한다.</p>
 */
public interface AuditLogPipeline {

    /** 주기 플러시 시작 */
    void start();

    /** 주기 플러시 중단 후 큐 드레인. 여러 번 호출해도 안전 */
    void stop();

    boolean isRunning();

    /** 엔트리 제출. 호출 스레드를 블로킹하지 않는다 */
    void submit(AuditLogEntry entry);

    /** 배치 1회 플러시 (진행 중이면 no-op) */
    CompletableFuture<BatchResult> flushBatch();

    /** 큐가 빌 때까지 플러시 반복 */
    void drain();

    /** 상태 스냅샷. 실패 시 null */
    PipelineStats getStats();

    /** olderThanDays 보다 오래된 로그 파일과 레코드 삭제. 삭제한 파일 수 반환 */
    int cleanup(int olderThanDays);

    /** 계층형 보존 정책 실행 (아카이브 + 상태별 레코드 삭제) */
    RetentionSummary applyRetentionPolicy();

    int queueSize();

    /** 배치 플러시 결과 */
    record BatchResult(int dequeued, int fileWrites, int storeWrites, int lost, boolean skipped) {

        public static final BatchResult SKIPPED = new BatchResult(0, 0, 0, 0, true);
        public static final BatchResult EMPTY = new BatchResult(0, 0, 0, 0, false);
    }
}
