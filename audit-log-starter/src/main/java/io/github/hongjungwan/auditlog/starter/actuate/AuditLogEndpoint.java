package io.github.hongjungwan.auditlog.starter.actuate;

import io.github.hongjungwan.auditlog.api.AuditLogPipeline;
import io.github.hongjungwan.auditlog.api.stats.PipelineStats;
import io.github.hongjungwan.auditlog.api.stats.RetentionSummary;
import org.springframework.boot.actuate.endpoint.annotation.DeleteOperation;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.WriteOperation;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * 감사 로그 운영 엔드포인트 (/actuator/auditlog).
 *
 * <ul>
 *   <li>GET: 파이프라인 통계</li>
 *   <li>DELETE ?days=N: 오래된 로그 정리 (기본: retention-days)</li>
 *   <li>POST: 계층형 보존 정책 실행</li>
 * </ul>
 */
@Endpoint(id = "auditlog")
public class AuditLogEndpoint {

    private final AuditLogPipeline pipeline;
    private final int defaultRetentionDays;

    public AuditLogEndpoint(AuditLogPipeline pipeline, int defaultRetentionDays) {
        this.pipeline = pipeline;
        this.defaultRetentionDays = defaultRetentionDays;
    }

    @ReadOperation
    public PipelineStats stats() {
        return pipeline.getStats();
    }

    @DeleteOperation
    public Map<String, Object> cleanup(@Nullable Integer days) {
        int olderThan = days != null ? days : defaultRetentionDays;
        int deleted = pipeline.cleanup(olderThan);
        return Map.of("days", olderThan, "deleted_files", deleted);
    }

    @WriteOperation
    public RetentionSummary applyRetentionPolicy() {
        return pipeline.applyRetentionPolicy();
    }
}
