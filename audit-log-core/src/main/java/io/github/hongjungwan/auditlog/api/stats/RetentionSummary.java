package io.github.hongjungwan.auditlog.api.stats;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * 보존 정책 실행 결과.
 */
public record RetentionSummary(
        @JsonProperty("files") CleanupResult files,
        @JsonProperty("database") CleanupResult database,
        @JsonProperty("executed_at") Instant executedAt
) {

    /** 단일 대상(파일 또는 Record Store) 정리 결과 */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CleanupResult(
            @JsonProperty("archived") Integer archived,
            @JsonProperty("deleted") long deleted,
            @JsonProperty("error") String error
    ) {

        public static CleanupResult files(int archived, int deleted) {
            return new CleanupResult(archived, deleted, null);
        }

        public static CleanupResult records(long deleted) {
            return new CleanupResult(null, deleted, null);
        }

        public static CleanupResult failed(String error) {
            return new CleanupResult(0, 0, error);
        }
    }
}
