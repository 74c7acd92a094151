package io.github.hongjungwan.auditlog.api.stats;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 파이프라인 스냅샷: 큐, 파일, Record Store 건수, 가동 시간(초).
 */
public record PipelineStats(
        @JsonProperty("queue") QueueStats queue,
        @JsonProperty("file") FileStats file,
        @JsonProperty("database") long database,
        @JsonProperty("uptime") double uptime
) {
}
