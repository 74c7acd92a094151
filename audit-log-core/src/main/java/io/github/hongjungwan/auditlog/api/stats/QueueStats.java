package io.github.hongjungwan.auditlog.api.stats;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 수집 큐 상태.
 */
public record QueueStats(
        @JsonProperty("queue_size") int queueSize,
        @JsonProperty("max_queue_size") int maxQueueSize,
        @JsonProperty("is_processing") boolean processing,
        @JsonProperty("batch_size") int batchSize,
        @JsonProperty("evicted") long evicted
) {
}
