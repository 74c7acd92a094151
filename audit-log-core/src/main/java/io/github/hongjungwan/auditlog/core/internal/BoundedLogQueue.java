package io.github.hongjungwan.auditlog.core.internal;

import io.github.hongjungwan.auditlog.api.domain.AuditLogEntry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 고정 용량 FIFO 수집 큐. 가득 차면 가장 오래된 엔트리를 제거한다 (drop-oldest).
 *
 * <p>생산자(dispatcher)와 소비자(flush) 스레드가 다르므로 큐 자체 모니터로 보호.
 * 모든 임계 구역은 O(batch)이며 대기하지 않는다.</p>
 */
@Slf4j
public class BoundedLogQueue {

    private final Deque<AuditLogEntry> entries;
    private final int capacity;
    private long evictedCount;

    public BoundedLogQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Queue capacity must be positive, got: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /** 꼬리에 추가. 용량 초과 시 머리 엔트리 제거 후 WARN */
    public synchronized void enqueue(AuditLogEntry entry) {
        if (entry == null) {
            return;
        }
        if (entries.size() >= capacity) {
            AuditLogEntry evicted = entries.pollFirst();
            evictedCount++;
            log.warn("Log queue overflow, removing oldest entry: {}", evicted != null ? evicted.getId() : null);
        }
        entries.addLast(entry);
    }

    /** 머리에서 최대 maxCount개를 원자적으로 제거 */
    public synchronized List<AuditLogEntry> dequeueBatch(int maxCount) {
        int count = Math.min(maxCount, entries.size());
        if (count <= 0) {
            return List.of();
        }
        List<AuditLogEntry> batch = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            batch.add(entries.pollFirst());
        }
        return batch;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    public int capacity() {
        return capacity;
    }

    /** 누적 제거(overflow) 건수 */
    public synchronized long evictedCount() {
        return evictedCount;
    }
}
