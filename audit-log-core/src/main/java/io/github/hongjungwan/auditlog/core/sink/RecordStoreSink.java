package io.github.hongjungwan.auditlog.core.sink;

import io.github.hongjungwan.auditlog.api.domain.AuditLogEntry;
import io.github.hongjungwan.auditlog.spi.LogSink;
import io.github.hongjungwan.auditlog.spi.RecordFilter;
import io.github.hongjungwan.auditlog.spi.RecordStore;
import lombok.extern.slf4j.Slf4j;

/**
 * Record Store 싱크. 비활성화되었거나 저장소가 없으면 모든 연산이 no-op.
 */
@Slf4j
public class RecordStoreSink implements LogSink {

    private final RecordStore store;
    private final boolean enabled;

    public RecordStoreSink(RecordStore store, boolean enabled) {
        this.store = store;
        this.enabled = enabled && store != null;
    }

    @Override
    public String getName() {
        return "record-store";
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public boolean write(AuditLogEntry entry) {
        if (!enabled) {
            return false;
        }
        try {
            return store.insert(entry);
        } catch (Exception e) {
            log.error("Failed to insert log entry into record store: {}", entry != null ? entry.getId() : null, e);
            return false;
        }
    }

    /** 전체 레코드 수. 비활성화 시 0 */
    public long count() {
        return enabled ? store.count(RecordFilter.all()) : 0L;
    }

    /** 조건에 맞는 레코드 삭제. 비활성화 시 0 */
    public long deleteMany(RecordFilter filter) {
        return enabled ? store.deleteMany(filter) : 0L;
    }
}
