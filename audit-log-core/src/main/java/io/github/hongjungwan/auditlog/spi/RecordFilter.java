package io.github.hongjungwan.auditlog.spi;

import io.github.hongjungwan.auditlog.api.domain.AuditLogEntry;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * Record Store 조회/삭제 조건. null 필드는 조건 없음.
 */
@Getter
@Builder
public class RecordFilter {

    private static final RecordFilter ALL = RecordFilter.builder().build();

    /** timestamp &lt; timestampBefore */
    private final Instant timestampBefore;

    /** status_code &gt;= minStatus */
    private final Integer minStatus;

    /** status_code &lt; maxStatusExclusive */
    private final Integer maxStatusExclusive;

    public static RecordFilter all() {
        return ALL;
    }

    public static RecordFilter olderThan(Instant cutoff) {
        return RecordFilter.builder().timestampBefore(cutoff).build();
    }

    /** 메모리 구현체 및 테스트용 매칭 */
    public boolean matches(AuditLogEntry entry) {
        if (timestampBefore != null
                && (entry.getTimestamp() == null || !entry.getTimestamp().isBefore(timestampBefore))) {
            return false;
        }
        if (minStatus != null && entry.getStatusCode() < minStatus) {
            return false;
        }
        return maxStatusExclusive == null || entry.getStatusCode() < maxStatusExclusive;
    }

    @Override
    public String toString() {
        return "RecordFilter{timestampBefore=" + timestampBefore
                + ", minStatus=" + minStatus + ", maxStatusExclusive=" + maxStatusExclusive + "}";
    }
}
