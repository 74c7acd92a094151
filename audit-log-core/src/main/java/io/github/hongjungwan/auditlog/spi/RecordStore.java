package io.github.hongjungwan.auditlog.spi;

import io.github.hongjungwan.auditlog.api.domain.AuditLogEntry;

/**
 * 구조화 레코드 저장소 SPI. MongoDB 등 문서 DB 어댑터가 구현.
 *
 * <p>구현체는 여러 싱크 스레드에서 동시에 호출될 수 있다.</p>
 */
public interface RecordStore {

    /** 엔트리 1건 저장. 성공 여부 반환 */
    boolean insert(AuditLogEntry entry);

    /** 필터에 해당하는 레코드 수 */
    long count(RecordFilter filter);

    /** 필터에 해당하는 레코드 삭제. 삭제 건수 반환 */
    long deleteMany(RecordFilter filter);
}
