package io.github.hongjungwan.auditlog.spi;

import io.github.hongjungwan.auditlog.api.domain.AuditLogEntry;

/**
 * 감사 로그 저장 대상. 실패는 false로 보고하고 예외를 밖으로 던지지 않는다.
 */
public interface LogSink {

    /** 싱크 식별자 (로그 출력용) */
    String getName();

    /** 엔트리 1건 저장 */
    boolean write(AuditLogEntry entry);
}
