package io.github.hongjungwan.auditlog.api.domain;

/**
 * 오류 응답 요약 (status >= 400 일 때만 채워짐).
 */
public record ErrorInfo(int code, String message) {
}
