package io.github.hongjungwan.auditlog.api.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * 요청/응답 1회에 대한 감사 로그 엔트리. 파일 한 줄 또는 Record Store 문서 하나로 저장.
 *
 * <p>생성 후 불변. JSON 트리 필드는 getter에서 복사본을 반환한다.</p>
 */
@Getter
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonDeserialize(builder = AuditLogEntry.AuditLogEntryBuilder.class)
public class AuditLogEntry {

    /** 엔트리 ID (16 hex chars) */
    private final String id;

    /** 엔트리 생성 시각 (응답 완료 시점) */
    private final Instant timestamp;

    private final String ip;

    private final String userAgent;

    /** 인증 사용자 ID (없으면 null) */
    private final String user;

    private final String method;

    private final String hostname;

    private final String url;

    /** 프레임워크가 매칭한 라우트 템플릿 */
    private final String route;

    private final int statusCode;

    private final ActionKind action;

    private final String entity;

    /** 처리 시간 (ms). 시작 시각이 없으면 null */
    private final Long executionTime;

    private final long requestSize;

    private final long responseSize;

    private final RequestDetails details;

    private final JsonNode responseBody;

    private final ErrorInfo error;

    private final String sessionId;

    private final String correlationId;

    public JsonNode getResponseBody() {
        return responseBody == null ? null : responseBody.deepCopy();
    }

    /** 오류 응답 여부 */
    @JsonIgnore
    public boolean isFailure() {
        return error != null;
    }

    @Override
    public String toString() {
        return "AuditLogEntry{id=" + id + ", method=" + method + ", url=" + url
                + ", status=" + statusCode + ", action=" + action + ", entity=" + entity + "}";
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class AuditLogEntryBuilder {

        public AuditLogEntryBuilder responseBody(JsonNode responseBody) {
            this.responseBody = responseBody == null ? null : responseBody.deepCopy();
            return this;
        }
    }
}
