package io.github.hongjungwan.auditlog.api.domain;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Locale;
import java.util.Map;

/**
 * 프레임워크 어댑터가 채우는 요청 메타데이터. 빌더 입력값.
 */
@Getter
@Builder
public class RequestMetadata {

    /** 캡처 시작 시 발급된 엔트리 ID */
    private final String logId;

    /** 캡처 시작 시각 (epoch millis). 없으면 null */
    private final Long startTimeMillis;

    private final String method;

    /** 쿼리 문자열을 포함하지 않는 경로 */
    private final String path;

    /** 쿼리 문자열을 포함한 원본 URL */
    private final String originalUrl;

    private final String hostname;

    private final String route;

    private final String ip;

    /** 헤더 (이름은 소문자로 정규화) */
    @Singular
    private final Map<String, String> headers;

    private final JsonNode params;

    private final JsonNode query;

    private final JsonNode body;

    private final String user;

    private final String sessionId;

    /** 헤더 조회 (대소문자 무시) */
    public String header(String name) {
        if (name == null || headers == null) {
            return null;
        }
        String value = headers.get(name.toLowerCase(Locale.ROOT));
        if (value != null) {
            return value;
        }
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
