package io.github.hongjungwan.auditlog.api.domain;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Map;

/**
 * 응답 메타데이터. 상태 코드, 상태 메시지, 헤더, 캡처된 본문.
 */
@Getter
@Builder
public class ResponseMetadata {

    private final int statusCode;

    /** 상태 메시지 (reason phrase). 없으면 null */
    private final String statusMessage;

    @Singular
    private final Map<String, String> headers;

    /** 캡처된 응답 본문 (마스킹 전) */
    private final JsonNode capturedBody;

    /** 헤더 조회 (대소문자 무시) */
    public String header(String name) {
        if (name == null || headers == null) {
            return null;
        }
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
