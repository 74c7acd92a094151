package io.github.hongjungwan.auditlog.core.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.hongjungwan.auditlog.api.domain.AuditLogEntry;

import java.util.Map;

/**
 * 감사 로그 엔트리 JSON 직렬화. 파일 한 줄(NDJSON)과 Record Store 문서 변환에 사용.
 */
public class AuditLogSerializer {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public AuditLogSerializer() {
        this.objectMapper = createObjectMapper();
    }

    /** 엔트리 직렬화 설정이 적용된 ObjectMapper 생성 */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /** 개행 종료 JSON 한 줄 */
    public String toJsonLine(AuditLogEntry entry) {
        return toJson(entry) + "\n";
    }

    public String toJson(AuditLogEntry entry) {
        try {
            return objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize log entry: " + entry.getId(), e);
        }
    }

    /** 문서 DB 저장용 Map 변환 (snake_case 키, ISO-8601 timestamp 문자열) */
    public Map<String, Object> toMap(AuditLogEntry entry) {
        try {
            return objectMapper.convertValue(entry, MAP_TYPE);
        } catch (IllegalArgumentException e) {
            throw new SerializationException("Failed to convert log entry: " + entry.getId(), e);
        }
    }

    public AuditLogEntry fromJson(String json) {
        try {
            return objectMapper.readValue(json, AuditLogEntry.class);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to deserialize log entry", e);
        }
    }

    public static class SerializationException extends RuntimeException {
        public SerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
