package io.github.hongjungwan.auditlog.core.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.hongjungwan.auditlog.api.config.AuditLogConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 민감 필드 마스킹 처리기. 키 이름에 민감 문자열이 포함되면 값 전체를 마커로 치환.
 *
 * <p>입력 트리는 변경하지 않고 복사본을 반환한다.</p>
 */
@Slf4j
public class SensitiveDataRedactor {

    private final List<String> sensitiveFields;
    private final TextNode marker;
    private final ObjectMapper objectMapper;

    public SensitiveDataRedactor(AuditLogConfig config) {
        this(config.getSensitiveFields(), config.getRedactionMarker(), new ObjectMapper());
    }

    public SensitiveDataRedactor(List<String> sensitiveFields, String marker, ObjectMapper objectMapper) {
        List<String> normalized = new ArrayList<>(sensitiveFields.size());
        for (String field : sensitiveFields) {
            if (field != null && !field.isBlank()) {
                normalized.add(field.toLowerCase(Locale.ROOT));
            }
        }
        this.sensitiveFields = List.copyOf(normalized);
        this.marker = TextNode.valueOf(marker);
        this.objectMapper = objectMapper;
    }

    /**
     * JSON 트리 마스킹. null 입력은 null 반환.
     */
    public JsonNode redact(JsonNode value) {
        if (value == null) {
            return null;
        }
        JsonNode copy = value.deepCopy();
        redactInPlace(copy);
        return copy;
    }

    /**
     * 임의 객체를 트리로 변환 후 마스킹.
     */
    public JsonNode redactValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof JsonNode node) {
            return redact(node);
        }
        JsonNode tree = objectMapper.valueToTree(value);
        redactInPlace(tree);
        return tree;
    }

    /** 키가 민감 필드에 해당하는지 (소문자 부분 일치) */
    public boolean isSensitiveKey(String key) {
        if (key == null) {
            return false;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        for (String field : sensitiveFields) {
            if (lower.contains(field)) {
                return true;
            }
        }
        return false;
    }

    private void redactInPlace(JsonNode node) {
        if (node instanceof ObjectNode object) {
            List<String> hidden = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (isSensitiveKey(field.getKey())) {
                    hidden.add(field.getKey());
                } else {
                    redactInPlace(field.getValue());
                }
            }
            // 순회 중 수정 방지
            for (String key : hidden) {
                object.set(key, marker);
            }
        } else if (node instanceof ArrayNode array) {
            for (JsonNode element : array) {
                redactInPlace(element);
            }
        }
    }
}
