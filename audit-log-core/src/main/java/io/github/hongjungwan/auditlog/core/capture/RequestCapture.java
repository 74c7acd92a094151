package io.github.hongjungwan.auditlog.core.capture;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.Charset;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 요청 1건의 캡처 상태. 엔트리 ID와 시작 시각을 발급하고 응답 본문을 정확히 한 번 캡처한다.
 *
 * <p>구조화 경로({@link #captureStructured(Object)})와 원문 경로({@link #captureRaw(String)}) 중
 * 먼저 호출된 쪽만 반영된다.</p>
 */
@Slf4j
public class RequestCapture {

    /** 요청 속성 키. 핸들러에서 현재 캡처 상태 조회용 */
    public static final String ATTRIBUTE = RequestCapture.class.getName();

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    private final ObjectMapper objectMapper;

    @Getter
    private final String logId;

    @Getter
    private final long startTimeMillis;

    private final AtomicReference<JsonNode> body = new AtomicReference<>();
    private final AtomicReference<String> user = new AtomicReference<>();

    public RequestCapture(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.logId = newLogId();
        this.startTimeMillis = clock.millis();
    }

    /** 16자리 hex 엔트리 ID 생성 (8 random bytes) */
    public static String newLogId() {
        byte[] bytes = new byte[8];
        RANDOM.nextBytes(bytes);
        return HEX.formatHex(bytes);
    }

    /**
     * 구조화 객체 캡처. 이미 캡처되었으면 false.
     */
    public boolean captureStructured(Object payload) {
        if (isCaptured()) {
            return false;
        }
        JsonNode node;
        try {
            node = payload == null ? JsonNodeFactory.instance.nullNode() : objectMapper.valueToTree(payload);
        } catch (IllegalArgumentException e) {
            log.debug("Response payload is not convertible to JSON, keeping text form", e);
            node = rawNode(String.valueOf(payload));
        }
        return body.compareAndSet(null, node);
    }

    /**
     * 원문 캡처. JSON이면 파싱, 아니면 {"raw": text}. 이미 캡처되었으면 false.
     */
    public boolean captureRaw(String text) {
        if (isCaptured() || text == null) {
            return false;
        }
        return body.compareAndSet(null, parseOrWrap(text));
    }

    public boolean captureRaw(byte[] bytes, Charset charset) {
        if (bytes == null || bytes.length == 0) {
            return false;
        }
        return captureRaw(new String(bytes, charset));
    }

    public boolean isCaptured() {
        return body.get() != null;
    }

    /** 캡처된 본문. 없으면 null */
    public JsonNode getCapturedBody() {
        return body.get();
    }

    /** 보안 컨텍스트가 살아있는 동안 확인한 사용자 ID 기록 */
    public void rememberUser(String userId) {
        if (userId != null) {
            user.compareAndSet(null, userId);
        }
    }

    public String getUser() {
        return user.get();
    }

    private JsonNode parseOrWrap(String text) {
        String trimmed = text.trim();
        if (!trimmed.isEmpty()) {
            try {
                return objectMapper.readTree(trimmed);
            } catch (JsonProcessingException e) {
                log.trace("Captured body is not JSON, storing as raw text");
            }
        }
        return rawNode(text);
    }

    private static ObjectNode rawNode(String text) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("raw", text);
        return node;
    }
}
