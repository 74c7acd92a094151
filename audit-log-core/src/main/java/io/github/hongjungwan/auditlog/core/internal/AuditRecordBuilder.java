package io.github.hongjungwan.auditlog.core.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hongjungwan.auditlog.api.config.AuditLogConfig;
import io.github.hongjungwan.auditlog.api.domain.ActionKind;
import io.github.hongjungwan.auditlog.api.domain.AuditLogEntry;
import io.github.hongjungwan.auditlog.api.domain.ErrorInfo;
import io.github.hongjungwan.auditlog.api.domain.RequestDetails;
import io.github.hongjungwan.auditlog.api.domain.RequestMetadata;
import io.github.hongjungwan.auditlog.api.domain.ResponseMetadata;
import io.github.hongjungwan.auditlog.core.capture.RequestCapture;
import io.github.hongjungwan.auditlog.core.classify.RequestClassifier;
import io.github.hongjungwan.auditlog.core.security.SensitiveDataRedactor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 요청/응답 메타데이터로 감사 로그 엔트리 생성.
 *
 * <p>예외를 던지지 않는다. 필드별로 추출 실패 시 기본값을 사용하고 DEBUG 로그를 남긴다.</p>
 */
@Slf4j
public class AuditRecordBuilder {

    public static final String UNKNOWN = "unknown";
    public static final String UNKNOWN_ERROR = "Unknown error";

    private final SensitiveDataRedactor redactor;
    private final RequestClassifier classifier;
    private final String correlationHeader;
    private final Clock clock;

    public AuditRecordBuilder(AuditLogConfig config) {
        this(new SensitiveDataRedactor(config), new RequestClassifier(), config.getCorrelationHeader(),
                Clock.systemUTC());
    }

    public AuditRecordBuilder(SensitiveDataRedactor redactor, RequestClassifier classifier,
                              String correlationHeader, Clock clock) {
        this.redactor = redactor;
        this.classifier = classifier;
        this.correlationHeader = correlationHeader;
        this.clock = clock;
    }

    /**
     * 감사 로그 엔트리 생성. 응답 완료 직후 요청 스레드에서 호출.
     */
    public AuditLogEntry build(RequestMetadata requestMetadata, ResponseMetadata responseMetadata) {
        if (requestMetadata == null || responseMetadata == null) {
            log.debug("Missing {} metadata, building entry from defaults",
                    requestMetadata == null ? "request" : "response");
        }
        RequestMetadata request = requestMetadata != null ? requestMetadata : RequestMetadata.builder().build();
        ResponseMetadata response = responseMetadata != null ? responseMetadata : ResponseMetadata.builder().build();

        long now = clock.millis();
        String id = guard("id", () -> request.getLogId() != null ? request.getLogId() : RequestCapture.newLogId(),
                RequestCapture.newLogId());
        int status = guard("statusCode", response::getStatusCode, 0);

        return AuditLogEntry.builder()
                .id(id)
                .timestamp(clock.instant())
                .ip(guard("ip", () -> orDefault(request.getIp(), UNKNOWN), UNKNOWN))
                .userAgent(guard("userAgent", () -> orDefault(request.header("user-agent"), UNKNOWN), UNKNOWN))
                .user(guard("user", request::getUser, null))
                .method(guard("method", () -> upperCase(request.getMethod()), null))
                .hostname(guard("hostname", request::getHostname, null))
                .url(guard("url", request::getOriginalUrl, null))
                .route(guard("route", request::getRoute, null))
                .statusCode(status)
                .action(guard("action", () -> classifier.classifyAction(request.getPath()), ActionKind.UNKNOWN))
                .entity(guard("entity", () -> classifier.classifyEntity(request.getOriginalUrl()),
                        RequestClassifier.ERROR_ENTITY))
                .executionTime(guard("executionTime", () -> executionTime(request, now), null))
                .requestSize(guard("requestSize", () -> contentLength(request.header("content-length")), 0L))
                .responseSize(guard("responseSize", () -> contentLength(response.header("content-length")), 0L))
                .details(guard("details", () -> details(request), RequestDetails.empty()))
                .responseBody(guard("responseBody", () -> redactOrEmpty(response.getCapturedBody()), emptyObject()))
                .error(guard("error", () -> error(response, status), null))
                .sessionId(guard("sessionId", request::getSessionId, null))
                .correlationId(guard("correlationId", () -> orDefault(request.header(correlationHeader), id), id))
                .build();
    }

    private RequestDetails details(RequestMetadata request) {
        return new RequestDetails(
                redactPart("params", request.getParams()),
                redactPart("query", request.getQuery()),
                redactPart("headers", headersTree(request.getHeaders())),
                redactPart("body", request.getBody()));
    }

    // 파트별 독립 마스킹. 한 파트 실패가 다른 파트에 영향 없음
    private JsonNode redactPart(String part, JsonNode node) {
        return guard(part, () -> redactOrEmpty(node), emptyObject());
    }

    private JsonNode redactOrEmpty(JsonNode node) {
        JsonNode redacted = redactor.redact(node);
        return redacted == null || redacted.isMissingNode() ? emptyObject() : redacted;
    }

    private static JsonNode headersTree(Map<String, String> headers) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        if (headers != null) {
            headers.forEach(node::put);
        }
        return node;
    }

    private static Long executionTime(RequestMetadata request, long now) {
        Long start = request.getStartTimeMillis();
        return start == null ? null : now - start;
    }

    private static ErrorInfo error(ResponseMetadata response, int status) {
        if (status < 400) {
            return null;
        }
        String message = response.getStatusMessage();
        return new ErrorInfo(status, message == null || message.isBlank() ? UNKNOWN_ERROR : message);
    }

    private static long contentLength(String value) {
        if (value == null || value.isBlank()) {
            return 0L;
        }
        return Long.parseLong(value.trim());
    }

    private static String upperCase(String value) {
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static ObjectNode emptyObject() {
        return JsonNodeFactory.instance.objectNode();
    }

    private static <T> T guard(String field, Supplier<T> extractor, T fallback) {
        try {
            return extractor.get();
        } catch (RuntimeException e) {
            log.debug("Failed to extract field '{}', using default: {}", field, e.toString());
            return fallback;
        }
    }
}
