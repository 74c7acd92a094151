package io.github.hongjungwan.auditlog.starter.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hongjungwan.auditlog.api.domain.RequestMetadata;
import io.github.hongjungwan.auditlog.api.domain.ResponseMetadata;
import io.github.hongjungwan.auditlog.core.capture.RequestCapture;
import io.github.hongjungwan.auditlog.starter.security.AuditUserExtractor;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.MultiValueMap;
import org.springframework.web.servlet.HandlerMapping;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.UriComponentsBuilder;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 서블릿 요청/응답에서 빌더 입력 메타데이터 추출.
 */
@Slf4j
public class ServletMetadataExtractor {

    private final ObjectMapper objectMapper;
    private final AuditUserExtractor userExtractor;

    public ServletMetadataExtractor(ObjectMapper objectMapper, AuditUserExtractor userExtractor) {
        this.objectMapper = objectMapper;
        this.userExtractor = userExtractor;
    }

    public RequestMetadata extractRequest(ContentCachingRequestWrapper request, RequestCapture capture) {
        String originalUrl = originalUrl(request);
        RequestMetadata.RequestMetadataBuilder builder = RequestMetadata.builder()
                .logId(capture.getLogId())
                .startTimeMillis(capture.getStartTimeMillis())
                .method(request.getMethod())
                .path(request.getRequestURI())
                .originalUrl(originalUrl)
                .hostname(request.getServerName())
                .route(attribute(request, HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE))
                .ip(clientIp(request))
                .headers(headers(request))
                .params(pathVariables(request))
                .query(queryParams(originalUrl))
                .body(requestBody(request))
                .user(user(request, capture))
                .sessionId(sessionId(request));
        return builder.build();
    }

    /**
     * 응답 메타데이터 추출. content 는 클라이언트로 복사하기 전에 보관한 응답 본문.
     */
    public ResponseMetadata extractResponse(HttpServletResponse response, byte[] content, RequestCapture capture) {
        int status = response.getStatus();
        HttpStatus httpStatus = HttpStatus.resolve(status);
        byte[] body = content != null ? content : new byte[0];

        ResponseMetadata.ResponseMetadataBuilder builder = ResponseMetadata.builder()
                .statusCode(status)
                .statusMessage(httpStatus != null ? httpStatus.getReasonPhrase() : null);

        boolean hasContentLength = false;
        for (String name : response.getHeaderNames()) {
            builder.header(name.toLowerCase(Locale.ROOT), String.join(", ", response.getHeaders(name)));
            hasContentLength |= "content-length".equalsIgnoreCase(name);
        }
        if (!hasContentLength) {
            builder.header("content-length", String.valueOf(body.length));
        }

        if (!capture.isCaptured()) {
            capture.captureRaw(body, charset(response.getCharacterEncoding()));
        }
        return builder.capturedBody(capture.getCapturedBody()).build();
    }

    private String user(HttpServletRequest request, RequestCapture capture) {
        if (capture.getUser() != null) {
            return capture.getUser();
        }
        return userExtractor != null ? userExtractor.extractCurrentUser(request) : null;
    }

    private static String originalUrl(HttpServletRequest request) {
        String query = request.getQueryString();
        return query == null ? request.getRequestURI() : request.getRequestURI() + "?" + query;
    }

    /** X-Forwarded-For 첫 번째 주소, 없으면 remoteAddr */
    static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    private static Map<String, String> headers(HttpServletRequest request) {
        Map<String, String> headers = new LinkedHashMap<>();
        Enumeration<String> names = request.getHeaderNames();
        while (names != null && names.hasMoreElements()) {
            String name = names.nextElement();
            headers.put(name.toLowerCase(Locale.ROOT), String.join(", ", Collections.list(request.getHeaders(name))));
        }
        return headers;
    }

    private ObjectNode pathVariables(HttpServletRequest request) {
        ObjectNode node = objectMapper.createObjectNode();
        Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (variables instanceof Map<?, ?> map) {
            map.forEach((key, value) -> node.put(String.valueOf(key), String.valueOf(value)));
        }
        return node;
    }

    private ObjectNode queryParams(String originalUrl) {
        ObjectNode node = objectMapper.createObjectNode();
        MultiValueMap<String, String> params = UriComponentsBuilder.fromUriString(originalUrl).build().getQueryParams();
        params.forEach((key, values) -> putValues(node, key, values));
        return node;
    }

    private JsonNode requestBody(ContentCachingRequestWrapper request) {
        String contentType = request.getContentType();
        if (contentType != null && contentType.toLowerCase(Locale.ROOT)
                .startsWith(MediaType.APPLICATION_FORM_URLENCODED_VALUE)) {
            ObjectNode node = objectMapper.createObjectNode();
            request.getParameterMap().forEach((key, values) -> putValues(node, key, List.of(values)));
            return node;
        }

        byte[] content = request.getContentAsByteArray();
        if (content.length == 0) {
            return null;
        }
        String text = new String(content, charset(request.getCharacterEncoding()));
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            ObjectNode raw = objectMapper.createObjectNode();
            raw.put("raw", text);
            return raw;
        }
    }

    private static void putValues(ObjectNode node, String key, Collection<String> values) {
        if (values == null || values.isEmpty()) {
            node.putNull(key);
        } else if (values.size() == 1) {
            node.put(key, values.iterator().next());
        } else {
            ArrayNode array = node.putArray(key);
            values.forEach(array::add);
        }
    }

    private static String sessionId(HttpServletRequest request) {
        HttpSession session = request.getSession(false);
        return session != null ? session.getId() : null;
    }

    private static String attribute(HttpServletRequest request, String name) {
        Object value = request.getAttribute(name);
        return value != null ? value.toString() : null;
    }

    private static Charset charset(String encoding) {
        if (encoding == null) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(encoding);
        } catch (IllegalArgumentException e) {
            log.debug("Unsupported character encoding '{}', using UTF-8", encoding);
            return StandardCharsets.UTF_8;
        }
    }
}
