package io.github.hongjungwan.auditlog.starter.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hongjungwan.auditlog.api.AuditLogPipeline;
import io.github.hongjungwan.auditlog.api.domain.AuditLogEntry;
import io.github.hongjungwan.auditlog.core.capture.RequestCapture;
import io.github.hongjungwan.auditlog.core.internal.AuditRecordBuilder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.time.Clock;
import java.util.List;

/**
 * 요청/응답 캡처 필터. 응답 완료 후 감사 로그 엔트리를 만들어 파이프라인에 제출한다.
 *
 * <p>클라이언트로 나가는 응답 본문은 변경하지 않는다.</p>
 */
@Slf4j
public class AuditCaptureFilter extends OncePerRequestFilter {

    private final AuditLogPipeline pipeline;
    private final AuditRecordBuilder recordBuilder;
    private final ServletMetadataExtractor metadataExtractor;
    private final ObjectMapper objectMapper;
    private final List<String> excludePatterns;
    private final Clock clock;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public AuditCaptureFilter(AuditLogPipeline pipeline, AuditRecordBuilder recordBuilder,
                              ServletMetadataExtractor metadataExtractor, ObjectMapper objectMapper,
                              List<String> excludePatterns, Clock clock) {
        this.pipeline = pipeline;
        this.recordBuilder = recordBuilder;
        this.metadataExtractor = metadataExtractor;
        this.objectMapper = objectMapper;
        this.excludePatterns = excludePatterns != null ? List.copyOf(excludePatterns) : List.of();
        this.clock = clock;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        for (String pattern : excludePatterns) {
            if (pathMatcher.match(pattern, path)) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        ContentCachingRequestWrapper requestWrapper = new ContentCachingRequestWrapper(request);
        ContentCachingResponseWrapper responseWrapper = new ContentCachingResponseWrapper(response);

        RequestCapture capture = new RequestCapture(objectMapper, clock);
        requestWrapper.setAttribute(RequestCapture.ATTRIBUTE, capture);

        boolean completed = false;
        try {
            chain.doFilter(requestWrapper, responseWrapper);
            completed = true;
        } finally {
            // copyBodyToResponse 후에는 캐시가 비워진다
            byte[] content = responseWrapper.getContentAsByteArray();
            try {
                responseWrapper.copyBodyToResponse();
                if (completed) {
                    response.flushBuffer();
                }
            } finally {
                submitEntry(requestWrapper, response, content, capture);
            }
        }
    }

    private void submitEntry(ContentCachingRequestWrapper request, HttpServletResponse response, byte[] content,
                             RequestCapture capture) {
        AuditLogEntry entry = buildEntry(request, response, content, capture);
        if (entry != null) {
            pipeline.submit(entry);
            log.debug("{} | {} | {} | {} | {}ms", entry.getId(), entry.getMethod(), entry.getUrl(),
                    entry.getStatusCode(), entry.getExecutionTime());
        }
    }

    private AuditLogEntry buildEntry(ContentCachingRequestWrapper request, HttpServletResponse response,
                                     byte[] content, RequestCapture capture) {
        try {
            return recordBuilder.build(
                    metadataExtractor.extractRequest(request, capture),
                    metadataExtractor.extractResponse(response, content, capture));
        } catch (RuntimeException | StackOverflowError e) {
            // 마스킹은 재귀 순회이므로 깊은 본문에서 StackOverflowError 가능
            log.error("Failed to build audit log entry: {}", capture.getLogId(), e);
            return null;
        }
    }
}
