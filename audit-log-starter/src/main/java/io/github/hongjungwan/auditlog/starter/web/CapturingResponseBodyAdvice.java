package io.github.hongjungwan.auditlog.starter.web;

import io.github.hongjungwan.auditlog.core.capture.RequestCapture;
import io.github.hongjungwan.auditlog.starter.security.AuditUserExtractor;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.MethodParameter;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * 컨트롤러 반환값을 메시지 변환 전에 캡처 (구조화 경로).
 *
 * <p>보안 컨텍스트가 아직 바인딩된 시점이므로 인증 사용자도 여기서 기록한다.</p>
 */
@ControllerAdvice
public class CapturingResponseBodyAdvice implements ResponseBodyAdvice<Object> {

    private final AuditUserExtractor userExtractor;

    public CapturingResponseBodyAdvice(AuditUserExtractor userExtractor) {
        this.userExtractor = userExtractor;
    }

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        return true;
    }

    @Override
    public Object beforeBodyWrite(Object body, MethodParameter returnType, MediaType selectedContentType,
                                  Class<? extends HttpMessageConverter<?>> selectedConverterType,
                                  ServerHttpRequest request, ServerHttpResponse response) {
        if (request instanceof ServletServerHttpRequest servletRequest) {
            HttpServletRequest httpRequest = servletRequest.getServletRequest();
            if (httpRequest.getAttribute(RequestCapture.ATTRIBUTE) instanceof RequestCapture capture) {
                if (body instanceof String text) {
                    capture.captureRaw(text);
                } else if (body != null && !(body instanceof byte[]) && !(body instanceof Resource)) {
                    capture.captureStructured(body);
                }
                capture.rememberUser(userExtractor.extractCurrentUser(httpRequest));
            }
        }
        return body;
    }
}
