package io.github.hongjungwan.auditlog.starter.security;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;

import java.security.Principal;

/**
 * Spring Security 기반 사용자 추출기.
 *
 * SecurityContextHolder 에서 인증 사용자를 찾고, 없으면 요청의 Principal 을 사용.
 * Spring Security 는 선택 의존성이므로 리플렉션으로 접근한다.
 */
@Slf4j
public class SecurityContextUserExtractor implements AuditUserExtractor {

    private static final String ANONYMOUS_USER = "anonymousUser";

    private static final boolean SPRING_SECURITY_PRESENT = isSpringSecurityPresent();

    private static boolean isSpringSecurityPresent() {
        try {
            Class.forName("org.springframework.security.core.context.SecurityContextHolder");
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    @Override
    public String extractCurrentUser(HttpServletRequest request) {
        if (SPRING_SECURITY_PRESENT) {
            String user = extractFromSecurityContext();
            if (user != null) {
                return user;
            }
        }

        if (request != null) {
            Principal principal = request.getUserPrincipal();
            if (principal != null && principal.getName() != null && !ANONYMOUS_USER.equals(principal.getName())) {
                return principal.getName();
            }
        }
        return null;
    }

    private String extractFromSecurityContext() {
        try {
            Class<?> holder = Class.forName("org.springframework.security.core.context.SecurityContextHolder");
            Object securityContext = holder.getMethod("getContext").invoke(null);
            if (securityContext == null) {
                return null;
            }

            Object authentication = securityContext.getClass()
                    .getMethod("getAuthentication")
                    .invoke(securityContext);
            if (authentication == null) {
                return null;
            }

            Boolean authenticated = (Boolean) authentication.getClass()
                    .getMethod("isAuthenticated")
                    .invoke(authentication);
            if (!Boolean.TRUE.equals(authenticated)) {
                return null;
            }

            String name = (String) authentication.getClass()
                    .getMethod("getName")
                    .invoke(authentication);
            return name == null || ANONYMOUS_USER.equals(name) ? null : name;
        } catch (Exception e) {
            log.debug("Failed to extract user from SecurityContext: {}", e.getMessage());
            return null;
        }
    }
}
