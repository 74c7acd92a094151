package io.github.hongjungwan.auditlog.core.classify;

import io.github.hongjungwan.auditlog.api.domain.ActionKind;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 요청 경로에서 행위(action)와 대상 엔티티(entity)를 유도하는 분류기.
 */
@Slf4j
public class RequestClassifier {

    public static final String UNKNOWN_ENTITY = "unknown";
    public static final String ERROR_ENTITY = "error";

    private static final Set<String> IGNORED_SEGMENTS = Set.of("api", "v1", "v2", "v3");

    // 선언 순서대로 검사, 첫 매칭 우선
    private static final Map<ActionKind, List<String>> ACTION_KEYWORDS = new LinkedHashMap<>();

    static {
        ACTION_KEYWORDS.put(ActionKind.CREATE, List.of("add", "create", "upload", "post", "register", "signup", "insert"));
        ACTION_KEYWORDS.put(ActionKind.READ, List.of("get", "fetch", "find", "search", "list", "show", "view"));
        ACTION_KEYWORDS.put(ActionKind.UPDATE, List.of("update", "modify", "edit", "patch", "put", "change"));
        ACTION_KEYWORDS.put(ActionKind.DELETE, List.of("delete", "del", "remove", "destroy", "clear"));
        ACTION_KEYWORDS.put(ActionKind.AUTH, List.of("login", "logout", "signin", "signout", "authenticate"));
        ACTION_KEYWORDS.put(ActionKind.SUBSCRIBE, List.of("subscribe", "follow", "join"));
        ACTION_KEYWORDS.put(ActionKind.UNSUBSCRIBE, List.of("unsubscribe", "unfollow", "leave"));
    }

    /**
     * 경로 문자열의 키워드로 행위 분류. 매칭 없으면 UNKNOWN.
     */
    public ActionKind classifyAction(String path) {
        if (path == null) {
            return ActionKind.UNKNOWN;
        }
        String lower = path.toLowerCase(Locale.ROOT);
        for (Map.Entry<ActionKind, List<String>> group : ACTION_KEYWORDS.entrySet()) {
            for (String keyword : group.getValue()) {
                if (lower.startsWith(keyword) || lower.contains(keyword)) {
                    return group.getKey();
                }
            }
        }
        return ActionKind.UNKNOWN;
    }

    /**
     * URL의 첫 의미 있는 경로 세그먼트 추출. api, v1-v3 세그먼트는 건너뛴다.
     */
    public String classifyEntity(String url) {
        try {
            String path = url;
            int queryStart = path.indexOf('?');
            if (queryStart >= 0) {
                path = path.substring(0, queryStart);
            }
            for (String segment : path.split("/")) {
                if (segment.isEmpty() || IGNORED_SEGMENTS.contains(segment.toLowerCase(Locale.ROOT))) {
                    continue;
                }
                return segment;
            }
            return UNKNOWN_ENTITY;
        } catch (RuntimeException e) {
            log.debug("Failed to extract entity from url: {}", url, e);
            return ERROR_ENTITY;
        }
    }
}
