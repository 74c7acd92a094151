package io.github.hongjungwan.auditlog.api.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 요청 경로에서 유도되는 행위 분류. 직렬화 시 소문자.
 */
public enum ActionKind {
    CREATE,
    READ,
    UPDATE,
    DELETE,
    AUTH,
    SUBSCRIBE,
    UNSUBSCRIBE,
    UNKNOWN;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ActionKind fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        try {
            return ActionKind.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
