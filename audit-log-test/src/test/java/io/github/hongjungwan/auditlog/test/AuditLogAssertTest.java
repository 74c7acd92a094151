package io.github.hongjungwan.auditlog.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hongjungwan.auditlog.api.domain.ActionKind;
import io.github.hongjungwan.auditlog.api.domain.AuditLogEntry;
import io.github.hongjungwan.auditlog.api.domain.ErrorInfo;
import io.github.hongjungwan.auditlog.api.domain.RequestDetails;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static io.github.hongjungwan.auditlog.test.AuditLogAssert.assertThatEntry;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AuditLogAssert 테스트")
class AuditLogAssertTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private AuditLogEntry entry(int status, ErrorInfo error) throws Exception {
        return AuditLogEntry.builder()
                .id("0123456789abcdef")
                .timestamp(Instant.parse("2024-03-01T10:00:00Z"))
                .method("POST")
                .url("/users/register")
                .statusCode(status)
                .action(ActionKind.CREATE)
                .entity("users")
                .user("kim")
                .details(new RequestDetails(null, null,
                        mapper.readTree("{\"authorization\":\"***HIDDEN***\"}"),
                        mapper.readTree("{\"name\":\"kim\",\"credentials\":{\"password\":\"***HIDDEN***\"}}")))
                .responseBody(mapper.readTree("{\"id\":\"7\",\"token\":\"***HIDDEN***\"}"))
                .error(error)
                .build();
    }

    @Test
    @DisplayName("성공 엔트리의 모든 조건을 체이닝으로 통과해야 한다")
    void shouldPassForMatchingEntry() throws Exception {
        assertThatEntry(entry(201, null))
                .hasStatus(201)
                .hasAction(ActionKind.CREATE)
                .hasEntity("users")
                .hasUser("kim")
                .hasNoError()
                .hasRedactedHeader("authorization")
                .hasRedactedBodyField("/credentials/password")
                .hasRedactedResponseField("token")
                .hasResponseField("id", "7");
    }

    @Test
    @DisplayName("error 코드와 메시지를 검증해야 한다")
    void shouldVerifyError() throws Exception {
        assertThatEntry(entry(404, new ErrorInfo(404, "Not Found")))
                .hasError(404, "Not Found");
    }

    @Test
    @DisplayName("마스킹되지 않은 필드는 실패해야 한다")
    void shouldFailForUnredactedField() throws Exception {
        AuditLogEntry entry = entry(201, null);

        assertThatThrownBy(() -> assertThatEntry(entry).hasRedactedBodyField("name"))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("to be redacted");
    }

    @Test
    @DisplayName("상태 코드 불일치는 실패해야 한다")
    void shouldFailForWrongStatus() throws Exception {
        AuditLogEntry entry = entry(500, new ErrorInfo(500, "Internal Server Error"));

        assertThatThrownBy(() -> assertThatEntry(entry).hasStatus(200))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("<200>");
        assertThatThrownBy(() -> assertThatEntry(entry).hasNoError())
                .isInstanceOf(AssertionError.class);
    }

    @Test
    @DisplayName("null 엔트리는 실패해야 한다")
    void shouldFailForNullEntry() {
        assertThatThrownBy(() -> assertThatEntry(null).hasStatus(200))
                .isInstanceOf(AssertionError.class);
    }
}
