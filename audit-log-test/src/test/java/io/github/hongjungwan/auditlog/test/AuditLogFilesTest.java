package io.github.hongjungwan.auditlog.test;

import io.github.hongjungwan.auditlog.api.domain.AuditLogEntry;
import io.github.hongjungwan.auditlog.core.internal.AuditLogSerializer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AuditLogFiles 테스트")
class AuditLogFilesTest {

    @TempDir
    Path logsDir;

    private final AuditLogSerializer serializer = new AuditLogSerializer();

    @Test
    @DisplayName("일자별 파일의 NDJSON 라인을 엔트리로 읽어야 한다")
    void shouldReadDayFiles() throws Exception {
        // given
        AuditLogEntry first = AuditLogEntry.builder().id("a").statusCode(200)
                .timestamp(Instant.parse("2024-03-01T10:00:00Z")).build();
        AuditLogEntry second = AuditLogEntry.builder().id("b").statusCode(404)
                .timestamp(Instant.parse("2024-03-02T10:00:00Z")).build();
        Files.writeString(logsDir.resolve("2024-03-01.log"), serializer.toJsonLine(first));
        Files.writeString(logsDir.resolve("2024-03-02.log"), serializer.toJsonLine(second) + "\n");
        Files.writeString(logsDir.resolve("notes.txt"), "ignored");

        // when & then
        assertThat(AuditLogFiles.readDay(logsDir, LocalDate.of(2024, 3, 1)))
                .extracting(AuditLogEntry::getId).containsExactly("a");
        assertThat(AuditLogFiles.readAll(logsDir))
                .extracting(AuditLogEntry::getId).containsExactly("a", "b");
        assertThat(AuditLogFiles.readDay(logsDir, LocalDate.of(2024, 3, 3))).isEmpty();
    }
}
