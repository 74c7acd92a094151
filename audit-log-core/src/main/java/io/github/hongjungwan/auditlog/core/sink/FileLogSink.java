package io.github.hongjungwan.auditlog.core.sink;

import io.github.hongjungwan.auditlog.api.domain.AuditLogEntry;
import io.github.hongjungwan.auditlog.core.internal.AuditLogSerializer;
import io.github.hongjungwan.auditlog.spi.LogSink;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 일자별 로그 파일 싱크. {@code <logsDir>/YYYY-MM-DD.log} 에 엔트리당 JSON 한 줄 추가.
 */
@Slf4j
public class FileLogSink implements LogSink {

    public static final String LOG_FILE_SUFFIX = ".log";

    private final Path logsDirectory;
    private final AuditLogSerializer serializer;

    // 동시 배치의 라인이 섞이지 않도록 append 직렬화
    private final ReentrantLock appendLock = new ReentrantLock();

    public FileLogSink(String logsDirectory, AuditLogSerializer serializer) {
        this(Paths.get(logsDirectory), serializer);
    }

    public FileLogSink(Path logsDirectory, AuditLogSerializer serializer) {
        this.logsDirectory = logsDirectory;
        this.serializer = serializer;

        try {
            Files.createDirectories(logsDirectory);
        } catch (IOException e) {
            log.error("Failed to create logs directory: " + logsDirectory, e);
        }
    }

    @Override
    public String getName() {
        return "file";
    }

    @Override
    public boolean write(AuditLogEntry entry) {
        try {
            byte[] line = serializer.toJsonLine(entry).getBytes(StandardCharsets.UTF_8);
            Path file = resolveLogFile(entry.getTimestamp());

            appendLock.lock();
            try {
                Files.write(file, line, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } finally {
                appendLock.unlock();
            }
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to write log entry to file: {}", entry != null ? entry.getId() : null, e);
            return false;
        }
    }

    /** 엔트리 timestamp의 UTC 날짜 기준 파일 경로 */
    public Path resolveLogFile(Instant timestamp) {
        LocalDate date = LocalDate.ofInstant(timestamp != null ? timestamp : Instant.now(), ZoneOffset.UTC);
        return logsDirectory.resolve(date + LOG_FILE_SUFFIX);
    }

    /** 로그 디렉토리 최상위의 *.log 파일 목록 */
    public List<Path> listLogFiles() throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(logsDirectory, "*" + LOG_FILE_SUFFIX)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        }
        files.sort(null);
        return files;
    }

    public Path getLogsDirectory() {
        return logsDirectory;
    }
}
