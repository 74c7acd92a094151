package io.github.hongjungwan.auditlog.core.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hongjungwan.auditlog.api.AuditLogPipeline;
import io.github.hongjungwan.auditlog.api.AuditLogPipeline.BatchResult;
import io.github.hongjungwan.auditlog.api.config.AuditLogConfig;
import io.github.hongjungwan.auditlog.api.domain.AuditLogEntry;
import io.github.hongjungwan.auditlog.api.domain.RequestMetadata;
import io.github.hongjungwan.auditlog.api.domain.ResponseMetadata;
import io.github.hongjungwan.auditlog.api.stats.PipelineStats;
import io.github.hongjungwan.auditlog.core.capture.RequestCapture;
import io.github.hongjungwan.auditlog.core.internal.AuditRecordBuilder;
import io.github.hongjungwan.auditlog.core.internal.DefaultAuditLogPipeline;
import io.github.hongjungwan.auditlog.spi.RecordFilter;
import io.github.hongjungwan.auditlog.spi.RecordStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 캡처 → 빌드 → 큐 → 배치 플러시 → 파일/Record Store 전체 흐름 테스트.
 */
@DisplayName("End-to-End 파이프라인 테스트")
class EndToEndTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private AuditLogPipeline pipeline;

    @AfterEach
    void tearDown() {
        if (pipeline != null) {
            pipeline.stop();
        }
    }

    /** 테스트용 메모리 저장소 */
    static class MapRecordStore implements RecordStore {
        final Map<String, AuditLogEntry> records = new ConcurrentHashMap<>();

        @Override
        public boolean insert(AuditLogEntry entry) {
            records.put(entry.getId(), entry);
            return true;
        }

        @Override
        public long count(RecordFilter filter) {
            return records.values().stream().filter(filter::matches).count();
        }

        @Override
        public long deleteMany(RecordFilter filter) {
            List<String> ids = records.values().stream().filter(filter::matches).map(AuditLogEntry::getId).toList();
            ids.forEach(records::remove);
            return ids.size();
        }
    }

    private AuditLogConfig.AuditLogConfigBuilder config() {
        return AuditLogConfig.builder()
                .logsDirectory(tempDir.toString())
                .flushInterval(Duration.ofHours(1))
                .drainInterval(Duration.ofMillis(10));
    }

    private List<String> logLines() throws IOException {
        try (var files = Files.list(tempDir)) {
            List<Path> logs = files.filter(p -> p.toString().endsWith(".log")).toList();
            assertThat(logs).hasSize(1);
            return Files.readAllLines(logs.get(0));
        }
    }

    @Nested
    @DisplayName("회원 가입 요청")
    class RegisterTests {

        @Test
        @DisplayName("POST /users/register 201 은 마스킹된 한 줄로 저장되어야 한다")
        void shouldPersistRedactedRegisterRequest() throws Exception {
            // given
            MapRecordStore store = new MapRecordStore();
            pipeline = new DefaultAuditLogPipeline(config().recordStoreEnabled(true).build(), store);
            pipeline.start();

            RequestCapture capture = new RequestCapture(mapper, Clock.systemUTC());
            capture.captureStructured(Map.of("id", 1, "name", "kim"));
            RequestMetadata request = RequestMetadata.builder()
                    .logId(capture.getLogId())
                    .startTimeMillis(capture.getStartTimeMillis())
                    .method("POST")
                    .path("/users/register")
                    .originalUrl("/users/register")
                    .ip("127.0.0.1")
                    .body(mapper.readTree("{\"name\":\"kim\",\"password\":\"hunter2\"}"))
                    .build();
            ResponseMetadata response = ResponseMetadata.builder()
                    .statusCode(201)
                    .statusMessage("Created")
                    .capturedBody(capture.getCapturedBody())
                    .build();

            // when
            AuditLogEntry entry = new AuditRecordBuilder(AuditLogConfig.defaultConfig()).build(request, response);
            pipeline.submit(entry);
            pipeline.stop();

            // then
            List<String> lines = logLines();
            assertThat(lines).hasSize(1);
            JsonNode line = mapper.readTree(lines.get(0));
            assertThat(line.get("id").asText()).isEqualTo(capture.getLogId());
            assertThat(line.get("status_code").asInt()).isEqualTo(201);
            assertThat(line.get("action").asText()).isEqualTo("create");
            assertThat(line.get("entity").asText()).isEqualTo("users");
            assertThat(line.at("/details/body/password").asText()).isEqualTo("***HIDDEN***");
            assertThat(line.get("error").isNull()).isTrue();
            assertThat(line.at("/response_body/name").asText()).isEqualTo("kim");

            assertThat(store.records).containsKey(capture.getLogId());
            assertThat(pipeline.queueSize()).isZero();
        }
    }

    @Nested
    @DisplayName("드레인")
    class DrainTests {

        @Test
        @DisplayName("stop 은 큐에 남은 모든 엔트리를 저장해야 한다")
        void shouldDrainAllOnStop() throws Exception {
            pipeline = new DefaultAuditLogPipeline(config().batchSize(7).build(), null);
            pipeline.start();

            for (int i = 0; i < 50; i++) {
                pipeline.submit(AuditLogEntry.builder()
                        .id("e" + i).timestamp(Instant.now()).method("GET").statusCode(200).build());
            }
            pipeline.stop();

            assertThat(pipeline.queueSize()).isZero();
            assertThat(logLines()).hasSize(50);
            assertThat(pipeline.isRunning()).isFalse();
        }

        @Test
        @DisplayName("stop 은 여러 번 호출해도 안전해야 한다")
        void stopShouldBeIdempotent() {
            pipeline = new DefaultAuditLogPipeline(config().build(), null);
            pipeline.start();

            pipeline.stop();
            pipeline.stop();

            assertThat(pipeline.isRunning()).isFalse();
        }

        @Test
        @DisplayName("stop 이후 submit 은 호출 스레드에서 바로 저장해야 한다")
        void submitAfterStopShouldWriteSynchronously() throws Exception {
            MapRecordStore store = new MapRecordStore();
            pipeline = new DefaultAuditLogPipeline(config().recordStoreEnabled(true).build(), store);
            pipeline.start();
            pipeline.stop();

            pipeline.submit(AuditLogEntry.builder().id("late").timestamp(Instant.now()).statusCode(200).build());

            assertThat(pipeline.queueSize()).isZero();
            assertThat(logLines()).hasSize(1);
            assertThat(store.records).containsKey("late");
        }
    }

    @Nested
    @DisplayName("운영 연산")
    class OperatorTests {

        @Test
        @DisplayName("수동 플러시 후 통계에 파일이 반영되어야 한다")
        void shouldReportStatsAfterFlush() throws Exception {
            pipeline = new DefaultAuditLogPipeline(config().build(), null);
            pipeline.start();
            pipeline.submit(AuditLogEntry.builder().id("s1").timestamp(Instant.now()).statusCode(200).build());

            long deadline = System.currentTimeMillis() + 5000;
            while (pipeline.queueSize() == 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
            }
            BatchResult result = pipeline.flushBatch().join();
            PipelineStats stats = pipeline.getStats();

            assertThat(result.dequeued()).isEqualTo(1);
            assertThat(result.fileWrites()).isEqualTo(1);
            assertThat(stats.queue().queueSize()).isZero();
            assertThat(stats.queue().maxQueueSize()).isEqualTo(1000);
            assertThat(stats.file().filesCount()).isEqualTo(1);
            assertThat(stats.database()).isZero();
            assertThat(stats.uptime()).isPositive();
        }

        @Test
        @DisplayName("잘못된 설정이면 생성 시 실패해야 한다")
        void shouldFailFastOnInvalidConfig() {
            AuditLogConfig invalid = config().batchSize(0).build();

            org.assertj.core.api.Assertions.assertThatThrownBy(() -> new DefaultAuditLogPipeline(invalid, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
