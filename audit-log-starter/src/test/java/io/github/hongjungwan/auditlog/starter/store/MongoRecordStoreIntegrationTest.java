package io.github.hongjungwan.auditlog.starter.store;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.github.hongjungwan.auditlog.api.domain.ActionKind;
import io.github.hongjungwan.auditlog.api.domain.AuditLogEntry;
import io.github.hongjungwan.auditlog.api.domain.ErrorInfo;
import io.github.hongjungwan.auditlog.core.internal.AuditLogSerializer;
import io.github.hongjungwan.auditlog.spi.RecordFilter;
import org.bson.Document;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * MongoDB 컨테이너 기반 통합 테스트. Docker 가 없으면 건너뛴다.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("MongoRecordStore 통합 테스트")
class MongoRecordStoreIntegrationTest {

    private static final Instant NOW = Instant.parse("2024-03-10T00:00:00Z");

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private MongoClient client;
    private MongoTemplate template;
    private MongoRecordStore store;

    @BeforeEach
    void setUp() {
        client = MongoClients.create(MONGO.getReplicaSetUrl());
        template = new MongoTemplate(client, "audit_test");
        template.dropCollection("logs");
        store = new MongoRecordStore(template, new AuditLogSerializer(), "logs");
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    private static AuditLogEntry entry(String id, int status, Instant timestamp) {
        return AuditLogEntry.builder()
                .id(id)
                .timestamp(timestamp)
                .method("GET")
                .url("/users/" + id)
                .statusCode(status)
                .action(ActionKind.READ)
                .entity("users")
                .error(status >= 400 ? new ErrorInfo(status, "failed") : null)
                .build();
    }

    @Test
    @DisplayName("엔트리를 snake_case 문서로 저장하고 timestamp 는 날짜 타입이어야 한다")
    void shouldInsertDocument() {
        store.insert(entry("a1", 200, NOW));

        Document document = template.getCollection("logs").find().first();

        assertThat(document).isNotNull();
        assertThat(document.getString("id")).isEqualTo("a1");
        assertThat(document.getInteger("status_code")).isEqualTo(200);
        assertThat(document.get("timestamp")).isInstanceOf(Date.class);
        assertThat(store.count(RecordFilter.all())).isEqualTo(1);
    }

    @Test
    @DisplayName("상태 코드 계층과 timestamp 로 삭제해야 한다")
    void shouldDeleteByTier() {
        Instant old = NOW.minus(40, ChronoUnit.DAYS);
        store.insert(entry("ok-old", 200, old));
        store.insert(entry("client-old", 404, old));
        store.insert(entry("server-old", 503, old));
        store.insert(entry("client-new", 404, NOW));

        RecordFilter clientErrors = RecordFilter.builder()
                .timestampBefore(NOW.minus(30, ChronoUnit.DAYS))
                .minStatus(400)
                .maxStatusExclusive(500)
                .build();

        assertThat(store.deleteMany(clientErrors)).isEqualTo(1);
        assertThat(store.count(RecordFilter.all())).isEqualTo(3);
        assertThat(store.deleteMany(RecordFilter.olderThan(NOW.minus(1, ChronoUnit.DAYS)))).isEqualTo(2);
        assertThat(store.count(RecordFilter.all())).isEqualTo(1);
    }
}
