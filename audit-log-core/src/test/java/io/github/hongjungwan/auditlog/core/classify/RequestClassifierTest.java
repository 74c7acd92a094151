package io.github.hongjungwan.auditlog.core.classify;

import io.github.hongjungwan.auditlog.api.domain.ActionKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RequestClassifier 테스트")
class RequestClassifierTest {

    private final RequestClassifier classifier = new RequestClassifier();

    @Nested
    @DisplayName("행위 분류")
    class ActionTests {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "/users/register, CREATE",
                "/users/list, READ",
                "/articles/edit/12, UPDATE",
                "/items/remove, DELETE",
                "/auth/login, AUTH",
                "/channels/follow, SUBSCRIBE",
                "/channels/leave, UNSUBSCRIBE",
                "/health, UNKNOWN",
                "GET /users, READ",
                "POST /users/create, CREATE",
                "DELETE /sessions, DELETE",
                "/foo/bar/zzz, UNKNOWN"
        })
        @DisplayName("경로 키워드로 행위를 분류해야 한다")
        void shouldClassifyByKeyword(String path, ActionKind expected) {
            assertThat(classifier.classifyAction(path)).isEqualTo(expected);
        }

        @Test
        @DisplayName("대소문자를 무시해야 한다")
        void shouldIgnoreCase() {
            assertThat(classifier.classifyAction("/Users/SIGNUP")).isEqualTo(ActionKind.CREATE);
        }

        @Test
        @DisplayName("선언 순서상 먼저인 그룹이 우선해야 한다")
        void shouldPreferEarlierGroup() {
            // "unsubscribe" 는 subscribe 그룹 키워드를 포함
            assertThat(classifier.classifyAction("/unsubscribe")).isEqualTo(ActionKind.SUBSCRIBE);
            // "post" (create) 가 "list" (read) 보다 먼저
            assertThat(classifier.classifyAction("/postlist")).isEqualTo(ActionKind.CREATE);
        }

        @Test
        @DisplayName("null 입력은 UNKNOWN")
        void shouldReturnUnknownForNull() {
            assertThat(classifier.classifyAction(null)).isEqualTo(ActionKind.UNKNOWN);
        }
    }

    @Nested
    @DisplayName("엔티티 추출")
    class EntityTests {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "/api/v1/users/42, users",
                "/api/v1/users/123, users",
                "/v2/orders?x=1, orders",
                "/API/V2/orders?page=1, orders",
                "/products, products",
                "/users/register, users",
                "/api/v3, unknown",
                "/, unknown",
                "'', unknown"
        })
        @DisplayName("첫 의미 있는 세그먼트를 반환해야 한다")
        void shouldExtractFirstMeaningfulSegment(String url, String expected) {
            assertThat(classifier.classifyEntity(url)).isEqualTo(expected);
        }

        @Test
        @DisplayName("null 입력은 error")
        void shouldReturnErrorForNull() {
            assertThat(classifier.classifyEntity(null)).isEqualTo("error");
        }
    }
}
