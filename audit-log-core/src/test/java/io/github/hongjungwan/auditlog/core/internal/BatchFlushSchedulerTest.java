package io.github.hongjungwan.auditlog.core.internal;

import io.github.hongjungwan.auditlog.api.AuditLogPipeline.BatchResult;
import io.github.hongjungwan.auditlog.api.domain.AuditLogEntry;
import io.github.hongjungwan.auditlog.spi.LogSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BatchFlushScheduler 테스트")
class BatchFlushSchedulerTest {

    private ExecutorService sinkExecutor;
    private BoundedLogQueue queue;

    @BeforeEach
    void setUp() {
        sinkExecutor = Executors.newFixedThreadPool(4);
        queue = new BoundedLogQueue(100);
    }

    @AfterEach
    void tearDown() {
        sinkExecutor.shutdownNow();
    }

    private static AuditLogEntry entry(String id) {
        return AuditLogEntry.builder().id(id).timestamp(Instant.now()).statusCode(200).build();
    }

    /** 기록만 하는 테스트 싱크 */
    static class RecordingSink implements LogSink {
        final List<String> written = new CopyOnWriteArrayList<>();
        private final boolean result;

        RecordingSink(boolean result) {
            this.result = result;
        }

        @Override
        public String getName() {
            return "recording";
        }

        @Override
        public boolean write(AuditLogEntry entry) {
            written.add(entry.getId());
            return result;
        }
    }

    /** latch 가 열릴 때까지 쓰기를 막는 싱크 */
    static class BlockingSink extends RecordingSink {
        final CountDownLatch release = new CountDownLatch(1);

        BlockingSink() {
            super(true);
        }

        @Override
        public boolean write(AuditLogEntry entry) {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return super.write(entry);
        }
    }

    @Nested
    @DisplayName("배치 처리")
    class BatchTests {

        @Test
        @DisplayName("최대 batchSize 건만 꺼내 두 싱크에 써야 한다")
        void shouldWriteAtMostBatchSize() {
            // given
            RecordingSink file = new RecordingSink(true);
            RecordingSink store = new RecordingSink(true);
            BatchFlushScheduler scheduler = new BatchFlushScheduler(queue, file, store, 10, sinkExecutor);
            for (int i = 0; i < 25; i++) {
                queue.enqueue(entry("e" + i));
            }

            // when
            BatchResult result = scheduler.flushBatch().join();

            // then
            assertThat(result.dequeued()).isEqualTo(10);
            assertThat(result.fileWrites()).isEqualTo(10);
            assertThat(result.storeWrites()).isEqualTo(10);
            assertThat(queue.size()).isEqualTo(15);
            assertThat(file.written).hasSize(10);
            assertThat(scheduler.isProcessing()).isFalse();
        }

        @Test
        @DisplayName("빈 큐는 no-op 이어야 한다")
        void shouldNoOpOnEmptyQueue() {
            RecordingSink file = new RecordingSink(true);
            BatchFlushScheduler scheduler = new BatchFlushScheduler(queue, file, new RecordingSink(true), 10, sinkExecutor);

            BatchResult result = scheduler.flushBatch().join();

            assertThat(result).isEqualTo(BatchResult.EMPTY);
            assertThat(file.written).isEmpty();
        }

        @Test
        @DisplayName("한 싱크의 예외는 다른 싱크 쓰기에 영향이 없어야 한다")
        void shouldIsolateSinkFailures() {
            LogSink failing = new LogSink() {
                @Override
                public String getName() {
                    return "failing";
                }

                @Override
                public boolean write(AuditLogEntry entry) {
                    throw new IllegalStateException("disk full");
                }
            };
            RecordingSink store = new RecordingSink(true);
            BatchFlushScheduler scheduler = new BatchFlushScheduler(queue, failing, store, 10, sinkExecutor);
            queue.enqueue(entry("a"));
            queue.enqueue(entry("b"));

            BatchResult result = scheduler.flushBatch().join();

            assertThat(result.fileWrites()).isZero();
            assertThat(result.storeWrites()).isEqualTo(2);
            assertThat(result.lost()).isZero();
        }

        @Test
        @DisplayName("두 싱크 모두 실패한 엔트리는 유실로 집계해야 한다")
        void shouldCountEntriesLostInBothSinks() {
            BatchFlushScheduler scheduler = new BatchFlushScheduler(queue,
                    new RecordingSink(false), new RecordingSink(false), 10, sinkExecutor);
            queue.enqueue(entry("x"));

            BatchResult result = scheduler.flushBatch().join();

            assertThat(result.lost()).isEqualTo(1);
            assertThat(queue.isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("single-flight")
    class SingleFlightTests {

        @Test
        @DisplayName("진행 중인 배치가 있으면 새 플러시는 건너뛰어야 한다")
        void shouldSkipWhileBatchInFlight() throws Exception {
            // given
            BlockingSink file = new BlockingSink();
            BatchFlushScheduler scheduler = new BatchFlushScheduler(queue, file, new RecordingSink(true), 2, sinkExecutor);
            for (int i = 0; i < 4; i++) {
                queue.enqueue(entry("e" + i));
            }

            // when
            CompletableFuture<BatchResult> first = scheduler.flushBatch();
            BatchResult second = scheduler.flushBatch().join();

            // then
            assertThat(second.skipped()).isTrue();
            assertThat(scheduler.isProcessing()).isTrue();
            assertThat(queue.size()).isEqualTo(2);

            file.release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS).dequeued()).isEqualTo(2);
            assertThat(scheduler.isProcessing()).isFalse();

            BatchResult third = scheduler.flushBatch().join();
            assertThat(third.dequeued()).isEqualTo(2);
        }

        @Test
        @DisplayName("awaitIdle 은 진행 중인 배치 완료까지 기다려야 한다")
        void shouldAwaitInFlightBatch() throws Exception {
            BlockingSink file = new BlockingSink();
            BatchFlushScheduler scheduler = new BatchFlushScheduler(queue, file, new RecordingSink(true), 5, sinkExecutor);
            queue.enqueue(entry("a"));
            scheduler.flushBatch();

            Thread releaser = new Thread(() -> {
                try {
                    Thread.sleep(100);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                file.release.countDown();
            });
            releaser.start();
            scheduler.awaitIdle();

            assertThat(file.written).containsExactly("a");
            assertThat(scheduler.isProcessing()).isFalse();
        }
    }

    @Test
    @DisplayName("주기 tick 이 큐를 비워야 한다")
    void shouldFlushOnTicks() throws Exception {
        // given
        ScheduledExecutorService ticker = Executors.newSingleThreadScheduledExecutor();
        RecordingSink file = new RecordingSink(true);
        BatchFlushScheduler scheduler = new BatchFlushScheduler(queue, file, new RecordingSink(true), 10, sinkExecutor);
        for (int i = 0; i < 15; i++) {
            queue.enqueue(entry("e" + i));
        }

        try {
            // when
            scheduler.start(ticker, Duration.ofMillis(20));
            long deadline = System.currentTimeMillis() + 5000;
            while (file.written.size() < 15 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }

            // then
            assertThat(file.written).hasSize(15);
            assertThat(queue.isEmpty()).isTrue();
        } finally {
            scheduler.stop();
            ticker.shutdownNow();
        }
    }
}
