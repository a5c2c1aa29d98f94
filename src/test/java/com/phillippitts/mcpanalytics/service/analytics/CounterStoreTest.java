package com.phillippitts.mcpanalytics.service.analytics;

import com.phillippitts.mcpanalytics.domain.AnalyticsSnapshot;
import com.phillippitts.mcpanalytics.domain.ToolCallRecord;
import com.phillippitts.mcpanalytics.exception.RecordingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CounterStoreTest {

    private static final Instant START = Instant.parse("2025-01-01T00:00:00Z");
    private static final Instant NOW = Instant.parse("2025-01-01T05:30:00Z");

    private CounterStore store;

    @BeforeEach
    void setUp() {
        SnapshotSummarizer summarizer = new SnapshotSummarizer("Test Server", 20, 24, 20, 50);
        store = new CounterStore(summarizer, 100, 50, START);
    }

    @Test
    void recordsRequestAgainstEveryTally() {
        store.recordRequest("GET", "/health", "203.0.113.7", "curl/8.0", NOW);

        AnalyticsSnapshot snapshot = store.snapshot();
        assertThat(snapshot.totalRequests()).isEqualTo(1);
        assertThat(snapshot.requestsByMethod()).containsExactly(Map.entry("GET", 1L));
        assertThat(snapshot.requestsByEndpoint()).containsExactly(Map.entry("/health", 1L));
        assertThat(snapshot.requestsByClientIp()).containsExactly(Map.entry("203.0.113.7", 1L));
        assertThat(snapshot.requestsByUserAgentPrefix()).containsExactly(Map.entry("curl/8.0", 1L));
        assertThat(snapshot.requestsByHour()).containsExactly(Map.entry("2025-01-01T05", 1L));
    }

    @Test
    void missingClientAndUserAgentCountAsUnknown() {
        store.recordRequest("POST", "/mcp", null, null, NOW);
        store.recordRequest("POST", "/mcp", "  ", "", NOW);

        AnalyticsSnapshot snapshot = store.snapshot();
        assertThat(snapshot.requestsByClientIp()).containsExactly(Map.entry("unknown", 2L));
        assertThat(snapshot.requestsByUserAgentPrefix()).containsExactly(Map.entry("unknown", 2L));
    }

    @Test
    void truncatesUserAgentToConfiguredLength() {
        String longAgent = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36";

        store.recordRequest("GET", "/", "127.0.0.1", longAgent, NOW);

        assertThat(store.snapshot().requestsByUserAgentPrefix())
                .containsOnlyKeys(longAgent.substring(0, 50));
    }

    @Test
    void hourBucketUsesUtc() {
        store.recordRequest("GET", "/", "a", "b", Instant.parse("2025-03-09T23:59:59Z"));
        store.recordRequest("GET", "/", "a", "b", Instant.parse("2025-03-10T00:00:00Z"));

        assertThat(store.snapshot().requestsByHour())
                .containsOnlyKeys("2025-03-09T23", "2025-03-10T00");
    }

    @Test
    void rejectsBlankMethodOrEndpoint() {
        assertThatThrownBy(() -> store.recordRequest(" ", "/health", "a", "b", NOW))
                .isInstanceOf(RecordingException.class)
                .extracting("eventKind").isEqualTo("request");
        assertThatThrownBy(() -> store.recordRequest("GET", null, "a", "b", NOW))
                .isInstanceOf(RecordingException.class);

        assertThat(store.totalRequests()).isZero();
    }

    @Test
    void recordsToolCallNewestFirst() {
        store.recordToolCall("codex", "10.0.0.1", "node", NOW);
        store.recordToolCall("ping", "10.0.0.2", null, NOW.plusSeconds(1));

        AnalyticsSnapshot snapshot = store.snapshot();
        assertThat(snapshot.totalToolCalls()).isEqualTo(2);
        assertThat(snapshot.toolCallsByTool()).containsEntry("codex", 1L).containsEntry("ping", 1L);
        assertThat(snapshot.recentToolCalls())
                .extracting(ToolCallRecord::tool)
                .containsExactly("ping", "codex");
        assertThat(snapshot.recentToolCalls().get(0).userAgent()).isEqualTo("unknown");
        assertThat(snapshot.totalRequests()).isZero();
    }

    @Test
    void rejectsBlankToolName() {
        assertThatThrownBy(() -> store.recordToolCall("", "a", "b", NOW))
                .isInstanceOf(RecordingException.class)
                .extracting("eventKind").isEqualTo("tool-call");
        assertThat(store.totalToolCalls()).isZero();
    }

    @Test
    void concurrentRequestsAreAllCounted() throws Exception {
        int requests = 1000;
        ExecutorService pool = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < requests; i++) {
                String client = "10.0.0." + (i % 10);
                futures.add(pool.submit(() -> {
                    start.await();
                    store.recordRequest("GET", "/health", client, "kube-health", NOW);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        AnalyticsSnapshot snapshot = store.snapshot();
        assertThat(snapshot.totalRequests()).isEqualTo(requests);
        assertThat(snapshot.requestsByEndpoint()).containsEntry("/health", (long) requests);
        assertThat(snapshot.requestsByMethod()).containsEntry("GET", (long) requests);
        assertThat(snapshot.requestsByClientIp().values().stream().mapToLong(Long::longValue).sum())
                .isEqualTo(requests);
    }

    @Test
    void concurrentToolCallsKeepRecentFeedBoundedAndDistinct() throws Exception {
        int calls = 500;
        ExecutorService pool = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < calls; i++) {
                String tool = "tool-" + (i % 7);
                Instant at = NOW.plusMillis(i);
                futures.add(pool.submit(() -> {
                    start.await();
                    store.recordToolCall(tool, "10.0.0.1", "node", at);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        AnalyticsSnapshot snapshot = store.snapshot();
        assertThat(snapshot.totalToolCalls()).isEqualTo(calls);
        assertThat(snapshot.toolCallsByTool().values().stream().mapToLong(Long::longValue).sum())
                .isEqualTo(calls);
        assertThat(snapshot.recentToolCalls())
                .hasSize(100)
                .doesNotHaveDuplicates()
                .allSatisfy(call -> assertThat(call.timestamp()).isBetween(NOW, NOW.plusMillis(calls - 1)));
    }

    @Test
    void applyDeltaAddsToTotalsOnly() {
        store.recordRequest("GET", "/", "a", "b", NOW);

        store.applyDelta(10, 3);
        store.applyDelta(10, 3);

        AnalyticsSnapshot snapshot = store.snapshot();
        assertThat(snapshot.totalRequests()).isEqualTo(21);
        assertThat(snapshot.totalToolCalls()).isEqualTo(6);
        assertThat(snapshot.requestsByMethod()).containsExactly(Map.entry("GET", 1L));
        assertThat(snapshot.toolCallsByTool()).isEmpty();
    }

    @Test
    void applyDeltaRejectsNegativeValuesWithoutChange() {
        store.applyDelta(5, 5);

        assertThatThrownBy(() -> store.applyDelta(-5, 1)).isInstanceOf(IllegalArgumentException.class);

        assertThat(store.totalRequests()).isEqualTo(5);
        assertThat(store.totalToolCalls()).isEqualTo(5);
    }

    @Test
    void applyDeltaOverflowLeavesBothTotalsUnchanged() {
        store.applyDelta(1, Long.MAX_VALUE - 1);

        assertThatThrownBy(() -> store.applyDelta(1, 5)).isInstanceOf(ArithmeticException.class);

        assertThat(store.totalRequests()).isEqualTo(1);
        assertThat(store.totalToolCalls()).isEqualTo(Long.MAX_VALUE - 1);
    }

    @Test
    void snapshotIsNotAffectedByLaterRecording() {
        store.recordRequest("GET", "/", "a", "b", NOW);
        AnalyticsSnapshot before = store.snapshot();

        store.recordRequest("GET", "/", "a", "b", NOW);
        store.recordToolCall("codex", "a", "b", NOW);

        assertThat(before.totalRequests()).isEqualTo(1);
        assertThat(before.requestsByMethod()).containsEntry("GET", 1L);
        assertThat(before.recentToolCalls()).isEmpty();
    }

    @Test
    void summarizeDoesNotMutateState() {
        store.recordRequest("GET", "/analytics", "a", "b", NOW);
        store.recordToolCall("codex", "a", "b", NOW);
        AnalyticsSnapshot before = store.snapshot();

        store.summarize(NOW.plusSeconds(3600));
        store.toolUsage();

        assertThat(store.snapshot()).isEqualTo(before);
    }

    @Test
    void restoreReplacesStartTimeAndCounters() {
        store.recordRequest("GET", "/", "a", "b", NOW);
        Instant recoveredStart = Instant.parse("2024-06-01T12:00:00Z");
        ToolCallRecord call = new ToolCallRecord("codex", NOW, "10.0.0.1", "node");
        AnalyticsSnapshot recovered = new AnalyticsSnapshot(recoveredStart, 40, 7,
                Map.of("POST", 40L), Map.of("/mcp", 40L), Map.of("codex", 7L),
                Map.of("10.0.0.1", 40L), Map.of("node", 40L), Map.of("2024-06-01T12", 40L),
                List.of(call));

        store.restore(recovered);

        assertThat(store.snapshot()).isEqualTo(recovered);
        store.recordRequest("POST", "/mcp", "10.0.0.1", "node", NOW);
        assertThat(store.totalRequests()).isEqualTo(41);
        assertThat(store.snapshot().startTime()).isEqualTo(recoveredStart);
    }
}
