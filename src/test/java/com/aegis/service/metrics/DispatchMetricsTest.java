package com.aegis.service.metrics;

import com.aegis.model.BackendKind;
import com.aegis.model.ErrorKind;
import com.aegis.model.TaskResult;
import com.aegis.model.TaskType;
import com.aegis.model.dto.BackendMetricsSnapshot;
import com.aegis.model.dto.MetricsSnapshot;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DispatchMetrics.
 */
class DispatchMetricsTest {

    private SimpleMeterRegistry registry;
    private DispatchMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new DispatchMetrics(registry, Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void testEveryOutcomeCountsOnce() {
        metrics.recordCacheMiss(BackendKind.OPENAI);
        metrics.recordResponse(BackendKind.OPENAI, TaskType.VULNERABILITY_ANALYSIS, success(150), 120);
        metrics.recordCacheHit(BackendKind.OPENAI, TaskType.VULNERABILITY_ANALYSIS);
        metrics.recordRateLimited(BackendKind.OPENAI);
        metrics.recordRejected(null, ErrorKind.VALIDATION);
        metrics.recordCacheMiss(BackendKind.ANTHROPIC);
        metrics.recordResponse(BackendKind.ANTHROPIC, TaskType.THREAT_MODELING,
                TaskResult.failure(ErrorKind.BACKEND, "Anthropic API: Internal server error"), 80);

        MetricsSnapshot snapshot = metrics.snapshot();

        assertEquals(5, snapshot.getTotalRequests());
        assertEquals(2, snapshot.getSuccessfulRequests());
        assertEquals(3, snapshot.getFailedRequests());
        assertEquals(snapshot.getTotalRequests(), snapshot.getSuccessfulRequests() + snapshot.getFailedRequests());
        assertEquals(1, snapshot.getCachedRequests());
        assertEquals(1, snapshot.getRateLimitedRequests());
        assertEquals(2, snapshot.getCacheMisses());
        assertEquals(1.0 / 3.0, snapshot.getCacheHitRate(), 0.0001);

        assertEquals(1L, snapshot.getErrors().get("rate_limited"));
        assertEquals(1L, snapshot.getErrors().get("validation"));
        assertEquals(1L, snapshot.getErrors().get("backend"));
        assertEquals(2L, snapshot.getItemsProcessed().get("vulnerability-analysis"));
        assertEquals(0L, snapshot.getItemsProcessed().get("threat-modeling"));

        assertEquals(2, snapshot.getLatency().getCount());
        assertEquals(80.0, snapshot.getLatency().getMinMs());
        assertEquals(120.0, snapshot.getLatency().getMaxMs());
    }

    @Test
    void testPerBackendBreakdown() {
        metrics.recordResponse(BackendKind.OPENAI, TaskType.SCAN_OPTIMIZATION, success(200), 100);
        metrics.recordResponse(BackendKind.OPENAI, TaskType.SCAN_OPTIMIZATION, success(50), 300);
        metrics.recordRateLimited(BackendKind.OPENAI);

        BackendMetricsSnapshot openai = metrics.snapshot().getBackends().get("openai");

        assertEquals(2, openai.getRequestsSent());
        assertEquals(2, openai.getRequestsSuccessful());
        assertEquals(1, openai.getRequestsFailed());
        assertEquals(1, openai.getRequestsRateLimited());
        assertEquals(250, openai.getTokensConsumed());
        assertEquals(200.0, openai.getAvgResponseTimeMs(), 0.0001);
        assertNotNull(openai.getLastRequestTime());
    }

    @Test
    void testMicrometerCountersFollowAtomics() {
        metrics.recordResponse(BackendKind.OPENAI, TaskType.VULNERABILITY_ANALYSIS, success(10), 5);
        metrics.recordRateLimited(BackendKind.OPENAI);

        assertEquals(2.0, registry.get("aegis.requests").functionCounter().count());
        assertEquals(1.0, registry.get("aegis.requests.rate_limited").functionCounter().count());
        assertEquals(1.0, registry.get("aegis.backend.requests")
                .tags("backend", "openai", "outcome", "success").functionCounter().count());
        assertEquals(1.0, registry.get("aegis.errors").tag("kind", "rate_limited").functionCounter().count());

        metrics.reset();

        assertEquals(0.0, registry.get("aegis.requests").functionCounter().count());
    }

    @Test
    void testResetClearsEverything() {
        metrics.recordResponse(BackendKind.OPENAI, TaskType.VULNERABILITY_ANALYSIS, success(10), 5);
        metrics.recordRejected(BackendKind.OPENAI, ErrorKind.CONFIGURATION);

        metrics.reset();
        MetricsSnapshot snapshot = metrics.snapshot();

        assertEquals(0, snapshot.getTotalRequests());
        assertEquals(0, snapshot.getLatency().getCount());
        assertEquals(0L, snapshot.getErrors().get("configuration"));
        assertEquals(0, snapshot.getBackends().get("openai").getRequestsSent());
    }

    @Test
    void testConcurrentRecordingLosesNoUpdates() throws Exception {
        int threads = 8;
        int perThread = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < perThread; i++) {
                        metrics.recordResponse(BackendKind.LOCAL, TaskType.REPORT_GENERATION, success(1), i % 50);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdown();
        }

        MetricsSnapshot snapshot = metrics.snapshot();
        assertEquals(threads * perThread, snapshot.getTotalRequests());
        assertEquals(threads * perThread, snapshot.getBackends().get("local").getTokensConsumed());
        assertEquals(threads * perThread, snapshot.getLatency().getCount());
    }

    private static TaskResult success(long tokens) {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("content", "ok");
        result.put("tokens_used", tokens);
        return TaskResult.success(result, 0.8);
    }
}
