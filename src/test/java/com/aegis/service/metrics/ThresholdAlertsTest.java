package com.aegis.service.metrics;

import com.aegis.config.AegisProperties;
import com.aegis.model.BackendConfig;
import com.aegis.model.BackendKind;
import com.aegis.model.ErrorKind;
import com.aegis.model.TaskRequest;
import com.aegis.model.TaskResult;
import com.aegis.model.TaskType;
import com.aegis.model.dto.Alert;
import com.aegis.provider.BackendAdapter;
import com.aegis.service.AdmissionController;
import com.aegis.service.BackendConfigValidator;
import com.aegis.service.BackendRegistry;
import com.aegis.service.ResponseCache;
import com.aegis.service.TaskDispatcher;
import com.aegis.service.canonicalization.PayloadSanitizer;
import com.aegis.service.canonicalization.RequestFingerprinter;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ThresholdAlerts.
 */
class ThresholdAlertsTest {

    private final CountDownLatch release = new CountDownLatch(1);

    private AegisProperties properties;
    private SimpleMeterRegistry registry;
    private DispatchMetrics metrics;
    private BackendRegistry backends;
    private TaskDispatcher dispatcher;
    private ThresholdAlerts alerts;

    @BeforeEach
    void setUp() {
        properties = new AegisProperties();
        properties.getService().setThreadPoolSize(1);
        properties.getAlerts().setResponseTimeThresholdMs(1000);
        properties.getAlerts().setQueueSizeThreshold(1);

        registry = new SimpleMeterRegistry();
        metrics = new DispatchMetrics(registry);
        BackendConfigValidator validator = new BackendConfigValidator();
        AdmissionController admission = new AdmissionController(properties.getRateLimiting(), Clock.systemUTC());
        backends = new BackendRegistry(properties, validator, admission, List.of(gatedAdapter()));
        backends.register(BackendConfig.defaults(BackendKind.OPENAI, "sk-test-1234567890"));
        dispatcher = new TaskDispatcher(properties, backends,
                new ResponseCache(properties.getCache(), Ticker.systemTicker()), admission,
                new RequestFingerprinter(false), new PayloadSanitizer(), metrics, validator);
        alerts = new ThresholdAlerts(properties.getAlerts(), metrics, dispatcher, registry, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        dispatcher.shutdown();
    }

    @Test
    void testQuietServiceRaisesNothing() {
        assertTrue(alerts.check().isEmpty());
        assertEquals(0.0, gauge(ThresholdAlerts.ERROR_RATE));
    }

    @Test
    void testErrorRateNeedsMinimumTraffic() {
        for (int i = 0; i < 9; i++) {
            metrics.recordResponse(BackendKind.OPENAI, TaskType.THREAT_MODELING,
                    TaskResult.failure(ErrorKind.BACKEND, "OpenAI API: Internal server error"), 20);
        }
        assertTrue(alerts.check().isEmpty());

        metrics.recordResponse(BackendKind.OPENAI, TaskType.THREAT_MODELING,
                TaskResult.failure(ErrorKind.TRANSPORT, "Could not connect to OpenAI API"), 20);
        List<Alert> raised = alerts.check();

        assertEquals(1, raised.size());
        assertEquals(ThresholdAlerts.ERROR_RATE, raised.get(0).getType());
        assertEquals(1.0, raised.get(0).getValue());
        assertEquals(0.5, raised.get(0).getThreshold());
        assertTrue(alerts.isActive(ThresholdAlerts.ERROR_RATE));
        assertEquals(1.0, gauge(ThresholdAlerts.ERROR_RATE));
    }

    @Test
    void testSlowResponsesRaiseAndClear() {
        metrics.recordResponse(BackendKind.OPENAI, TaskType.REPORT_GENERATION, success(), 4000);

        List<Alert> raised = alerts.check();
        assertEquals(1, raised.size());
        assertEquals(ThresholdAlerts.RESPONSE_TIME, raised.get(0).getType());
        assertEquals("Average response time 4000ms exceeds 1000ms", raised.get(0).getMessage());

        metrics.reset();
        assertTrue(alerts.check().isEmpty());
        assertFalse(alerts.isActive(ThresholdAlerts.RESPONSE_TIME));
        assertEquals(0.0, gauge(ThresholdAlerts.RESPONSE_TIME));
    }

    @Test
    void testQueueBacklogRaisesAlert() throws Exception {
        CompletableFuture<TaskResult> running = dispatcher.processAsync(request(1));
        dispatcher.processAsync(request(2));
        dispatcher.processAsync(request(3));

        // the single worker holds the first task; the other two wait in the queue
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (dispatcher.getQueueSize() < 2 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        List<Alert> raised = alerts.check();

        assertEquals(1, raised.size());
        assertEquals(ThresholdAlerts.QUEUE_SIZE, raised.get(0).getType());
        assertEquals(2.0, raised.get(0).getValue());

        release.countDown();
        assertTrue(running.get(10, TimeUnit.SECONDS).isSuccess());
    }

    private double gauge(String type) {
        return registry.get("aegis.alerts.active").tag("type", type).gauge().value();
    }

    private BackendAdapter gatedAdapter() {
        return new BackendAdapter() {
            @Override
            public BackendKind getKind() {
                return BackendKind.OPENAI;
            }

            @Override
            public TaskResult process(TaskRequest request) {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return success();
            }
        };
    }

    private TaskRequest request(int n) {
        return TaskRequest.builder()
                .taskType(TaskType.SCAN_OPTIMIZATION)
                .payload(JsonNodeFactory.instance.objectNode().put("n", n))
                .config(backends.find(BackendKind.OPENAI).orElseThrow())
                .build();
    }

    private static TaskResult success() {
        return TaskResult.success(JsonNodeFactory.instance.objectNode().put("content", "ok"), 0.8);
    }
}
