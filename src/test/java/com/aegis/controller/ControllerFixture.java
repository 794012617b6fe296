package com.aegis.controller;

import com.aegis.config.AegisProperties;
import com.aegis.config.JacksonConfiguration;
import com.aegis.model.BackendKind;
import com.aegis.model.ErrorKind;
import com.aegis.model.TaskRequest;
import com.aegis.model.TaskResult;
import com.aegis.provider.BackendAdapter;
import com.aegis.service.AdmissionController;
import com.aegis.service.BackendConfigValidator;
import com.aegis.service.BackendRegistry;
import com.aegis.service.HealthService;
import com.aegis.service.ResponseCache;
import com.aegis.service.TaskDispatcher;
import com.aegis.service.canonicalization.PayloadSanitizer;
import com.aegis.service.canonicalization.RequestFingerprinter;
import com.aegis.service.metrics.DispatchMetrics;
import com.aegis.service.metrics.MetricsExporter;
import com.aegis.service.metrics.ThresholdAlerts;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Real services wired by hand behind every controller, with in-process backends.
 */
class ControllerFixture {

    final AegisProperties properties = new AegisProperties();
    final ObjectMapper objectMapper = JacksonConfiguration.createObjectMapper();
    final AtomicInteger backendCalls = new AtomicInteger();
    final AtomicBoolean backendUp = new AtomicBoolean(true);

    final BackendRegistry registry;
    final ResponseCache cache;
    final AdmissionController admission;
    final DispatchMetrics metrics;
    final TaskDispatcher dispatcher;
    final WebTestClient client;

    ControllerFixture() {
        BackendConfigValidator validator = new BackendConfigValidator();
        PrometheusMeterRegistry meterRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        admission = new AdmissionController(properties.getRateLimiting(), Clock.systemUTC());
        registry = new BackendRegistry(properties, validator, admission,
                List.of(adapter(BackendKind.OPENAI), adapter(BackendKind.ANTHROPIC)));
        cache = new ResponseCache(properties.getCache(), Ticker.systemTicker());
        metrics = new DispatchMetrics(meterRegistry);
        dispatcher = new TaskDispatcher(properties, registry, cache, admission,
                new RequestFingerprinter(false), new PayloadSanitizer(), metrics, validator);
        HealthService healthService = new HealthService(registry, dispatcher);
        MetricsExporter exporter = new MetricsExporter(metrics, cache, admission, meterRegistry, objectMapper);

        client = WebTestClient.bindToController(
                        new TaskController(dispatcher, registry),
                        new BackendController(registry),
                        new CacheController(cache),
                        new RateLimitController(admission),
                        new MetricsController(exporter, new ThresholdAlerts(
                                properties.getAlerts(), metrics, dispatcher, meterRegistry, Clock.systemUTC())),
                        new HealthController(healthService))
                .httpMessageCodecs(codecs -> {
                    codecs.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(objectMapper));
                    codecs.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(objectMapper));
                })
                .build();
    }

    void shutdown() {
        dispatcher.shutdown();
    }

    private BackendAdapter adapter(BackendKind kind) {
        return new BackendAdapter() {
            @Override
            public BackendKind getKind() {
                return kind;
            }

            @Override
            public TaskResult process(TaskRequest request) {
                backendCalls.incrementAndGet();
                if (!backendUp.get()) {
                    return TaskResult.failure(ErrorKind.TRANSPORT, "Could not connect to " + kind.getDisplayName() + " API");
                }
                ObjectNode result = JsonNodeFactory.instance.objectNode();
                result.put("content", "Upgrade the affected component.");
                result.put("backend", kind.getId());
                result.put("model", request.getConfig().getModel());
                return TaskResult.success(result, 0.8);
            }
        };
    }
}
