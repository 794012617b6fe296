package com.aegis.service.metrics;

import com.aegis.model.BackendKind;
import com.aegis.model.dto.BackendMetricsSnapshot;
import com.aegis.model.dto.MetricsSnapshot;
import com.aegis.service.AdmissionController;
import com.aegis.service.ResponseCache;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.TreeMap;

/**
 * Renders the dispatch metrics as JSON or Prometheus exposition text.
 */
@Slf4j
@Service
public class MetricsExporter {

    private final DispatchMetrics metrics;
    private final ResponseCache cache;
    private final AdmissionController admissionController;
    private final PrometheusMeterRegistry prometheusRegistry;
    private final ObjectMapper objectMapper;

    public MetricsExporter(
            DispatchMetrics metrics,
            ResponseCache cache,
            AdmissionController admissionController,
            PrometheusMeterRegistry prometheusRegistry,
            ObjectMapper objectMapper) {
        this.metrics = metrics;
        this.cache = cache;
        this.admissionController = admissionController;
        this.prometheusRegistry = prometheusRegistry;
        this.objectMapper = objectMapper;
    }

    /**
     * Dispatch metrics plus cache statistics and remaining admission slots per backend.
     */
    public MetricsSnapshot snapshot() {
        MetricsSnapshot snapshot = metrics.snapshot();

        Map<String, BackendMetricsSnapshot> backends = new TreeMap<>(snapshot.getBackends());
        for (Map.Entry<BackendKind, Integer> entry : admissionController.remainingByBackend().entrySet()) {
            String id = entry.getKey().getId();
            backends.computeIfAbsent(id, key -> BackendMetricsSnapshot.builder().backend(key).build())
                    .setRateLimitRemaining(entry.getValue());
        }

        return snapshot.toBuilder()
                .backends(backends)
                .cache(cache.statistics())
                .build();
    }

    public String toJson() {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize metrics snapshot", e);
            throw new IllegalStateException("Failed to serialize metrics snapshot", e);
        }
    }

    public String toPrometheus() {
        return prometheusRegistry.scrape();
    }

    public void reset() {
        metrics.reset();
    }
}
