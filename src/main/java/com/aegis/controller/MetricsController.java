package com.aegis.controller;

import com.aegis.model.dto.Alert;
import com.aegis.model.dto.MetricsSnapshot;
import com.aegis.service.metrics.MetricsExporter;
import com.aegis.service.metrics.ThresholdAlerts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Dispatch metrics in JSON and Prometheus text format.
 */
@Slf4j
@RestController
@RequestMapping("/v1/metrics")
public class MetricsController {

    static final MediaType PROMETHEUS_TEXT = MediaType.parseMediaType("text/plain;version=0.0.4;charset=utf-8");

    private final MetricsExporter exporter;
    private final ThresholdAlerts alerts;

    public MetricsController(MetricsExporter exporter, ThresholdAlerts alerts) {
        this.exporter = exporter;
        this.alerts = alerts;
    }

    @GetMapping
    public ResponseEntity<MetricsSnapshot> getMetrics() {
        return ResponseEntity.ok(exporter.snapshot());
    }

    @GetMapping("/prometheus")
    public ResponseEntity<String> getPrometheus() {
        return ResponseEntity.ok()
                .contentType(PROMETHEUS_TEXT)
                .body(exporter.toPrometheus());
    }

    /**
     * Thresholds breached right now; an empty list when all is well.
     */
    @GetMapping("/alerts")
    public ResponseEntity<List<Alert>> getAlerts() {
        return ResponseEntity.ok(alerts.check());
    }

    @PostMapping("/reset")
    public ResponseEntity<Map<String, String>> reset() {
        log.info("Metrics reset requested");
        exporter.reset();
        return ResponseEntity.ok(Map.of("status", "success"));
    }
}
