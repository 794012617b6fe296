package com.aegis.service.metrics;

import com.aegis.config.AegisProperties;
import com.aegis.model.dto.Alert;
import com.aegis.model.dto.MetricsSnapshot;
import com.aegis.service.TaskDispatcher;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Compares the dispatch metrics against the configured error-rate,
 * response-time and queue-size thresholds.
 *
 * Each threshold has an {@code aegis.alerts.active} gauge (1 while breached).
 * A breach is logged at WARN when it starts and at INFO when it clears.
 */
@Slf4j
@Component
public class ThresholdAlerts {

    static final String ERROR_RATE = "error_rate";
    static final String RESPONSE_TIME = "response_time";
    static final String QUEUE_SIZE = "queue_size";

    private final AegisProperties.AlertConfig config;
    private final DispatchMetrics metrics;
    private final TaskDispatcher dispatcher;
    private final Clock clock;
    private final Map<String, AtomicInteger> active = new LinkedHashMap<>();

    @Autowired
    public ThresholdAlerts(AegisProperties properties, DispatchMetrics metrics,
                           TaskDispatcher dispatcher, MeterRegistry registry) {
        this(properties.getAlerts(), metrics, dispatcher, registry, Clock.systemUTC());
    }

    public ThresholdAlerts(AegisProperties.AlertConfig config, DispatchMetrics metrics,
                           TaskDispatcher dispatcher, MeterRegistry registry, Clock clock) {
        this.config = config;
        this.metrics = metrics;
        this.dispatcher = dispatcher;
        this.clock = clock;

        for (String type : List.of(ERROR_RATE, RESPONSE_TIME, QUEUE_SIZE)) {
            AtomicInteger flag = new AtomicInteger();
            active.put(type, flag);
            Gauge.builder("aegis.alerts.active", flag, AtomicInteger::get)
                    .description("1 while the threshold is breached")
                    .tag("type", type)
                    .register(registry);
        }
    }

    @Scheduled(fixedDelayString = "${aegis.alerts.check-interval-ms:60000}")
    public void scheduledCheck() {
        if (config.isEnabled()) {
            check();
        }
    }

    /**
     * Evaluate every threshold now.
     *
     * @return the thresholds currently breached
     */
    public synchronized List<Alert> check() {
        MetricsSnapshot snapshot = metrics.snapshot();
        List<Alert> alerts = new ArrayList<>();

        double errorRate = snapshot.getTotalRequests() == 0
                ? 0.0
                : (double) snapshot.getFailedRequests() / snapshot.getTotalRequests();
        boolean enoughTraffic = snapshot.getTotalRequests() >= config.getMinRequests();
        evaluate(alerts, ERROR_RATE, enoughTraffic && errorRate > config.getErrorRateThreshold(),
                errorRate, config.getErrorRateThreshold(),
                String.format(Locale.ROOT, "Error rate %.1f%% over %d requests exceeds %.1f%%",
                        errorRate * 100, snapshot.getTotalRequests(), config.getErrorRateThreshold() * 100));

        double avgMs = snapshot.getLatency() == null ? 0.0 : snapshot.getLatency().getAvgMs();
        evaluate(alerts, RESPONSE_TIME, avgMs > config.getResponseTimeThresholdMs(),
                avgMs, config.getResponseTimeThresholdMs(),
                String.format(Locale.ROOT, "Average response time %.0fms exceeds %.0fms",
                        avgMs, config.getResponseTimeThresholdMs()));

        int queued = dispatcher.getQueueSize();
        evaluate(alerts, QUEUE_SIZE, queued > config.getQueueSizeThreshold(),
                queued, config.getQueueSizeThreshold(),
                "Dispatcher queue holds " + queued + " tasks, threshold " + config.getQueueSizeThreshold());

        return alerts;
    }

    public boolean isActive(String type) {
        AtomicInteger flag = active.get(type);
        return flag != null && flag.get() == 1;
    }

    private void evaluate(List<Alert> alerts, String type, boolean breached,
                          double value, double threshold, String message) {
        int previous = active.get(type).getAndSet(breached ? 1 : 0);
        if (!breached) {
            if (previous == 1) {
                log.info("Alert cleared: {}", type);
            }
            return;
        }
        if (previous == 0) {
            log.warn("Alert raised: {} - {}", type, message);
        }
        alerts.add(Alert.builder()
                .type(type)
                .message(message)
                .value(value)
                .threshold(threshold)
                .raisedAt(clock.instant())
                .build());
    }
}
