package com.aegis.service.metrics;

import com.aegis.model.BackendKind;
import com.aegis.model.ErrorKind;
import com.aegis.model.TaskResult;
import com.aegis.model.TaskType;
import com.aegis.model.dto.BackendMetricsSnapshot;
import com.aegis.model.dto.MetricsSnapshot;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Process-wide dispatch counters and latency statistics.
 *
 * Every dispatch increments {@code total} exactly once and exactly one of
 * {@code successful}/{@code failed}. Counters are atomics, so writers never
 * block readers; only the latency ring takes a short lock. The same atomics
 * back the Micrometer meters used for the Prometheus export.
 */
@Slf4j
@Service
public class DispatchMetrics {

    private static final String PREFIX = "aegis.";

    private final MeterRegistry registry;
    private final Clock clock;
    private final AtomicReference<Instant> startedAt;

    private final AtomicLong total = new AtomicLong();
    private final AtomicLong successful = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong cached = new AtomicLong();
    private final AtomicLong rateLimited = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final LatencyStats latency = new LatencyStats();

    private final Map<BackendKind, BackendStats> backends = new ConcurrentHashMap<>();
    private final Map<ErrorKind, AtomicLong> errors = new EnumMap<>(ErrorKind.class);
    private final Map<TaskType, AtomicLong> itemsProcessed = new EnumMap<>(TaskType.class);

    @Autowired
    public DispatchMetrics(MeterRegistry registry) {
        this(registry, Clock.systemUTC());
    }

    public DispatchMetrics(MeterRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
        this.startedAt = new AtomicReference<>(clock.instant());

        // fixed key sets, populated once so the maps are never structurally modified afterwards
        for (ErrorKind kind : ErrorKind.values()) {
            errors.put(kind, new AtomicLong());
        }
        for (TaskType type : TaskType.values()) {
            itemsProcessed.put(type, new AtomicLong());
        }

        bindMeters();
    }

    /**
     * Request rejected before admission: missing/invalid config, disabled task type.
     * {@code backend} may be null when the config could not be resolved.
     */
    public void recordRejected(BackendKind backend, ErrorKind errorKind) {
        total.incrementAndGet();
        failed.incrementAndGet();
        errors.get(errorKind).incrementAndGet();
        if (backend != null) {
            backend(backend).failed.incrementAndGet();
        }
    }

    public void recordRateLimited(BackendKind backend) {
        total.incrementAndGet();
        failed.incrementAndGet();
        rateLimited.incrementAndGet();
        errors.get(ErrorKind.RATE_LIMITED).incrementAndGet();
        BackendStats stats = backend(backend);
        stats.failed.incrementAndGet();
        stats.rateLimited.incrementAndGet();
    }

    public void recordCacheHit(BackendKind backend, TaskType taskType) {
        total.incrementAndGet();
        successful.incrementAndGet();
        cached.incrementAndGet();
        backend(backend).cached.incrementAndGet();
        itemsProcessed.get(taskType).incrementAndGet();
    }

    public void recordCacheMiss(BackendKind backend) {
        cacheMisses.incrementAndGet();
    }

    /**
     * Outcome of an adapter call.
     */
    public void recordResponse(BackendKind backend, TaskType taskType, TaskResult result, long durationMs) {
        total.incrementAndGet();
        latency.record(durationMs);

        BackendStats stats = backend(backend);
        stats.sent.incrementAndGet();
        stats.latency.record(durationMs);
        stats.lastRequestTime.set(clock.instant());

        if (result.isSuccess()) {
            successful.incrementAndGet();
            stats.successful.incrementAndGet();
            itemsProcessed.get(taskType).incrementAndGet();
            if (result.getResult() != null && result.getResult().path("tokens_used").canConvertToLong()) {
                stats.tokens.addAndGet(result.getResult().path("tokens_used").asLong());
            }
        } else {
            failed.incrementAndGet();
            stats.failed.incrementAndGet();
            errors.get(result.getErrorKind()).incrementAndGet();
        }
    }

    public MetricsSnapshot snapshot() {
        Instant now = clock.instant();
        Instant started = startedAt.get();
        long uptimeSeconds = Math.max(0L, Duration.between(started, now).getSeconds());

        long totalRequests = total.get();
        long successfulRequests = successful.get();
        long cachedRequests = cached.get();
        long misses = cacheMisses.get();

        Map<String, BackendMetricsSnapshot> backendSnapshots = new TreeMap<>();
        backends.forEach((kind, stats) -> backendSnapshots.put(kind.getId(), stats.snapshot(kind)));

        Map<String, Long> errorCounts = new TreeMap<>();
        errors.forEach((kind, count) -> errorCounts.put(kind.name().toLowerCase(), count.get()));

        Map<String, Long> items = new TreeMap<>();
        itemsProcessed.forEach((type, count) -> items.put(type.getId(), count.get()));

        return MetricsSnapshot.builder()
                .startedAt(started)
                .uptimeSeconds(uptimeSeconds)
                .totalRequests(totalRequests)
                .successfulRequests(successfulRequests)
                .failedRequests(failed.get())
                .cachedRequests(cachedRequests)
                .rateLimitedRequests(rateLimited.get())
                .cacheMisses(misses)
                .successRate(totalRequests == 0 ? 0.0 : (double) successfulRequests / totalRequests)
                .cacheHitRate(cachedRequests + misses == 0 ? 0.0 : (double) cachedRequests / (cachedRequests + misses))
                .requestsPerMinute(totalRequests * 60.0 / Math.max(1L, uptimeSeconds))
                .latency(latency.snapshot())
                .backends(backendSnapshots)
                .errors(errorCounts)
                .itemsProcessed(items)
                .build();
    }

    /**
     * Zero every counter in place; exported meters keep pointing at the same atomics.
     */
    public void reset() {
        total.set(0);
        successful.set(0);
        failed.set(0);
        cached.set(0);
        rateLimited.set(0);
        cacheMisses.set(0);
        latency.reset();
        errors.values().forEach(count -> count.set(0));
        itemsProcessed.values().forEach(count -> count.set(0));
        backends.values().forEach(BackendStats::reset);
        startedAt.set(clock.instant());
        log.info("Dispatch metrics reset");
    }

    public long getTotalRequests() {
        return total.get();
    }

    private BackendStats backend(BackendKind kind) {
        return backends.computeIfAbsent(kind, this::newBackendStats);
    }

    private BackendStats newBackendStats(BackendKind kind) {
        BackendStats stats = new BackendStats();
        if (registry != null) {
            String backend = kind.getId();
            backendCounter(backend, "sent", stats.sent);
            backendCounter(backend, "success", stats.successful);
            backendCounter(backend, "failure", stats.failed);
            backendCounter(backend, "cached", stats.cached);
            backendCounter(backend, "rate_limited", stats.rateLimited);
            FunctionCounter.builder(PREFIX + "backend.tokens", stats.tokens, AtomicLong::get)
                    .description("Tokens reported by the backend")
                    .tag("backend", backend)
                    .register(registry);
        }
        return stats;
    }

    private void backendCounter(String backend, String outcome, AtomicLong value) {
        FunctionCounter.builder(PREFIX + "backend.requests", value, AtomicLong::get)
                .description("Dispatches per backend and outcome")
                .tag("backend", backend)
                .tag("outcome", outcome)
                .register(registry);
    }

    private void bindMeters() {
        if (registry == null) {
            return;
        }
        counter("requests", "All dispatches", total);
        counter("requests.successful", "Dispatches answered successfully", successful);
        counter("requests.failed", "Dispatches that failed", failed);
        counter("requests.cached", "Dispatches served from the response cache", cached);
        counter("requests.rate_limited", "Dispatches denied by admission control", rateLimited);
        counter("cache.misses", "Response cache misses", cacheMisses);

        errors.forEach((kind, count) -> FunctionCounter.builder(PREFIX + "errors", count, AtomicLong::get)
                .description("Failures by error kind")
                .tag("kind", kind.name().toLowerCase())
                .register(registry));
        itemsProcessed.forEach((type, count) -> FunctionCounter.builder(PREFIX + "items.processed", count, AtomicLong::get)
                .description("Successful tasks by task type")
                .tag("task_type", type.getId())
                .register(registry));

        latencyGauge("min", snapshot -> snapshot.getMinMs());
        latencyGauge("max", snapshot -> snapshot.getMaxMs());
        latencyGauge("avg", snapshot -> snapshot.getAvgMs());
        latencyGauge("p50", snapshot -> snapshot.getP50Ms());
        latencyGauge("p95", snapshot -> snapshot.getP95Ms());
        latencyGauge("p99", snapshot -> snapshot.getP99Ms());
    }

    private void counter(String name, String description, AtomicLong value) {
        FunctionCounter.builder(PREFIX + name, value, AtomicLong::get)
                .description(description)
                .register(registry);
    }

    private void latencyGauge(String stat, Function<com.aegis.model.dto.LatencySnapshot, Double> extractor) {
        Gauge.builder(PREFIX + "response.time.ms", latency, stats -> extractor.apply(stats.snapshot()))
                .description("Backend call latency in milliseconds")
                .tag("stat", stat)
                .register(registry);
    }

    private static final class BackendStats {
        private final AtomicLong sent = new AtomicLong();
        private final AtomicLong successful = new AtomicLong();
        private final AtomicLong failed = new AtomicLong();
        private final AtomicLong cached = new AtomicLong();
        private final AtomicLong rateLimited = new AtomicLong();
        private final AtomicLong tokens = new AtomicLong();
        private final LatencyStats latency = new LatencyStats(64);
        private final AtomicReference<Instant> lastRequestTime = new AtomicReference<>();

        BackendMetricsSnapshot snapshot(BackendKind kind) {
            return BackendMetricsSnapshot.builder()
                    .backend(kind.getId())
                    .requestsSent(sent.get())
                    .requestsSuccessful(successful.get())
                    .requestsFailed(failed.get())
                    .requestsCached(cached.get())
                    .requestsRateLimited(rateLimited.get())
                    .tokensConsumed(tokens.get())
                    .avgResponseTimeMs(latency.average())
                    .lastRequestTime(lastRequestTime.get())
                    .build();
        }

        void reset() {
            sent.set(0);
            successful.set(0);
            failed.set(0);
            cached.set(0);
            rateLimited.set(0);
            tokens.set(0);
            latency.reset();
            lastRequestTime.set(null);
        }
    }
}
