package com.aegis.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time view of the dispatch metrics, for dashboards.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MetricsSnapshot {

    @JsonProperty("started_at")
    private Instant startedAt;

    @JsonProperty("uptime_seconds")
    private long uptimeSeconds;

    @JsonProperty("total_requests")
    private long totalRequests;

    @JsonProperty("successful_requests")
    private long successfulRequests;

    @JsonProperty("failed_requests")
    private long failedRequests;

    @JsonProperty("cached_requests")
    private long cachedRequests;

    @JsonProperty("rate_limited_requests")
    private long rateLimitedRequests;

    @JsonProperty("cache_misses")
    private long cacheMisses;

    @JsonProperty("success_rate")
    private double successRate;

    @JsonProperty("cache_hit_rate")
    private double cacheHitRate;

    @JsonProperty("requests_per_minute")
    private double requestsPerMinute;

    private LatencySnapshot latency;

    private Map<String, BackendMetricsSnapshot> backends;

    /**
     * Failures by error kind.
     */
    private Map<String, Long> errors;

    /**
     * Successfully answered tasks by task type.
     */
    @JsonProperty("items_processed")
    private Map<String, Long> itemsProcessed;

    private CacheStatistics cache;
}
