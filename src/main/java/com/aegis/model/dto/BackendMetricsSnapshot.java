package com.aegis.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Per-backend slice of the metrics snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackendMetricsSnapshot {

    private String backend;

    /**
     * Calls that actually reached the adapter.
     */
    @JsonProperty("requests_sent")
    private long requestsSent;

    @JsonProperty("requests_successful")
    private long requestsSuccessful;

    /**
     * Every failure attributed to this backend, including admission denials.
     */
    @JsonProperty("requests_failed")
    private long requestsFailed;

    @JsonProperty("requests_cached")
    private long requestsCached;

    @JsonProperty("requests_rate_limited")
    private long requestsRateLimited;

    @JsonProperty("tokens_consumed")
    private long tokensConsumed;

    @JsonProperty("avg_response_time_ms")
    private double avgResponseTimeMs;

    @JsonProperty("last_request_time")
    private Instant lastRequestTime;

    /**
     * Admission slots left in the current window; absent when the backend has no window.
     */
    @JsonProperty("rate_limit_remaining")
    private Integer rateLimitRemaining;
}
