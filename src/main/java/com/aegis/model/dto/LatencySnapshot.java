package com.aegis.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Backend call latency in milliseconds. Percentiles cover the most recent samples only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LatencySnapshot {

    private long count;

    @JsonProperty("min_ms")
    private double minMs;

    @JsonProperty("max_ms")
    private double maxMs;

    @JsonProperty("avg_ms")
    private double avgMs;

    @JsonProperty("p50_ms")
    private double p50Ms;

    @JsonProperty("p95_ms")
    private double p95Ms;

    @JsonProperty("p99_ms")
    private double p99Ms;
}
