package com.aegis.model.dto;

import com.aegis.model.HealthStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Result of probing one backend.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthCheck {

    private String backend;

    private HealthStatus status;

    private String message;

    @JsonProperty("response_time_ms")
    private long responseTimeMs;

    @JsonProperty("checked_at")
    private Instant checkedAt;
}
