package com.aegis.model.dto;

import com.aegis.model.HealthStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthReport {

    private HealthStatus status;

    @JsonProperty("healthy_backends")
    private int healthyBackends;

    @JsonProperty("total_backends")
    private int totalBackends;

    private List<HealthCheck> backends;

    @JsonProperty("checked_at")
    private Instant checkedAt;
}
