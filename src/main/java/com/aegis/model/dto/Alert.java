package com.aegis.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A metric that crossed its configured threshold.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    /**
     * error_rate, response_time or queue_size.
     */
    private String type;

    private String message;

    private double value;

    private double threshold;

    @JsonProperty("raised_at")
    private Instant raisedAt;
}
