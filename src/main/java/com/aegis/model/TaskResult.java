package com.aegis.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a task. {@code result} is present iff {@code success};
 * {@code errorMessage} and {@code errorKind} are present iff not.
 */
@Value
@Builder(toBuilder = true, access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskResult {

    public static final double DEFAULT_CONFIDENCE = 0.8;

    @JsonProperty("success")
    boolean success;

    @JsonProperty("result")
    JsonNode result;

    @JsonProperty("error_message")
    String errorMessage;

    @JsonProperty("error_kind")
    ErrorKind errorKind;

    @JsonProperty("confidence_score")
    double confidenceScore;

    @JsonProperty("processing_time_ms")
    long processingTimeMs;

    @JsonProperty("cached")
    boolean cached;

    public static TaskResult success(JsonNode result, double confidenceScore) {
        if (result == null) {
            throw new IllegalArgumentException("successful result requires a payload");
        }
        if (Double.isNaN(confidenceScore) || confidenceScore < 0.0 || confidenceScore > 1.0) {
            throw new IllegalArgumentException("confidence score must be within [0.0, 1.0]: " + confidenceScore);
        }
        return new TaskResult(true, result, null, null, confidenceScore, 0L, false);
    }

    public static TaskResult failure(ErrorKind kind, String message) {
        if (kind == null || message == null || message.isBlank()) {
            throw new IllegalArgumentException("failed result requires an error kind and message");
        }
        return new TaskResult(false, null, message, kind, 0.0, 0L, false);
    }

    public TaskResult withProcessingTime(long processingTimeMs) {
        return toBuilder().processingTimeMs(processingTimeMs).build();
    }

    /**
     * Deep copy, flagged as served from cache.
     */
    public TaskResult asCached() {
        return toBuilder()
                .result(result == null ? null : result.deepCopy())
                .cached(true)
                .build();
    }

    /**
     * Deep copy with identical flags.
     */
    public TaskResult copy() {
        return toBuilder()
                .result(result == null ? null : result.deepCopy())
                .build();
    }
}
