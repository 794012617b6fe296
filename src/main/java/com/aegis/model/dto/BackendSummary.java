package com.aegis.model.dto;

import com.aegis.model.BackendConfig;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Registered backend as shown by the API, credential masked.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackendSummary {

    private String backend;

    @JsonProperty("display_name")
    private String displayName;

    private String endpoint;

    private String model;

    @JsonProperty("api_key")
    private String apiKey;

    @JsonProperty("timeout_seconds")
    private int timeoutSeconds;

    private boolean enabled;

    private boolean available;

    public static BackendSummary of(BackendConfig config, boolean available) {
        return BackendSummary.builder()
                .backend(config.getKind().getId())
                .displayName(config.getKind().getDisplayName())
                .endpoint(config.getEndpoint())
                .model(config.getModel())
                .apiKey(config.getMaskedApiKey())
                .timeoutSeconds(config.getTimeoutSeconds())
                .enabled(config.isEnabled())
                .available(available)
                .build();
    }
}
