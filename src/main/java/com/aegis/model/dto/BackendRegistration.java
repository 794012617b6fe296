package com.aegis.model.dto;

import com.aegis.config.AegisProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Body of {@code PUT /v1/backends/{id}}; omitted fields take the backend's defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackendRegistration {

    @ToString.Exclude
    @JsonProperty("api_key")
    private String apiKey;

    private String endpoint;

    private String model;

    @JsonProperty("timeout_seconds")
    private Integer timeoutSeconds;

    @Builder.Default
    private boolean enabled = true;

    public AegisProperties.ProviderConfig toProviderConfig() {
        AegisProperties.ProviderConfig provider = new AegisProperties.ProviderConfig();
        provider.setApiKey(apiKey);
        provider.setEndpoint(endpoint);
        provider.setModel(model);
        provider.setTimeout(timeoutSeconds);
        provider.setEnabled(enabled);
        return provider;
    }
}
