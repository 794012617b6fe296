package com.aegis.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Connection parameters for one backend instance.
 *
 * Instances are plain values; they become usable only once
 * {@link com.aegis.service.BackendConfigValidator} has accepted them,
 * which {@link com.aegis.service.BackendRegistry#register(BackendConfig)} enforces.
 */
@Value
@Builder(toBuilder = true)
public class BackendConfig {

    public static final int DEFAULT_TIMEOUT_SECONDS = 30;

    BackendKind kind;

    @ToString.Exclude
    String apiKey;

    String endpoint;

    String model;

    @Builder.Default
    int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

    @Builder.Default
    boolean enabled = true;

    /**
     * Config for {@code kind} with its default endpoint, model and timeout.
     */
    public static BackendConfig defaults(BackendKind kind, String apiKey) {
        return BackendConfig.builder()
                .kind(kind)
                .apiKey(apiKey)
                .endpoint(kind.getDefaultEndpoint())
                .model(kind.getDefaultModel())
                .build();
    }

    @ToString.Include(name = "apiKey")
    public String getMaskedApiKey() {
        return mask(apiKey);
    }

    /**
     * Masks a credential for logs and API output, keeping a short prefix and the last four characters.
     */
    public static String mask(String secret) {
        if (secret == null || secret.isEmpty()) {
            return "";
        }
        if (secret.length() <= 8) {
            return "****";
        }
        return secret.substring(0, 3) + "..." + secret.substring(secret.length() - 4);
    }
}
