package com.aegis.service;

import com.aegis.model.BackendConfig;
import com.aegis.model.BackendKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Shape checks a backend configuration must pass before it can be registered.
 */
@Component
public class BackendConfigValidator {

    private static final String OPENAI_KEY_PREFIX = "sk-";
    private static final String ANTHROPIC_KEY_PREFIX = "sk-ant-";

    /**
     * @throws ConfigurationException listing every violated rule
     */
    public void validate(BackendConfig config) {
        List<String> violations = violations(config);
        if (!violations.isEmpty()) {
            String name = config == null || config.getKind() == null ? "backend" : config.getKind().getId();
            throw new ConfigurationException("Invalid configuration for " + name, violations);
        }
    }

    public boolean isValid(BackendConfig config) {
        return violations(config).isEmpty();
    }

    public List<String> violations(BackendConfig config) {
        List<String> violations = new ArrayList<>();
        if (config == null) {
            violations.add("configuration is missing");
            return violations;
        }
        if (config.getKind() == null) {
            violations.add("backend kind is missing");
        } else if (!isValidApiKey(config.getApiKey(), config.getKind())) {
            violations.add("credential is empty or malformed for " + config.getKind().getDisplayName());
        }
        if (!isValidEndpoint(config.getEndpoint())) {
            violations.add("endpoint must use https:// (plain http only for localhost)");
        }
        if (config.getModel() == null || config.getModel().isBlank()) {
            violations.add("model is empty");
        }
        if (config.getTimeoutSeconds() <= 0) {
            violations.add("timeout must be positive");
        }
        return violations;
    }

    public boolean isValidApiKey(String apiKey, BackendKind kind) {
        if (apiKey == null || apiKey.isEmpty()) {
            return false;
        }
        return switch (kind) {
            case OPENAI -> apiKey.startsWith(OPENAI_KEY_PREFIX) && apiKey.length() > 10;
            case ANTHROPIC -> apiKey.startsWith(ANTHROPIC_KEY_PREFIX) && apiKey.length() > 20;
            case CUSTOM, LOCAL -> !apiKey.isBlank();
        };
    }

    public boolean isValidEndpoint(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            return false;
        }
        return endpoint.startsWith("https://")
                || endpoint.startsWith("http://localhost")
                || endpoint.startsWith("http://127.0.0.1");
    }
}
