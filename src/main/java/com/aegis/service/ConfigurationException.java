package com.aegis.service;

import java.util.List;

/**
 * Thrown when a backend configuration is rejected at registration time.
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> violations;

    public ConfigurationException(String message, List<String> violations) {
        super(message + ": " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
