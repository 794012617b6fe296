package com.aegis.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * External AI backends the orchestrator can route to.
 */
public enum BackendKind {

    OPENAI("openai", "OpenAI",
            "https://api.openai.com/v1/chat/completions", "gpt-4"),
    ANTHROPIC("anthropic", "Claude",
            "https://api.anthropic.com/v1/messages", "claude-3-sonnet-20240229"),
    CUSTOM("custom", "Custom",
            "http://localhost:8080/v1/chat/completions", "local-model"),
    LOCAL("local", "Local",
            "http://localhost:8080/v1/chat/completions", "local-model");

    private final String id;
    private final String displayName;
    private final String defaultEndpoint;
    private final String defaultModel;

    BackendKind(String id, String displayName, String defaultEndpoint, String defaultModel) {
        this.id = id;
        this.displayName = displayName;
        this.defaultEndpoint = defaultEndpoint;
        this.defaultModel = defaultModel;
    }

    /**
     * Configuration id, e.g. "openai". Used as property key and metric tag.
     */
    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDefaultEndpoint() {
        return defaultEndpoint;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    /**
     * Resolve a kind from its id or enum name, case-insensitively.
     * "claude" is accepted as an alias for {@link #ANTHROPIC}.
     */
    public static Optional<BackendKind> fromId(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("claude".equals(normalized)) {
            return Optional.of(ANTHROPIC);
        }
        return Arrays.stream(values())
                .filter(kind -> kind.id.equals(normalized) || kind.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
