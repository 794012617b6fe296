package com.aegis.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of analysis a caller can request.
 */
public enum TaskType {

    VULNERABILITY_ANALYSIS("vulnerability-analysis", "Vulnerability Analysis"),
    THREAT_MODELING("threat-modeling", "Threat Modeling"),
    SCAN_OPTIMIZATION("scan-optimization", "Scan Optimization"),
    REPORT_GENERATION("report-generation", "Report Generation"),
    EXPLOIT_SUGGESTION("exploit-suggestion", "Exploit Suggestion");

    private final String id;
    private final String displayName;

    TaskType(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    /**
     * Feature-flag id, e.g. "threat-modeling".
     */
    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Accepts the id ("threat-modeling"), the enum name ("THREAT_MODELING")
     * or the snake_case form ("threat_modeling").
     */
    public static Optional<TaskType> fromId(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
                .filter(type -> type.id.equals(normalized))
                .findFirst();
    }
}
