package com.aegis.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Applies {@code aegis.security.log-level} to the {@code com.aegis} logger.
 */
@Slf4j
@Component
public class LogLevelApplier {

    static final String LOGGER_NAME = "com.aegis";

    private final AegisProperties properties;
    private final LoggingSystem loggingSystem;

    public LogLevelApplier(AegisProperties properties, LoggingSystem loggingSystem) {
        this.properties = properties;
        this.loggingSystem = loggingSystem;
    }

    @PostConstruct
    public void apply() {
        LogLevel level = parse(properties.getSecurity().getLogLevel());
        loggingSystem.setLogLevel(LOGGER_NAME, level);
        log.info("Log level for {} set to {}", LOGGER_NAME, level);
    }

    /**
     * Unknown or empty names fall back to INFO.
     */
    static LogLevel parse(String name) {
        if (name == null || name.isBlank()) {
            return LogLevel.INFO;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("WARNING")) {
            normalized = "WARN";
        }
        try {
            return LogLevel.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown log level '{}', using INFO", name);
            return LogLevel.INFO;
        }
    }
}
