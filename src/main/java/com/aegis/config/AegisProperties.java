package com.aegis.config;

import com.aegis.model.TaskType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for Aegis.
 *
 * Layering (lowest to highest precedence): application.yml defaults,
 * /etc/aegis/ai-config.yml, ~/.config/aegis/ai-config.yml, ./ai-config.yml,
 * environment variables.
 */
@Data
@Component
@ConfigurationProperties(prefix = "aegis")
public class AegisProperties {

    private ServiceConfig service = new ServiceConfig();
    private CacheConfig cache = new CacheConfig();
    private RateLimitConfig rateLimiting = new RateLimitConfig();
    private SecurityConfig security = new SecurityConfig();
    private FeatureConfig features = new FeatureConfig();
    private AlertConfig alerts = new AlertConfig();

    /**
     * Keyed by backend id: openai, anthropic, custom, local.
     */
    private Map<String, ProviderConfig> providers = new LinkedHashMap<>();

    @Data
    public static class ServiceConfig {
        private boolean enabled = true;
        private int threadPoolSize = 8;
        private int queueCapacity = 256;
        private int defaultTimeout = 30;
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration shutdownGracePeriod = Duration.ofSeconds(30);
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        private int maxEntries = 1000;
        /**
         * Plain numbers are seconds.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration defaultTtl = Duration.ofHours(1);
        private boolean keyIncludesBackend = false;
    }

    @Data
    public static class RateLimitConfig {
        private boolean enabled = true;
        private int requestsPerMinute = 60;
        private boolean countCacheHits = true;
    }

    @Data
    public static class SecurityConfig {
        private boolean sanitizeData = true;
        private boolean auditEnabled = true;
        private String logLevel = "INFO";
        /**
         * Serialized payload plus context, in UTF-8 bytes. Zero or less disables the check.
         */
        private int maxPayloadBytes = 1024 * 1024;
        /**
         * Object/array nesting levels. Zero or less disables the check.
         */
        private int maxPayloadDepth = 32;
    }

    @Data
    public static class AlertConfig {
        private boolean enabled = true;
        private long checkIntervalMs = 60_000;
        /**
         * Failed share of all requests, 0.0 to 1.0.
         */
        private double errorRateThreshold = 0.5;
        private double responseTimeThresholdMs = 10_000;
        private int queueSizeThreshold = 200;
        /**
         * Error rate is not judged before this many requests.
         */
        private long minRequests = 10;
    }

    @Data
    public static class FeatureConfig {
        private boolean vulnerabilityAnalysis = true;
        private boolean threatModeling = true;
        private boolean scanOptimization = true;
        private boolean reportGeneration = true;
        private boolean exploitSuggestion = false;

        public boolean isEnabled(TaskType type) {
            return switch (type) {
                case VULNERABILITY_ANALYSIS -> vulnerabilityAnalysis;
                case THREAT_MODELING -> threatModeling;
                case SCAN_OPTIMIZATION -> scanOptimization;
                case REPORT_GENERATION -> reportGeneration;
                case EXPLOIT_SUGGESTION -> exploitSuggestion;
            };
        }
    }

    @Data
    public static class ProviderConfig {
        private boolean enabled = true;
        private String apiKey;
        private String model;
        private String endpoint;
        private Integer timeout;
    }
}
