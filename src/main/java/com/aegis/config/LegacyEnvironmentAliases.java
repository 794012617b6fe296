package com.aegis.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.MutablePropertySources;
import org.springframework.core.env.StandardEnvironment;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps the engine's historical environment variables (AI_*, OPENAI_*, CLAUDE_*)
 * onto {@code aegis.*} properties.
 *
 * <p>The aliases sit directly below the system environment: they override every
 * config file, while a canonical {@code AEGIS_*} variable still wins over its
 * legacy spelling.
 */
public class LegacyEnvironmentAliases implements EnvironmentPostProcessor, Ordered {

    private static final Logger log = LoggerFactory.getLogger(LegacyEnvironmentAliases.class);

    static final String SOURCE_NAME = "aegisLegacyEnvironment";

    private static final Set<String> TRUE_VALUES = Set.of("true", "yes", "1", "on");

    private static final Map<String, String> BOOLEANS = new LinkedHashMap<>();
    private static final Map<String, String> VALUES = new LinkedHashMap<>();

    static {
        BOOLEANS.put("AI_SERVICE_ENABLED", "aegis.service.enabled");
        BOOLEANS.put("AI_CACHE_ENABLED", "aegis.cache.enabled");
        BOOLEANS.put("AI_RATE_LIMIT_ENABLED", "aegis.rate-limiting.enabled");
        BOOLEANS.put("AI_SANITIZE_DATA", "aegis.security.sanitize-data");
        BOOLEANS.put("AI_AUDIT_ENABLED", "aegis.security.audit-enabled");
        BOOLEANS.put("AI_VULN_ANALYSIS_ENABLED", "aegis.features.vulnerability-analysis");
        BOOLEANS.put("AI_THREAT_MODELING_ENABLED", "aegis.features.threat-modeling");
        BOOLEANS.put("AI_SCAN_OPTIMIZATION_ENABLED", "aegis.features.scan-optimization");
        BOOLEANS.put("AI_REPORT_GENERATION_ENABLED", "aegis.features.report-generation");
        BOOLEANS.put("AI_EXPLOIT_SUGGESTION_ENABLED", "aegis.features.exploit-suggestion");

        VALUES.put("AI_THREAD_POOL_SIZE", "aegis.service.thread-pool-size");
        VALUES.put("AI_DEFAULT_TIMEOUT", "aegis.service.default-timeout");
        VALUES.put("AI_CACHE_MAX_ENTRIES", "aegis.cache.max-entries");
        VALUES.put("AI_CACHE_DEFAULT_TTL", "aegis.cache.default-ttl");
        VALUES.put("AI_RATE_LIMIT_RPM", "aegis.rate-limiting.requests-per-minute");
        VALUES.put("AI_LOG_LEVEL", "aegis.security.log-level");

        VALUES.put("OPENAI_API_KEY", "aegis.providers.openai.api-key");
        VALUES.put("OPENAI_MODEL", "aegis.providers.openai.model");
        VALUES.put("OPENAI_ENDPOINT", "aegis.providers.openai.endpoint");
        VALUES.put("OPENAI_TIMEOUT", "aegis.providers.openai.timeout");
        VALUES.put("ANTHROPIC_API_KEY", "aegis.providers.anthropic.api-key");
        VALUES.put("CLAUDE_MODEL", "aegis.providers.anthropic.model");
        VALUES.put("CLAUDE_ENDPOINT", "aegis.providers.anthropic.endpoint");
        VALUES.put("CLAUDE_TIMEOUT", "aegis.providers.anthropic.timeout");
    }

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment env, SpringApplication application) {
        Map<String, Object> aliases = aliases(env.getSystemEnvironment());
        if (aliases.isEmpty()) {
            return;
        }

        MutablePropertySources sources = env.getPropertySources();
        MapPropertySource source = new MapPropertySource(SOURCE_NAME, aliases);
        if (sources.contains(StandardEnvironment.SYSTEM_ENVIRONMENT_PROPERTY_SOURCE_NAME)) {
            sources.addAfter(StandardEnvironment.SYSTEM_ENVIRONMENT_PROPERTY_SOURCE_NAME, source);
        } else {
            sources.addFirst(source);
        }
        // keys only, values may be credentials
        log.info("Applied legacy environment aliases: {}", aliases.keySet());
    }

    /**
     * Translate legacy variables present in {@code env} into {@code aegis.*} properties.
     */
    static Map<String, Object> aliases(Map<String, ?> env) {
        Map<String, Object> aliases = new LinkedHashMap<>();
        BOOLEANS.forEach((variable, property) -> {
            String value = trimToNull(env.get(variable));
            if (value != null) {
                aliases.put(property, String.valueOf(TRUE_VALUES.contains(value.toLowerCase(Locale.ROOT))));
            }
        });
        VALUES.forEach((variable, property) -> {
            String value = trimToNull(env.get(variable));
            if (value != null) {
                aliases.put(property, value);
            }
        });
        return aliases;
    }

    private static String trimToNull(Object value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.toString().trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    @Override
    public int getOrder() {
        // after config data files have been loaded
        return Ordered.LOWEST_PRECEDENCE;
    }
}
