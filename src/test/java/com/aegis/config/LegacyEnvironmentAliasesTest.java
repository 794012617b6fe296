package com.aegis.config;

import org.junit.jupiter.api.Test;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.PropertySource;
import org.springframework.core.env.StandardEnvironment;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LegacyEnvironmentAliases.
 */
class LegacyEnvironmentAliasesTest {

    @Test
    void testMapsLegacyNames() {
        Map<String, Object> aliases = LegacyEnvironmentAliases.aliases(Map.of(
                "AI_THREAD_POOL_SIZE", "4",
                "AI_CACHE_DEFAULT_TTL", "600",
                "AI_RATE_LIMIT_RPM", "30",
                "OPENAI_API_KEY", "sk-test-1234567890",
                "CLAUDE_MODEL", "claude-3-opus-20240229",
                "AI_VULN_ANALYSIS_ENABLED", "no"));

        assertEquals("4", aliases.get("aegis.service.thread-pool-size"));
        assertEquals("600", aliases.get("aegis.cache.default-ttl"));
        assertEquals("30", aliases.get("aegis.rate-limiting.requests-per-minute"));
        assertEquals("sk-test-1234567890", aliases.get("aegis.providers.openai.api-key"));
        assertEquals("claude-3-opus-20240229", aliases.get("aegis.providers.anthropic.model"));
        assertEquals("false", aliases.get("aegis.features.vulnerability-analysis"));
    }

    @Test
    void testBooleanSpellings() {
        for (String value : List.of("true", "TRUE", "yes", "Yes", "1", "on")) {
            assertEquals("true", LegacyEnvironmentAliases.aliases(Map.of("AI_CACHE_ENABLED", value))
                    .get("aegis.cache.enabled"), value);
        }
        for (String value : List.of("false", "0", "nope")) {
            assertEquals("false", LegacyEnvironmentAliases.aliases(Map.of("AI_CACHE_ENABLED", value))
                    .get("aegis.cache.enabled"), value);
        }
    }

    @Test
    void testBlankValuesIgnored() {
        assertTrue(LegacyEnvironmentAliases.aliases(Map.of("OPENAI_API_KEY", "  ", "PATH", "/usr/bin")).isEmpty());
    }

    @Test
    void testAliasesRankBelowEnvironmentAboveFiles() {
        Map<String, Object> env = Map.of("AI_RATE_LIMIT_RPM", "15", "AEGIS_CACHE_MAX_ENTRIES", "50");
        StandardEnvironment environment = new StandardEnvironment() {
            @Override
            public Map<String, Object> getSystemEnvironment() {
                return env;
            }
        };
        environment.getPropertySources().replace(StandardEnvironment.SYSTEM_ENVIRONMENT_PROPERTY_SOURCE_NAME,
                new MapPropertySource(StandardEnvironment.SYSTEM_ENVIRONMENT_PROPERTY_SOURCE_NAME, env));
        environment.getPropertySources().addLast(new MapPropertySource("applicationConfig", Map.of(
                "aegis.rate-limiting.requests-per-minute", "60")));

        new LegacyEnvironmentAliases().postProcessEnvironment(environment, null);

        assertEquals("15", environment.getProperty("aegis.rate-limiting.requests-per-minute"));
        int systemIndex = indexOf(environment, StandardEnvironment.SYSTEM_ENVIRONMENT_PROPERTY_SOURCE_NAME);
        int aliasIndex = indexOf(environment, LegacyEnvironmentAliases.SOURCE_NAME);
        int fileIndex = indexOf(environment, "applicationConfig");
        assertEquals(systemIndex + 1, aliasIndex);
        assertTrue(aliasIndex < fileIndex);
    }

    private static int indexOf(StandardEnvironment environment, String name) {
        int index = 0;
        for (PropertySource<?> source : environment.getPropertySources()) {
            if (source.getName().equals(name)) {
                return index;
            }
            index++;
        }
        return -1;
    }
}
