package com.aegis.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response cache statistics for the cache endpoint and the metrics snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    private boolean enabled;

    /**
     * Live entries after expired ones have been purged.
     */
    private long entries;

    @JsonProperty("max_entries")
    private int maxEntries;

    @JsonProperty("default_ttl_seconds")
    private long defaultTtlSeconds;

    private long hits;

    /**
     * Includes lookups that found an expired entry.
     */
    private long misses;

    /**
     * Entries removed by expiry or size pressure.
     */
    private long evictions;

    @JsonProperty("hit_rate")
    private double hitRate;
}
