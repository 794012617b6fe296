package com.aegis.service;

import com.aegis.config.AegisProperties;
import com.aegis.model.TaskResult;
import com.aegis.model.dto.CacheStatistics;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Content-addressed store of successful task results with a per-entry TTL.
 *
 * Entries are deep copies in both directions, so neither the producer nor any
 * reader can mutate what the cache holds. Expired entries are dropped when they
 * are looked up (or during Caffeine's maintenance) and count as misses.
 */
@Slf4j
@Service
public class ResponseCache {

    private final Cache<String, CacheEntry> entries;
    private final Ticker ticker;
    private final boolean enabled;
    private final Duration defaultTtl;
    private final int maxEntries;

    @Autowired
    public ResponseCache(AegisProperties properties) {
        this(properties.getCache(), Ticker.systemTicker());
    }

    public ResponseCache(AegisProperties.CacheConfig config, Ticker ticker) {
        this.ticker = ticker;
        this.enabled = config.isEnabled();
        this.defaultTtl = config.getDefaultTtl();
        this.maxEntries = config.getMaxEntries();
        this.entries = Caffeine.newBuilder()
                .maximumSize(config.getMaxEntries())
                .expireAfter(new EntryTtl())
                .ticker(ticker)
                // maintenance on the calling thread keeps size() exact
                .executor(Runnable::run)
                .recordStats()
                .build();

        log.info("Response cache initialized: enabled={}, maxEntries={}, defaultTtl={}",
                enabled, maxEntries, defaultTtl);
    }

    /**
     * Look up a result. A hit returns a deep copy flagged as cached.
     */
    public Optional<TaskResult> get(String key) {
        if (!enabled || key == null) {
            return Optional.empty();
        }
        CacheEntry entry = entries.getIfPresent(key);
        if (entry == null) {
            log.debug("Cache miss: {}", key);
            return Optional.empty();
        }
        log.debug("Cache hit: {} (age {}ms)", key, Duration.ofNanos(ticker.read() - entry.insertedAtNanos()).toMillis());
        return Optional.of(entry.result().asCached());
    }

    /**
     * Store a result with the default TTL.
     */
    public void set(String key, TaskResult result) {
        set(key, result, defaultTtl);
    }

    /**
     * Store a successful result. Failed results are ignored so a transient
     * backend failure never poisons later identical requests.
     *
     * @throws IllegalArgumentException if the TTL is not positive
     */
    public void set(String key, TaskResult result, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }
        if (!enabled || key == null || result == null) {
            return;
        }
        if (!result.isSuccess()) {
            log.debug("Not caching failed result for {}", key);
            return;
        }
        entries.put(key, new CacheEntry(result.copy(), ticker.read(), ttl));
    }

    public void invalidate(String key) {
        entries.invalidate(key);
    }

    public void clear() {
        entries.invalidateAll();
        entries.cleanUp();
        log.info("Response cache cleared");
    }

    /**
     * Number of live entries.
     */
    public long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public CacheStatistics statistics() {
        CacheStats stats = entries.stats();
        return CacheStatistics.builder()
                .enabled(enabled)
                .entries(size())
                .maxEntries(maxEntries)
                .defaultTtlSeconds(defaultTtl.toSeconds())
                .hits(stats.hitCount())
                .misses(stats.missCount())
                .evictions(stats.evictionCount())
                .hitRate(stats.requestCount() == 0 ? 0.0 : stats.hitRate())
                .build();
    }

    private record CacheEntry(TaskResult result, long insertedAtNanos, Duration ttl) {
    }

    private static final class EntryTtl implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry value, long currentTime) {
            return lifetimeNanos(value.ttl());
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry value, long currentTime, long currentDuration) {
            return lifetimeNanos(value.ttl());
        }

        /**
         * Caffeine drops an entry once its age reaches the returned duration;
         * an entry whose age equals its TTL is still live.
         */
        private static long lifetimeNanos(Duration ttl) {
            long nanos = ttl.toNanos();
            return nanos == Long.MAX_VALUE ? nanos : nanos + 1;
        }

        @Override
        public long expireAfterRead(String key, CacheEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
