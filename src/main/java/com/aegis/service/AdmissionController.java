package com.aegis.service;

import com.aegis.config.AegisProperties;
import com.aegis.model.BackendKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-backend fixed-window request counter.
 *
 * Advisory only: a denied request is neither queued nor delayed. Each window is
 * its own monitor, so traffic to one backend never waits on another's lock.
 */
@Slf4j
@Service
public class AdmissionController {

    static final Duration WINDOW = Duration.ofSeconds(60);

    private final Map<BackendKind, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;
    private final boolean enabled;
    private final int requestsPerMinute;

    @Autowired
    public AdmissionController(AegisProperties properties) {
        this(properties.getRateLimiting(), Clock.systemUTC());
    }

    public AdmissionController(AegisProperties.RateLimitConfig config, Clock clock) {
        if (config.getRequestsPerMinute() <= 0) {
            throw new IllegalArgumentException("requests-per-minute must be positive: " + config.getRequestsPerMinute());
        }
        this.clock = clock;
        this.enabled = config.isEnabled();
        this.requestsPerMinute = config.getRequestsPerMinute();
        log.info("Admission control initialized: enabled={}, requestsPerMinute={}", enabled, requestsPerMinute);
    }

    /**
     * Create the window for a backend up front (called when a backend is registered).
     */
    public void track(BackendKind kind) {
        window(kind);
    }

    /**
     * Admit one request for {@code kind} if its window has room, consuming a slot.
     *
     * @return true if admitted
     */
    public boolean check(BackendKind kind) {
        if (!enabled) {
            return true;
        }
        boolean admitted = window(kind).tryAcquire(clock.instant());
        if (!admitted) {
            log.warn("Rate limit exceeded for {} ({} requests/minute)", kind.getId(), requestsPerMinute);
        }
        return admitted;
    }

    /**
     * Slots left in the current window.
     */
    public int remaining(BackendKind kind) {
        if (!enabled) {
            return requestsPerMinute;
        }
        return window(kind).remaining(clock.instant());
    }

    /**
     * Start a fresh window for {@code kind} immediately.
     */
    public void reset(BackendKind kind) {
        window(kind).restart(clock.instant());
        log.info("Rate limit window reset for {}", kind.getId());
    }

    public Map<BackendKind, Integer> remainingByBackend() {
        Map<BackendKind, Integer> remaining = new EnumMap<>(BackendKind.class);
        windows.keySet().forEach(kind -> remaining.put(kind, remaining(kind)));
        return remaining;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int getRequestsPerMinute() {
        return requestsPerMinute;
    }

    private Window window(BackendKind kind) {
        return windows.computeIfAbsent(kind, k -> new Window(requestsPerMinute, clock.instant()));
    }

    private static final class Window {

        private final int ceiling;
        private int count;
        private Instant start;

        Window(int ceiling, Instant start) {
            this.ceiling = ceiling;
            this.start = start;
        }

        synchronized boolean tryAcquire(Instant now) {
            rollIfExpired(now);
            if (count >= ceiling) {
                return false;
            }
            count++;
            return true;
        }

        synchronized int remaining(Instant now) {
            rollIfExpired(now);
            return ceiling - count;
        }

        synchronized void restart(Instant now) {
            count = 0;
            start = now;
        }

        private void rollIfExpired(Instant now) {
            if (Duration.between(start, now).compareTo(WINDOW) >= 0) {
                count = 0;
                start = now;
            }
        }
    }
}
