package com.aegis.service.metrics;

import com.aegis.model.dto.LatencySnapshot;

import java.util.Arrays;

/**
 * Running min/max/avg over all samples plus percentiles over a ring of recent samples.
 */
public class LatencyStats {

    static final int DEFAULT_WINDOW = 1024;

    private final long[] recent;
    private int next;
    private int filled;
    private long count;
    private long sum;
    private long min = Long.MAX_VALUE;
    private long max;

    public LatencyStats() {
        this(DEFAULT_WINDOW);
    }

    public LatencyStats(int window) {
        this.recent = new long[window];
    }

    public synchronized void record(long millis) {
        long value = Math.max(0L, millis);
        recent[next] = value;
        next = (next + 1) % recent.length;
        filled = Math.min(filled + 1, recent.length);
        count++;
        sum += value;
        min = Math.min(min, value);
        max = Math.max(max, value);
    }

    public synchronized long count() {
        return count;
    }

    public synchronized double average() {
        return count == 0 ? 0.0 : (double) sum / count;
    }

    public synchronized void reset() {
        Arrays.fill(recent, 0L);
        next = 0;
        filled = 0;
        count = 0;
        sum = 0;
        min = Long.MAX_VALUE;
        max = 0;
    }

    public LatencySnapshot snapshot() {
        long[] samples;
        long count;
        long sum;
        long min;
        long max;
        synchronized (this) {
            samples = Arrays.copyOf(recent, filled);
            count = this.count;
            sum = this.sum;
            min = this.min;
            max = this.max;
        }
        // sort outside the lock
        Arrays.sort(samples);

        return LatencySnapshot.builder()
                .count(count)
                .minMs(count == 0 ? 0.0 : min)
                .maxMs(max)
                .avgMs(count == 0 ? 0.0 : (double) sum / count)
                .p50Ms(percentile(samples, 50.0))
                .p95Ms(percentile(samples, 95.0))
                .p99Ms(percentile(samples, 99.0))
                .build();
    }

    /**
     * Nearest-rank percentile of sorted samples; 0 when empty.
     */
    static double percentile(long[] sorted, double percentile) {
        if (sorted.length == 0) {
            return 0.0;
        }
        int rank = (int) Math.ceil(percentile / 100.0 * sorted.length);
        int index = Math.min(sorted.length - 1, Math.max(0, rank - 1));
        return sorted[index];
    }
}
