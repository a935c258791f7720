package org.replaysafe.datapipeline.utils.monitoring;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLongArray;

/**
 * Approximate latency percentiles over a sliding window of whole seconds.
 * <p>
 * Each second owns a fixed histogram of nanosecond latencies (1 ms up to 30 s, plus an
 * overflow bucket). A percentile is answered with the upper bound of the bucket that
 * contains it, which is precise enough for batch-level latencies.
 */
public class SlidingWindowPercentiles {

    private static final long[] BOUNDS_NANOS = {
            1_000_000L, 5_000_000L, 10_000_000L, 25_000_000L, 50_000_000L, 100_000_000L,
            250_000_000L, 500_000_000L, 1_000_000_000L, 2_500_000_000L, 5_000_000_000L,
            10_000_000_000L, 30_000_000_000L
    };

    // bucket counts followed by [count, sum]
    private static final int COUNT_SLOT = BOUNDS_NANOS.length + 1;
    private static final int SUM_SLOT = BOUNDS_NANOS.length + 2;

    private final ConcurrentHashMap<Long, AtomicLongArray> buckets = new ConcurrentHashMap<>();
    private final int windowSeconds;
    private final int maxBuckets;

    public SlidingWindowPercentiles(int windowSeconds) {
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("Window size must be positive, got: " + windowSeconds);
        }
        this.windowSeconds = windowSeconds;
        this.maxBuckets = windowSeconds + 5;
    }

    public void record(long nanos) {
        long currentSecond = Instant.now().getEpochSecond();
        AtomicLongArray histogram = buckets.computeIfAbsent(currentSecond, k -> new AtomicLongArray(SUM_SLOT + 1));
        int index = BOUNDS_NANOS.length;
        for (int i = 0; i < BOUNDS_NANOS.length; i++) {
            if (nanos < BOUNDS_NANOS[i]) {
                index = i;
                break;
            }
        }
        histogram.incrementAndGet(index);
        histogram.incrementAndGet(COUNT_SLOT);
        histogram.addAndGet(SUM_SLOT, nanos);
        if (buckets.size() > maxBuckets) {
            long cutoffSecond = currentSecond - windowSeconds - 1;
            buckets.keySet().removeIf(second -> second < cutoffSecond);
        }
    }

    /**
     * @param percentile Value in [0, 100].
     * @return Upper bucket bound in nanoseconds, 0 if nothing was recorded in the window.
     */
    public long getPercentile(double percentile) {
        if (percentile < 0 || percentile > 100) {
            throw new IllegalArgumentException("Percentile must be between 0 and 100, got: " + percentile);
        }
        long[] merged = mergeWindow();
        long total = merged[COUNT_SLOT];
        if (total == 0) {
            return 0;
        }
        long target = (long) Math.ceil(total * (percentile / 100.0));
        long accumulated = 0;
        for (int i = 0; i < BOUNDS_NANOS.length; i++) {
            accumulated += merged[i];
            if (accumulated >= target) {
                return BOUNDS_NANOS[i];
            }
        }
        return BOUNDS_NANOS[BOUNDS_NANOS.length - 1];
    }

    public double getAverage() {
        long[] merged = mergeWindow();
        return merged[COUNT_SLOT] == 0 ? 0.0 : (double) merged[SUM_SLOT] / merged[COUNT_SLOT];
    }

    public long getCount() {
        return mergeWindow()[COUNT_SLOT];
    }

    private long[] mergeWindow() {
        long currentSecond = Instant.now().getEpochSecond();
        long[] merged = new long[SUM_SLOT + 1];
        for (int i = 0; i < windowSeconds; i++) {
            AtomicLongArray histogram = buckets.get(currentSecond - i);
            if (histogram != null) {
                for (int slot = 0; slot < merged.length; slot++) {
                    merged[slot] += histogram.get(slot);
                }
            }
        }
        return merged;
    }
}
