package org.replaysafe.datapipeline.utils.monitoring;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counter over a sliding window of whole seconds.
 * <p>
 * Recording is O(1) (one atomic add on the bucket of the current second); rates and sums
 * scan {@code windowSeconds} buckets. Old buckets are evicted once more than
 * {@code windowSeconds + 5} exist.
 * <pre>
 * SlidingWindowCounter merged = new SlidingWindowCounter(5);
 * merged.recordSum(batch.size());
 * double eventsPerSec = merged.getRate();
 * </pre>
 */
public class SlidingWindowCounter {

    private final ConcurrentHashMap<Long, AtomicLong> buckets = new ConcurrentHashMap<>();
    private final int windowSeconds;
    private final int maxBuckets;

    /**
     * @param windowSeconds Window size in seconds, typically 5.
     * @throws IllegalArgumentException if windowSeconds is not positive.
     */
    public SlidingWindowCounter(int windowSeconds) {
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("Window size must be positive, got: " + windowSeconds);
        }
        this.windowSeconds = windowSeconds;
        this.maxBuckets = windowSeconds + 5;
    }

    public void recordCount() {
        recordSum(1);
    }

    public void recordSum(long value) {
        long currentSecond = Instant.now().getEpochSecond();
        buckets.computeIfAbsent(currentSecond, k -> new AtomicLong()).addAndGet(value);
        cleanupIfNeeded(currentSecond);
    }

    /**
     * @return Average per second over the window ending now.
     */
    public double getRate() {
        return (double) getWindowSum(Instant.now().getEpochSecond()) / windowSeconds;
    }

    public long getWindowSum() {
        return getWindowSum(Instant.now().getEpochSecond());
    }

    long getWindowSum(long nowSeconds) {
        long total = 0;
        for (int i = 0; i < windowSeconds; i++) {
            AtomicLong bucket = buckets.get(nowSeconds - i);
            if (bucket != null) {
                total += bucket.get();
            }
        }
        return total;
    }

    private void cleanupIfNeeded(long currentSecond) {
        if (buckets.size() > maxBuckets) {
            long cutoffSecond = currentSecond - windowSeconds - 1;
            buckets.keySet().removeIf(second -> second < cutoffSecond);
        }
    }
}
