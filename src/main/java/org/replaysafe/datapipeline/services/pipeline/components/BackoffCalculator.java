package org.replaysafe.datapipeline.services.pipeline.components;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter.
 * <pre>
 * delay  = min(baseDelay * 2^(attempt-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 * With baseDelay=100ms and jitterFactor=0.1: attempt 1 waits 100-110ms, attempt 2 200-220ms,
 * attempt 3 400-440ms, and so on until maxDelay.
 */
public class BackoffCalculator {

    // 2^30 * base already exceeds any sane maxDelay
    private static final int MAX_SHIFT = 30;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * @param attempt The attempt that just failed, starting at 1.
     * @return Milliseconds to wait before the next attempt.
     */
    public long calculate(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        int shift = Math.min(attempt - 1, MAX_SHIFT);
        long exponential = Math.min(baseDelayMs * (1L << shift), maxDelayMs);
        long jitter = jitterFactor == 0.0 ? 0L : (long) (exponential * jitterFactor * ThreadLocalRandom.current().nextDouble());
        return Math.min(exponential + jitter, maxDelayMs);
    }
}
