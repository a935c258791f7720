package org.replaysafe.datapipeline.services.pipeline.components;

import org.replaysafe.datapipeline.api.contracts.AnalyticalRow;
import org.replaysafe.datapipeline.api.contracts.FingerprintedEvent;
import org.replaysafe.datapipeline.api.resources.database.AnalyticalSinkException;
import org.replaysafe.datapipeline.api.resources.database.IAnalyticalWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Feeds the analytical store off the pipeline thread.
 * <p>
 * Every submitted batch gets a version from a monotonic microsecond clock at submit time, so
 * batches submitted later always carry higher versions and the store's last-write-wins
 * compaction keeps the newest data. Appends run on one background thread with their own
 * bounded retries. When the retries are exhausted, or the queue is full, the batch is given
 * up: an ERROR goes to the {@code org.replaysafe.datapipeline.alerts} logger and the
 * {@link FailureListener} is told. The pipeline never waits for this class.
 */
public class AnalyticalAppender implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AnalyticalAppender.class);
    private static final Logger alertLog = LoggerFactory.getLogger("org.replaysafe.datapipeline.alerts");

    /**
     * Receives batches the appender gave up on.
     */
    @FunctionalInterface
    public interface FailureListener {
        void onFailure(String code, String message, String details);
    }

    /**
     * Source of wall-clock microseconds.
     */
    @FunctionalInterface
    public interface MicrosClock {
        long nowMicros();
    }

    private final IAnalyticalWriter writer;
    private final int maxAttempts;
    private final BackoffCalculator backoff;
    private final long shutdownTimeoutMs;
    private final FailureListener failureListener;
    private final MicrosClock clock;
    private final ThreadPoolExecutor executor;

    private final Object versionLock = new Object();
    private long lastVersion;

    private final AtomicLong submittedBatches = new AtomicLong(0);
    private final AtomicLong appendedBatches = new AtomicLong(0);
    private final AtomicLong appendedRows = new AtomicLong(0);
    private final AtomicLong failedBatches = new AtomicLong(0);
    private final AtomicLong rejectedBatches = new AtomicLong(0);
    private final AtomicLong retries = new AtomicLong(0);

    public AnalyticalAppender(IAnalyticalWriter writer, String threadName, int queueCapacity, int maxAttempts,
                              BackoffCalculator backoff, long shutdownTimeoutMs, FailureListener failureListener) {
        this(writer, threadName, queueCapacity, maxAttempts, backoff, shutdownTimeoutMs, failureListener,
            AnalyticalAppender::systemMicros);
    }

    public AnalyticalAppender(IAnalyticalWriter writer, String threadName, int queueCapacity, int maxAttempts,
                              BackoffCalculator backoff, long shutdownTimeoutMs, FailureListener failureListener,
                              MicrosClock clock) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive, got: " + queueCapacity);
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive, got: " + maxAttempts);
        }
        this.writer = writer;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.shutdownTimeoutMs = shutdownTimeoutMs;
        this.failureListener = failureListener;
        this.clock = clock;
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            r -> {
                Thread t = new Thread(r, threadName);
                t.setDaemon(true);
                return t;
            },
            new ThreadPoolExecutor.AbortPolicy());
    }

    private static long systemMicros() {
        Instant now = Instant.now();
        return now.getEpochSecond() * 1_000_000L + now.getNano() / 1_000L;
    }

    /**
     * @return A version strictly greater than every version handed out before.
     */
    long nextVersion() {
        synchronized (versionLock) {
            lastVersion = Math.max(clock.nowMicros(), lastVersion + 1);
            return lastVersion;
        }
    }

    /**
     * Queues a batch for appending. Never blocks.
     *
     * @return {@code false} if the queue was full and the batch was given up.
     */
    public boolean submit(long batchId, List<FingerprintedEvent> events) {
        if (events.isEmpty()) {
            return true;
        }
        long version = nextVersion();
        List<AnalyticalRow> rows = events.stream().map(e -> AnalyticalRow.of(e, version)).toList();
        try {
            executor.execute(() -> appendWithRetry(batchId, rows));
            submittedBatches.incrementAndGet();
            return true;
        } catch (RejectedExecutionException e) {
            rejectedBatches.incrementAndGet();
            String message = executor.isShutdown()
                ? "Analytical appender is shut down"
                : "Analytical append queue is full";
            alertLog.error("{}, batch {} ({} rows) will not reach the analytical store", message, batchId, rows.size());
            failureListener.onFailure("ANALYTICAL_APPEND_REJECTED", message,
                String.format("Batch: %d, Rows: %d", batchId, rows.size()));
            return false;
        }
    }

    private void appendWithRetry(long batchId, List<AnalyticalRow> rows) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                writer.append(rows);
                appendedBatches.incrementAndGet();
                appendedRows.addAndGet(rows.size());
                return;
            } catch (AnalyticalSinkException e) {
                if (attempt == maxAttempts) {
                    giveUp(batchId, rows.size(), attempt, e.getMessage());
                    return;
                }
                retries.incrementAndGet();
                long delayMs = backoff.calculate(attempt);
                log.debug("Analytical append of batch {} failed (attempt {}/{}), retrying in {} ms: {}",
                    batchId, attempt, maxAttempts, delayMs, e.getMessage());
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    giveUp(batchId, rows.size(), attempt, "interrupted during backoff");
                    return;
                }
            } catch (RuntimeException e) {
                giveUp(batchId, rows.size(), attempt, e.getClass().getSimpleName() + ": " + e.getMessage());
                return;
            }
        }
    }

    private void giveUp(long batchId, int rowCount, int attempts, String reason) {
        failedBatches.incrementAndGet();
        alertLog.error("Analytical append of batch {} ({} rows) failed after {} attempts: {}",
            batchId, rowCount, attempts, reason);
        failureListener.onFailure("ANALYTICAL_APPEND_EXHAUSTED", "Analytical append failed after retries",
            String.format("Batch: %d, Rows: %d, Attempts: %d, Reason: %s", batchId, rowCount, attempts, reason));
    }

    /**
     * Stops accepting batches and waits for queued ones to finish.
     *
     * @return {@code true} if everything queued was processed within the timeout.
     */
    public boolean shutdown(long timeoutMs) {
        executor.shutdown();
        try {
            if (executor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                return true;
            }
            List<Runnable> dropped = executor.shutdownNow();
            log.warn("Analytical appender did not drain within {} ms, {} queued batches dropped", timeoutMs, dropped.size());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            List<Runnable> dropped = executor.shutdownNow();
            log.warn("Interrupted while draining analytical appender, {} queued batches dropped", dropped.size());
            return false;
        }
    }

    @Override
    public void close() {
        shutdown(shutdownTimeoutMs);
    }

    public long getPendingCount() {
        return executor.getQueue().size() + executor.getActiveCount();
    }

    public long getSubmittedBatches() {
        return submittedBatches.get();
    }

    public long getAppendedBatches() {
        return appendedBatches.get();
    }

    public long getAppendedRows() {
        return appendedRows.get();
    }

    public long getFailedBatches() {
        return failedBatches.get();
    }

    public long getRejectedBatches() {
        return rejectedBatches.get();
    }

    public long getRetryCount() {
        return retries.get();
    }
}
