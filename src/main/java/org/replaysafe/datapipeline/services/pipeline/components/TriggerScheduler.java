package org.replaysafe.datapipeline.services.pipeline.components;

import org.replaysafe.datapipeline.api.resources.log.LogRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Decides when a window is closed and how it is cut into dispatches.
 * <p>
 * State machine, driven by the single pipeline thread:
 * <pre>
 * IDLE --awaitNextTrigger--&gt; ACCUMULATING --cut--&gt; CUTTING --&gt; DISPATCHING --dispatchComplete--&gt; IDLE
 *                                                      \--empty window--&gt; IDLE
 * </pre>
 * Boundaries lie on a fixed-rate grid of {@code triggerIntervalMs}. If a dispatch overruns one
 * or more boundaries, the next trigger fires immediately once the dispatch is done and the
 * boundaries in between are skipped: dispatches never overlap and never pile up.
 * <p>
 * A window larger than {@code maxRecordsPerTrigger} is split into consecutive chunks. Chunks
 * are cut from the window sorted by (partition, offset), so every chunk covers a prefix of each
 * partition's remaining records and its end offsets are well defined.
 * <p>
 * <strong>Thread Safety:</strong> mutators are called from the pipeline thread only;
 * {@link #getState()} and the counters may be read from any thread.
 */
public class TriggerScheduler {

    public enum State {
        IDLE,
        ACCUMULATING,
        CUTTING,
        DISPATCHING
    }

    /**
     * Blocks for the given time. Tests replace it to drive the scheduler without waiting.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleepNanos(long nanos) throws InterruptedException;
    }

    private static final Comparator<LogRecord> LOG_ORDER =
        Comparator.comparingInt(LogRecord::partition).thenComparingLong(LogRecord::offset);

    private final long intervalNanos;
    private final int maxRecordsPerTrigger;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;

    private volatile State state = State.IDLE;
    private long nextBoundary;
    private boolean started;

    private final AtomicLong triggers = new AtomicLong(0);
    private final AtomicLong idleTriggers = new AtomicLong(0);
    private final AtomicLong skippedBoundaries = new AtomicLong(0);
    private final AtomicLong dispatches = new AtomicLong(0);

    public TriggerScheduler(long triggerIntervalMs, int maxRecordsPerTrigger) {
        this(triggerIntervalMs, maxRecordsPerTrigger, System::nanoTime, TimeUnit.NANOSECONDS::sleep);
    }

    public TriggerScheduler(long triggerIntervalMs, int maxRecordsPerTrigger, LongSupplier nanoClock, Sleeper sleeper) {
        if (triggerIntervalMs <= 0) {
            throw new IllegalArgumentException("triggerIntervalMs must be positive, got: " + triggerIntervalMs);
        }
        if (maxRecordsPerTrigger <= 0) {
            throw new IllegalArgumentException("maxRecordsPerTrigger must be positive, got: " + maxRecordsPerTrigger);
        }
        this.intervalNanos = TimeUnit.MILLISECONDS.toNanos(triggerIntervalMs);
        this.maxRecordsPerTrigger = maxRecordsPerTrigger;
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
    }

    /**
     * Accumulates until the next boundary. Returns immediately if the boundary already passed.
     *
     * @throws InterruptedException if interrupted while waiting; the state returns to IDLE.
     */
    public void awaitNextTrigger() throws InterruptedException {
        state = State.ACCUMULATING;
        long now = nanoClock.getAsLong();
        if (!started) {
            started = true;
            nextBoundary = now + intervalNanos;
        }

        long due = nextBoundary;
        if (now > due) {
            long missed = (now - due) / intervalNanos;
            if (missed > 0) {
                skippedBoundaries.addAndGet(missed);
                due += missed * intervalNanos;
            }
        } else {
            try {
                long remaining = due - now;
                if (remaining > 0) {
                    sleeper.sleepNanos(remaining);
                }
            } catch (InterruptedException e) {
                state = State.IDLE;
                throw e;
            }
        }
        nextBoundary = due + intervalNanos;
    }

    /**
     * Closes the window and cuts it into chunks of at most {@code maxRecordsPerTrigger} records.
     *
     * @return The chunks in dispatch order; empty for an empty window, which is an idle trigger.
     */
    public List<List<LogRecord>> cut(List<LogRecord> window) {
        state = State.CUTTING;
        triggers.incrementAndGet();
        if (window.isEmpty()) {
            idleTriggers.incrementAndGet();
            state = State.IDLE;
            return List.of();
        }

        List<LogRecord> sorted = new ArrayList<>(window);
        sorted.sort(LOG_ORDER);
        List<List<LogRecord>> chunks = new ArrayList<>();
        for (int from = 0; from < sorted.size(); from += maxRecordsPerTrigger) {
            chunks.add(List.copyOf(sorted.subList(from, Math.min(from + maxRecordsPerTrigger, sorted.size()))));
        }
        dispatches.addAndGet(chunks.size());
        state = State.DISPATCHING;
        return chunks;
    }

    /**
     * Marks the end of the current dispatch sequence.
     */
    public void dispatchComplete() {
        state = State.IDLE;
    }

    /**
     * Forgets the boundary grid so the next trigger starts a fresh interval, e.g. after the
     * pipeline was paused.
     */
    public void reset() {
        started = false;
        state = State.IDLE;
    }

    public State getState() {
        return state;
    }

    public long getTriggerCount() {
        return triggers.get();
    }

    public long getIdleTriggerCount() {
        return idleTriggers.get();
    }

    public long getSkippedBoundaryCount() {
        return skippedBoundaries.get();
    }

    public long getDispatchCount() {
        return dispatches.get();
    }
}
