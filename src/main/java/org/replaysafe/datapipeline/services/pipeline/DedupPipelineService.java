package org.replaysafe.datapipeline.services.pipeline;

import com.typesafe.config.Config;
import org.replaysafe.datapipeline.api.contracts.BatchStats;
import org.replaysafe.datapipeline.api.contracts.Checkpoint;
import org.replaysafe.datapipeline.api.contracts.FingerprintedEvent;
import org.replaysafe.datapipeline.api.contracts.MergeResult;
import org.replaysafe.datapipeline.api.resources.IResource;
import org.replaysafe.datapipeline.api.resources.database.IAnalyticalWriter;
import org.replaysafe.datapipeline.api.resources.database.ICheckpointStore;
import org.replaysafe.datapipeline.api.resources.database.IMergeTableWriter;
import org.replaysafe.datapipeline.api.resources.database.StorageException;
import org.replaysafe.datapipeline.api.resources.log.IEventLogReader;
import org.replaysafe.datapipeline.api.resources.log.LogRecord;
import org.replaysafe.datapipeline.api.resources.parking.IParkedBatchStore;
import org.replaysafe.datapipeline.api.resources.parking.ParkedBatch;
import org.replaysafe.datapipeline.services.AbstractService;
import org.replaysafe.datapipeline.services.pipeline.components.AnalyticalAppender;
import org.replaysafe.datapipeline.services.pipeline.components.BackoffCalculator;
import org.replaysafe.datapipeline.services.pipeline.components.BatchDeduplicator;
import org.replaysafe.datapipeline.services.pipeline.components.BatchStatsLogger;
import org.replaysafe.datapipeline.services.pipeline.components.BatchTooLargeException;
import org.replaysafe.datapipeline.services.pipeline.components.CheckpointManager;
import org.replaysafe.datapipeline.services.pipeline.components.DedupPolicy;
import org.replaysafe.datapipeline.services.pipeline.components.EventSchema;
import org.replaysafe.datapipeline.services.pipeline.components.KeyDeriver;
import org.replaysafe.datapipeline.services.pipeline.components.MissingFieldException;
import org.replaysafe.datapipeline.services.pipeline.components.TriggerScheduler;
import org.replaysafe.datapipeline.services.pipeline.components.WindowProcessor;
import org.replaysafe.datapipeline.utils.monitoring.SlidingWindowCounter;
import org.replaysafe.datapipeline.utils.monitoring.SlidingWindowPercentiles;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The micro-batch deduplication pipeline.
 * <p>
 * One service thread runs the loop: wait for the trigger boundary, poll the window from the
 * event log, cut it into dispatches, and for each dispatch derive keys and deduplicate (fanned
 * out per partition), merge into the transactional table, advance the checkpoint, and hand the
 * batch to the analytical appender. Merges never overlap. A checkpoint is only written after
 * the merge of the same batch has committed, so a crash in between replays records whose merge
 * is a no-op.
 * <p>
 * Merge conflicts and timeouts are retried with exponential backoff, and so are failed checkpoint
 * commits. When the retries are exhausted, or the store is unavailable, the batch is parked and the
 * service pauses itself without moving its offsets past the last durable checkpoint;
 * {@link #resume()} restarts from there.
 * <p>
 * <strong>Resources:</strong>
 * <ul>
 *   <li>{@code log} ({@code log-read}, required): the event log.</li>
 *   <li>{@code merge} ({@code db-merge}, required): the transactional merge table.</li>
 *   <li>{@code checkpoint} ({@code db-checkpoint}, required): the checkpoint table.</li>
 *   <li>{@code analytical} ({@code db-analytical}, optional): the analytical store.</li>
 *   <li>{@code parked} (optional): where parked batches are recorded.</li>
 * </ul>
 * <strong>Options:</strong> {@code pipelineId}, {@code triggerIntervalMs}, {@code maxRecordsPerTrigger},
 * {@code maxWindowRecords}, {@code maxBatchRecords}, {@code parallelism}, {@code dedupPolicy},
 * {@code merge.{maxAttempts,baseDelayMs,maxDelayMs,jitterFactor}},
 * {@code analytical.{queueCapacity,maxAttempts,baseDelayMs,maxDelayMs,shutdownTimeoutMs}}.
 */
public class DedupPipelineService extends AbstractService {

    private record MergeOutcome(MergeResult result, int attempts, StorageException failure) {
    }

    private record CheckpointOutcome(int attempts, StorageException failure) {
    }

    private final String pipelineId;
    private final long triggerIntervalMs;
    private final int maxRecordsPerTrigger;
    private final int maxWindowRecords;
    private final int maxBatchRecords;
    private final int parallelism;
    private final DedupPolicy dedupPolicy;
    private final int mergeMaxAttempts;
    private final BackoffCalculator mergeBackoff;
    private final int analyticalQueueCapacity;
    private final int analyticalMaxAttempts;
    private final BackoffCalculator analyticalBackoff;
    private final long analyticalShutdownTimeoutMs;

    private final IEventLogReader logReader;
    private final IMergeTableWriter mergeWriter;
    private final ICheckpointStore checkpointStore;
    private final Optional<IAnalyticalWriter> analyticalWriter;
    private final Optional<IParkedBatchStore> parkedStore;

    private final EventSchema schema = new EventSchema();
    private final KeyDeriver keyDeriver = new KeyDeriver();
    private final BatchStatsLogger statsLogger = new BatchStatsLogger();
    private final CheckpointManager checkpointManager;

    // rebuilt on every start
    private volatile TriggerScheduler scheduler;
    private volatile WindowProcessor windowProcessor;
    private volatile AnalyticalAppender appender;

    // pipeline thread only
    private Map<Integer, Long> offsets = new HashMap<>();
    private long nextBatchId = 1L;

    private final AtomicLong batchesCommitted = new AtomicLong(0);
    private final AtomicLong recordsProcessed = new AtomicLong(0);
    private final AtomicLong recordsSkipped = new AtomicLong(0);
    private final AtomicLong duplicatesDropped = new AtomicLong(0);
    private final AtomicLong rowsInserted = new AtomicLong(0);
    private final AtomicLong rowsUpdated = new AtomicLong(0);
    private final AtomicLong rowsUnchanged = new AtomicLong(0);
    private final AtomicLong mergeRetries = new AtomicLong(0);
    private final AtomicLong parkedBatches = new AtomicLong(0);
    private final AtomicLong checkpointFailures = new AtomicLong(0);
    private final AtomicLong batchSplits = new AtomicLong(0);
    private final AtomicLong lastCommittedBatchId = new AtomicLong(0);
    private final SlidingWindowCounter recordThroughput;
    private final SlidingWindowPercentiles batchLatency;

    public DedupPipelineService(String name, Config options, Map<String, List<IResource>> resources) {
        super(name, options, resources);

        this.pipelineId = options.hasPath("pipelineId") ? options.getString("pipelineId") : name;
        this.triggerIntervalMs = options.hasPath("triggerIntervalMs") ? options.getLong("triggerIntervalMs") : 1000L;
        this.maxRecordsPerTrigger = options.hasPath("maxRecordsPerTrigger") ? options.getInt("maxRecordsPerTrigger") : 10_000;
        this.maxWindowRecords = options.hasPath("maxWindowRecords") ? options.getInt("maxWindowRecords") : maxRecordsPerTrigger * 10;
        this.maxBatchRecords = options.hasPath("maxBatchRecords") ? options.getInt("maxBatchRecords") : maxRecordsPerTrigger;
        this.parallelism = options.hasPath("parallelism") ? options.getInt("parallelism") : 4;
        this.dedupPolicy = options.hasPath("dedupPolicy")
            ? DedupPolicy.valueOf(options.getString("dedupPolicy").toUpperCase(Locale.ROOT))
            : DedupPolicy.FIRST_ARRIVAL;

        this.mergeMaxAttempts = options.hasPath("merge.maxAttempts") ? options.getInt("merge.maxAttempts") : 5;
        this.mergeBackoff = new BackoffCalculator(
            options.hasPath("merge.baseDelayMs") ? options.getLong("merge.baseDelayMs") : 100L,
            options.hasPath("merge.maxDelayMs") ? options.getLong("merge.maxDelayMs") : 5_000L,
            options.hasPath("merge.jitterFactor") ? options.getDouble("merge.jitterFactor") : 0.1);

        this.analyticalQueueCapacity = options.hasPath("analytical.queueCapacity") ? options.getInt("analytical.queueCapacity") : 64;
        this.analyticalMaxAttempts = options.hasPath("analytical.maxAttempts") ? options.getInt("analytical.maxAttempts") : 5;
        this.analyticalBackoff = new BackoffCalculator(
            options.hasPath("analytical.baseDelayMs") ? options.getLong("analytical.baseDelayMs") : 200L,
            options.hasPath("analytical.maxDelayMs") ? options.getLong("analytical.maxDelayMs") : 10_000L,
            options.hasPath("analytical.jitterFactor") ? options.getDouble("analytical.jitterFactor") : 0.1);
        this.analyticalShutdownTimeoutMs = options.hasPath("analytical.shutdownTimeoutMs")
            ? options.getLong("analytical.shutdownTimeoutMs")
            : 10_000L;

        if (mergeMaxAttempts <= 0) {
            throw new IllegalArgumentException("merge.maxAttempts must be positive, got: " + mergeMaxAttempts);
        }
        if (maxWindowRecords <= 0) {
            throw new IllegalArgumentException("maxWindowRecords must be positive, got: " + maxWindowRecords);
        }

        this.logReader = getRequiredResource("log", IEventLogReader.class);
        this.mergeWriter = getRequiredResource("merge", IMergeTableWriter.class);
        this.checkpointStore = getRequiredResource("checkpoint", ICheckpointStore.class);
        this.analyticalWriter = getOptionalResource("analytical", IAnalyticalWriter.class);
        this.parkedStore = getOptionalResource("parked", IParkedBatchStore.class);

        this.checkpointManager = new CheckpointManager(checkpointStore, pipelineId);

        int metricsWindowSeconds = options.hasPath("metricsWindowSeconds") ? options.getInt("metricsWindowSeconds") : 5;
        this.recordThroughput = new SlidingWindowCounter(metricsWindowSeconds);
        this.batchLatency = new SlidingWindowPercentiles(metricsWindowSeconds);
        this.scheduler = new TriggerScheduler(triggerIntervalMs, maxRecordsPerTrigger);
    }

    @Override
    protected void logStarted() {
        log.info("{} started: pipeline={}, triggerIntervalMs={}, maxRecordsPerTrigger={}, dedupPolicy={}, parallelism={}, analytical={}",
            getClass().getSimpleName(), pipelineId, triggerIntervalMs, maxRecordsPerTrigger, dedupPolicy, parallelism,
            analyticalWriter.isPresent() ? "enabled" : "disabled");
    }

    @Override
    protected void run() throws InterruptedException {
        scheduler = new TriggerScheduler(triggerIntervalMs, maxRecordsPerTrigger);
        windowProcessor = new WindowProcessor(schema, keyDeriver, new BatchDeduplicator(dedupPolicy, maxBatchRecords),
            parallelism, serviceName + "-worker", this::onInvalidRecord);
        appender = analyticalWriter
            .map(writer -> new AnalyticalAppender(writer, serviceName + "-analytical", analyticalQueueCapacity,
                analyticalMaxAttempts, analyticalBackoff, analyticalShutdownTimeoutMs, this::recordError))
            .orElse(null);
        try {
            recover();
            while (!Thread.currentThread().isInterrupted()) {
                if (checkPause()) {
                    recover();
                    scheduler.reset();
                }
                scheduler.awaitNextTrigger();
                List<LogRecord> window = logReader.poll(offsets, maxWindowRecords);
                List<List<LogRecord>> chunks = scheduler.cut(window);
                try {
                    for (List<LogRecord> chunk : chunks) {
                        if (Thread.currentThread().isInterrupted()) {
                            log.debug("Stop requested, leaving {} undispatched records to the next start", window.size());
                            break;
                        }
                        if (!processChunk(chunk)) {
                            break;
                        }
                    }
                } finally {
                    scheduler.dispatchComplete();
                }
            }
        } finally {
            shutdownComponents();
        }
    }

    private void recover() {
        Checkpoint checkpoint;
        try {
            checkpoint = runUninterruptibly(checkpointManager::recover);
        } catch (StorageException e) {
            throw new IllegalStateException("Cannot recover checkpoint of pipeline '" + pipelineId + "': " + e.getMessage(), e);
        }
        offsets = new HashMap<>(checkpoint.offsets());
        nextBatchId = checkpoint.batchId() + 1;
        lastCommittedBatchId.set(checkpoint.batchId());
        if (checkpoint.isEmpty()) {
            log.info("No checkpoint for pipeline '{}', reading all partitions from the start", pipelineId);
        } else {
            log.info("Recovered checkpoint of pipeline '{}': batch {}, offsets {}", pipelineId, checkpoint.batchId(),
                new TreeMap<>(checkpoint.offsets()));
        }
    }

    /**
     * Processes one dispatch.
     *
     * @return {@code false} if the batch was parked or a stop was requested, so the rest of the
     *         window must not be dispatched.
     */
    private boolean processChunk(List<LogRecord> chunk) throws InterruptedException {
        long startNanos = System.nanoTime();
        WindowProcessor.ProcessedWindow processed;
        try {
            processed = windowProcessor.process(chunk);
        } catch (BatchTooLargeException e) {
            batchSplits.incrementAndGet();
            int mid = chunk.size() / 2;
            log.debug("Dispatch of {} records exceeds maxBatchRecords={}, splitting in two", chunk.size(), e.getLimit());
            return processChunk(chunk.subList(0, mid))
                && !Thread.currentThread().isInterrupted()
                && processChunk(chunk.subList(mid, chunk.size()));
        }

        Map<Integer, Long> chunkOffsets = new HashMap<>(offsets);
        for (LogRecord record : chunk) {
            chunkOffsets.merge(record.partition(), record.offset(), Math::max);
        }

        long batchId = nextBatchId;
        List<FingerprintedEvent> unique = processed.unique();
        MergeOutcome outcome = unique.isEmpty()
            ? new MergeOutcome(MergeResult.EMPTY, 0, null)
            : mergeWithRetry(batchId, unique);

        if (outcome.failure() != null) {
            String reason = outcome.failure().isRetryable() ? "RETRIES_EXHAUSTED" : "STORAGE_UNAVAILABLE";
            park(batchId, chunkOffsets, unique.size(), outcome.attempts(), reason, outcome.failure());
            logStats(batchId, processed, outcome, startNanos, BatchStats.Outcome.PARKED);
            return false;
        }

        // offsets stay behind until the checkpoint is durable, so a replay never spans more than this batch
        checkpointManager.recordMergeCommitted(batchId);
        CheckpointOutcome checkpoint = commitCheckpointWithRetry(batchId, chunkOffsets);
        if (checkpoint.failure() != null) {
            recordError("CHECKPOINT_COMMIT_FAILED", "Checkpoint commit failed after merge",
                String.format("Pipeline: %s, Batch: %d, Error: %s", pipelineId, batchId, checkpoint.failure().getMessage()));
            park(batchId, chunkOffsets, unique.size(), checkpoint.attempts(), "CHECKPOINT_FAILED", checkpoint.failure());
            logStats(batchId, processed, outcome, startNanos, BatchStats.Outcome.CHECKPOINT_FAILED);
            return false;
        }
        lastCommittedBatchId.set(batchId);
        offsets = chunkOffsets;
        nextBatchId = batchId + 1;

        if (appender != null && !unique.isEmpty()) {
            appender.submit(batchId, unique);
        }

        batchesCommitted.incrementAndGet();
        recordsProcessed.addAndGet(processed.recordCount());
        recordsSkipped.addAndGet(processed.skippedInvalid());
        duplicatesDropped.addAndGet(processed.duplicatesInBatch());
        rowsInserted.addAndGet(outcome.result().rowsInserted());
        rowsUpdated.addAndGet(outcome.result().rowsUpdated());
        rowsUnchanged.addAndGet(outcome.result().rowsUnchanged());
        recordThroughput.recordSum(processed.recordCount());
        logStats(batchId, processed, outcome, startNanos, BatchStats.Outcome.COMMITTED);
        return true;
    }

    private MergeOutcome mergeWithRetry(long batchId, List<FingerprintedEvent> unique) throws InterruptedException {
        StorageException lastFailure = null;
        int attempt = 0;
        while (attempt < mergeMaxAttempts) {
            attempt++;
            try {
                MergeResult result = runUninterruptibly(() -> mergeWriter.merge(unique));
                return new MergeOutcome(result, attempt, null);
            } catch (StorageException e) {
                lastFailure = e;
                if (!e.isRetryable()) {
                    break;
                }
                if (attempt < mergeMaxAttempts) {
                    long delayMs = mergeBackoff.calculate(attempt);
                    mergeRetries.incrementAndGet();
                    log.warn("Merge of batch {} failed (attempt {}/{}), retrying in {} ms: {}",
                        batchId, attempt, mergeMaxAttempts, delayMs, e.getMessage());
                    TimeUnit.MILLISECONDS.sleep(delayMs);
                }
            }
        }
        return new MergeOutcome(MergeResult.EMPTY, attempt, lastFailure);
    }

    /**
     * Retries the checkpoint commit with the merge backoff. Non-retryable failures are not retried.
     */
    private CheckpointOutcome commitCheckpointWithRetry(long batchId, Map<Integer, Long> chunkOffsets) throws InterruptedException {
        StorageException lastFailure = null;
        int attempt = 0;
        while (attempt < mergeMaxAttempts) {
            attempt++;
            try {
                runUninterruptibly(() -> {
                    checkpointManager.commit(batchId, chunkOffsets);
                    return null;
                });
                return new CheckpointOutcome(attempt, null);
            } catch (StorageException e) {
                lastFailure = e;
                checkpointFailures.incrementAndGet();
                if (!e.isRetryable()) {
                    break;
                }
                if (attempt < mergeMaxAttempts) {
                    long delayMs = mergeBackoff.calculate(attempt);
                    log.warn("Checkpoint commit of batch {} failed (attempt {}/{}), retrying in {} ms: {}",
                        batchId, attempt, mergeMaxAttempts, delayMs, e.getMessage());
                    TimeUnit.MILLISECONDS.sleep(delayMs);
                }
            }
        }
        return new CheckpointOutcome(attempt, lastFailure);
    }

    private void park(long batchId, Map<Integer, Long> toOffsets, int recordCount, int attempts, String reason,
                      StorageException failure) {
        ParkedBatch parked = new ParkedBatch(pipelineId, batchId, checkpointManager.getCommittedOffsets(), Map.copyOf(toOffsets),
            recordCount, reason, failure.getMessage(), attempts, Instant.now());
        parkedStore.ifPresent(store -> store.park(parked));
        parkedBatches.incrementAndGet();

        log.error("Batch {} of pipeline '{}' parked after {} attempts ({}): {}. Pausing until resumed",
            batchId, pipelineId, attempts, reason, failure.getMessage());
        recordError("BATCH_PARKED", "Batch parked, pipeline paused",
            String.format("Batch: %d, Reason: %s, Attempts: %d, Error: %s", batchId, reason, attempts, failure.getMessage()));
        if (getCurrentState() == State.RUNNING) {
            pause();
        }
    }

    private void onInvalidRecord(LogRecord record, MissingFieldException e) {
        log.warn("Skipping record {}:{} of pipeline '{}': {}", record.partition(), record.offset(), pipelineId, e.getMessage());
        recordError("MISSING_FIELD", "Invalid record skipped",
            String.format("Partition: %d, Offset: %d, Field: %s", record.partition(), record.offset(), e.getField()));
    }

    private void logStats(long batchId, WindowProcessor.ProcessedWindow processed, MergeOutcome outcome,
                          long startNanos, BatchStats.Outcome batchOutcome) {
        long latencyNanos = System.nanoTime() - startNanos;
        batchLatency.record(latencyNanos);
        MergeResult result = outcome.result();
        statsLogger.log(new BatchStats(batchId, processed.recordCount(), processed.skippedInvalid(),
            processed.duplicatesInBatch(), processed.unique().size(), result.rowsInserted(), result.rowsUpdated(),
            result.rowsUnchanged(), outcome.attempts(), TimeUnit.NANOSECONDS.toMillis(latencyNanos), batchOutcome));
    }

    private void shutdownComponents() {
        // drain even when stopping: the interrupt would cut the drain short
        boolean interrupted = Thread.interrupted();
        try {
            if (appender != null) {
                appender.shutdown(analyticalShutdownTimeoutMs);
            }
            if (windowProcessor != null) {
                windowProcessor.close();
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public String getPipelineId() {
        return pipelineId;
    }

    public long getLastCommittedBatchId() {
        return lastCommittedBatchId.get();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("batches_committed", batchesCommitted.get());
        metrics.put("last_committed_batch_id", lastCommittedBatchId.get());
        metrics.put("records_processed", recordsProcessed.get());
        metrics.put("records_skipped_invalid", recordsSkipped.get());
        metrics.put("duplicates_dropped", duplicatesDropped.get());
        metrics.put("rows_inserted", rowsInserted.get());
        metrics.put("rows_updated", rowsUpdated.get());
        metrics.put("rows_unchanged", rowsUnchanged.get());
        metrics.put("merge_retries", mergeRetries.get());
        metrics.put("parked_batches", parkedBatches.get());
        metrics.put("checkpoint_failures", checkpointFailures.get());
        metrics.put("batch_splits", batchSplits.get());
        metrics.put("records_per_sec", recordThroughput.getRate());
        metrics.put("batch_latency_p50_ms", batchLatency.getPercentile(50) / 1_000_000.0);
        metrics.put("batch_latency_p99_ms", batchLatency.getPercentile(99) / 1_000_000.0);

        TriggerScheduler currentScheduler = scheduler;
        metrics.put("scheduler_state", currentScheduler.getState().ordinal());
        metrics.put("triggers", currentScheduler.getTriggerCount());
        metrics.put("idle_triggers", currentScheduler.getIdleTriggerCount());
        metrics.put("skipped_boundaries", currentScheduler.getSkippedBoundaryCount());
        metrics.put("dispatches", currentScheduler.getDispatchCount());

        AnalyticalAppender currentAppender = appender;
        if (currentAppender != null) {
            metrics.put("analytical_pending", currentAppender.getPendingCount());
            metrics.put("analytical_batches_appended", currentAppender.getAppendedBatches());
            metrics.put("analytical_rows_appended", currentAppender.getAppendedRows());
            metrics.put("analytical_batches_failed", currentAppender.getFailedBatches());
            metrics.put("analytical_batches_rejected", currentAppender.getRejectedBatches());
        }
    }
}
