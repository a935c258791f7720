package org.replaysafe.datapipeline.resources.database;

import org.replaysafe.datapipeline.api.contracts.Checkpoint;
import org.replaysafe.datapipeline.api.resources.ResourceContext;
import org.replaysafe.datapipeline.api.resources.database.ICheckpointStore;
import org.replaysafe.datapipeline.api.resources.database.StorageException;
import org.replaysafe.datapipeline.utils.monitoring.SlidingWindowPercentiles;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

public class CheckpointStoreWrapper extends AbstractDatabaseWrapper implements ICheckpointStore {

    private final AtomicLong commits = new AtomicLong(0);
    private final AtomicLong failedCommits = new AtomicLong(0);
    private final SlidingWindowPercentiles commitLatency;

    CheckpointStoreWrapper(AbstractDatabaseResource db, ResourceContext context) {
        super(db, context);
        this.commitLatency = new SlidingWindowPercentiles(metricsWindowSeconds);
    }

    @Override
    public void commit(String pipelineId, long batchId, Map<Integer, Long> offsets) throws StorageException {
        long startNanos = System.nanoTime();
        try {
            database.doCommitCheckpoint(ensureConnection(), pipelineId, batchId, offsets);
            commits.incrementAndGet();
            commitLatency.record(System.nanoTime() - startNanos);
        } catch (StorageException e) {
            failedCommits.incrementAndGet();
            onFailure("CHECKPOINT_COMMIT_FAILED", "Checkpoint commit for batch " + batchId, e);
            throw e;
        }
    }

    @Override
    public Checkpoint load(String pipelineId) throws StorageException {
        try {
            return database.doLoadCheckpoint(ensureConnection(), pipelineId);
        } catch (StorageException e) {
            onFailure("CHECKPOINT_LOAD_FAILED", "Checkpoint load for pipeline " + pipelineId, e);
            throw e;
        }
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("checkpoint_commits", commits.get());
        metrics.put("failed_checkpoint_commits", failedCommits.get());
        metrics.put("checkpoint_commit_latency_p99_ms", commitLatency.getPercentile(99) / 1_000_000.0);
    }
}
