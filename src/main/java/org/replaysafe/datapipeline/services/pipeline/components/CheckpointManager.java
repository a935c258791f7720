package org.replaysafe.datapipeline.services.pipeline.components;

import org.replaysafe.datapipeline.api.contracts.Checkpoint;
import org.replaysafe.datapipeline.api.resources.database.ICheckpointStore;
import org.replaysafe.datapipeline.api.resources.database.StorageException;

import java.util.Map;
import java.util.TreeMap;

/**
 * Owns the durable progress of one pipeline.
 * <p>
 * The ordering rule is enforced here rather than trusted to the caller: {@link #commit(long, Map)}
 * for batch N is only accepted after {@link #recordMergeCommitted(long)} for the same N. Batch ids
 * grow strictly and offsets never move backwards.
 * <p>
 * <strong>Thread Safety:</strong> not thread-safe, used by the pipeline thread only.
 */
public class CheckpointManager {

    private static final long NONE = -1L;

    private final ICheckpointStore store;
    private final String pipelineId;

    private final Map<Integer, Long> committedOffsets = new TreeMap<>();
    private long lastCommittedBatchId;
    private long mergeCommittedBatchId = NONE;

    public CheckpointManager(ICheckpointStore store, String pipelineId) {
        if (pipelineId == null || pipelineId.isBlank()) {
            throw new IllegalArgumentException("pipelineId must not be blank");
        }
        this.store = store;
        this.pipelineId = pipelineId;
    }

    /**
     * Loads the last committed checkpoint and resets the in-memory view to it.
     *
     * @return The checkpoint, {@link Checkpoint#empty()} on first start.
     */
    public Checkpoint recover() throws StorageException {
        Checkpoint checkpoint = store.load(pipelineId);
        committedOffsets.clear();
        committedOffsets.putAll(checkpoint.offsets());
        lastCommittedBatchId = checkpoint.batchId();
        mergeCommittedBatchId = NONE;
        return checkpoint;
    }

    /**
     * Notes that the merge transaction of a batch has committed, which permits its checkpoint.
     */
    public void recordMergeCommitted(long batchId) {
        if (batchId <= lastCommittedBatchId) {
            throw new IllegalStateException(String.format(
                "Batch %d is not newer than the last checkpointed batch %d", batchId, lastCommittedBatchId));
        }
        mergeCommittedBatchId = batchId;
    }

    /**
     * Persists the offsets reached by a batch.
     *
     * @param offsets Cumulative last processed offset per partition.
     * @throws IllegalStateException if the merge of this batch was not recorded, or an offset would move backwards.
     * @throws StorageException      if the store could not persist the checkpoint; the in-memory view stays unchanged.
     */
    public void commit(long batchId, Map<Integer, Long> offsets) throws StorageException {
        if (mergeCommittedBatchId != batchId) {
            throw new IllegalStateException(String.format(
                "Checkpoint for batch %d requested before its merge committed", batchId));
        }
        for (Map.Entry<Integer, Long> entry : offsets.entrySet()) {
            Long committed = committedOffsets.get(entry.getKey());
            if (committed != null && entry.getValue() < committed) {
                throw new IllegalStateException(String.format(
                    "Offset of partition %d would move backwards from %d to %d", entry.getKey(), committed, entry.getValue()));
            }
        }

        store.commit(pipelineId, batchId, offsets);

        committedOffsets.putAll(offsets);
        lastCommittedBatchId = batchId;
        mergeCommittedBatchId = NONE;
    }

    public Map<Integer, Long> getCommittedOffsets() {
        return Map.copyOf(committedOffsets);
    }

    public long getLastCommittedBatchId() {
        return lastCommittedBatchId;
    }

    public String getPipelineId() {
        return pipelineId;
    }
}
