package org.replaysafe.datapipeline.api.resources.database;

import org.replaysafe.datapipeline.api.contracts.Checkpoint;
import org.replaysafe.datapipeline.api.resources.IResource;

import java.util.Map;

/**
 * Durable per-partition progress (usage type {@code db-checkpoint}).
 */
public interface ICheckpointStore extends IResource {

    /**
     * Persists the offsets of all given partitions together with the batch id in one transaction.
     * Offsets never move backwards: a lower offset than the stored one is ignored.
     */
    void commit(String pipelineId, long batchId, Map<Integer, Long> offsets) throws StorageException;

    /**
     * @return The last committed checkpoint, or {@link Checkpoint#empty()} if none exists.
     */
    Checkpoint load(String pipelineId) throws StorageException;
}
