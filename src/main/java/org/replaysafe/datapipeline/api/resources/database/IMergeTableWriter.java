package org.replaysafe.datapipeline.api.resources.database;

import org.replaysafe.datapipeline.api.contracts.FingerprintedEvent;
import org.replaysafe.datapipeline.api.contracts.MergeResult;
import org.replaysafe.datapipeline.api.resources.IResource;

import java.util.List;

/**
 * Capability for the transactional merge sink (usage type {@code db-merge}).
 */
public interface IMergeTableWriter extends IResource {

    /**
     * Upserts a batch of unique events keyed by dedup key in one atomic transaction.
     * <p>
     * Existing keys are updated in place, new keys are inserted. Either the whole batch
     * becomes visible or none of it does. At most one merge runs against the table at a time.
     *
     * @param batch Events with pairwise distinct dedup keys.
     * @return Counts of inserted, updated and unchanged rows.
     * @throws TransactionConflictException if another writer held the table or a key collided (retryable).
     * @throws TransactionTimeoutException  if the transaction exceeded its timeout (retryable).
     * @throws StorageUnavailableException  if the store cannot be used (fatal for the batch).
     * @throws IllegalArgumentException     if the batch contains the same key twice.
     */
    MergeResult merge(List<FingerprintedEvent> batch) throws StorageException;
}
