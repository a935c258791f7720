package org.replaysafe.datapipeline.api.resources.parking;

import org.replaysafe.datapipeline.api.resources.IResource;

import java.util.List;

/**
 * Quarantine for batches that exhausted their merge retries or hit an unavailable store.
 * Parking never drops the events themselves: they stay in the event log behind the
 * un-advanced checkpoint. The store keeps the operator-facing record.
 */
public interface IParkedBatchStore extends IResource {

    /**
     * @return {@code false} if the store is full and the record was dropped.
     */
    boolean park(ParkedBatch batch);

    List<ParkedBatch> list();

    int size();

    /**
     * @return Maximum number of records held, or -1 if unlimited.
     */
    default long getCapacityLimit() {
        return -1L;
    }
}
