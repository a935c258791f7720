package org.replaysafe.datapipeline.api.resources.database;

import org.replaysafe.datapipeline.api.contracts.AnalyticalRow;
import org.replaysafe.datapipeline.api.resources.IResource;

import java.util.Optional;

/**
 * Read access to the analytical store (usage type {@code db-analytical-read}).
 */
public interface IAnalyticalReader extends IResource {

    long countRows() throws StorageException;

    long countDistinctKeys() throws StorageException;

    /**
     * @return The row with the highest version for the key, the one compaction keeps.
     */
    Optional<AnalyticalRow> findLatest(String dedupKey) throws StorageException;
}
