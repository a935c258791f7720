package org.replaysafe.datapipeline.api.resources.database;

import org.replaysafe.datapipeline.api.contracts.MergeTableRow;
import org.replaysafe.datapipeline.api.resources.IResource;

import java.util.Optional;

/**
 * Read access to the merge table (usage type {@code db-merge-read}).
 */
public interface IMergeTableReader extends IResource {

    long countRows() throws StorageException;

    Optional<MergeTableRow> findRow(String dedupKey) throws StorageException;

    /**
     * @return Sum of {@code merge_version} over all rows, a cheap fingerprint of update activity.
     */
    long sumMergeVersions() throws StorageException;
}
