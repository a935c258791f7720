package org.replaysafe.datapipeline.resources.database;

import org.replaysafe.datapipeline.api.contracts.MergeTableRow;
import org.replaysafe.datapipeline.api.resources.ResourceContext;
import org.replaysafe.datapipeline.api.resources.database.IMergeTableReader;
import org.replaysafe.datapipeline.api.resources.database.StorageException;

import java.util.Optional;

public class MergeTableReaderWrapper extends AbstractDatabaseWrapper implements IMergeTableReader {

    MergeTableReaderWrapper(AbstractDatabaseResource db, ResourceContext context) {
        super(db, context);
    }

    @Override
    public long countRows() throws StorageException {
        try {
            return database.doCountMergeRows(ensureConnection());
        } catch (StorageException e) {
            onFailure("READ_FAILED", "Counting merge rows", e);
            throw e;
        }
    }

    @Override
    public Optional<MergeTableRow> findRow(String dedupKey) throws StorageException {
        try {
            return database.doFindMergeRow(ensureConnection(), dedupKey);
        } catch (StorageException e) {
            onFailure("READ_FAILED", "Reading merge row " + dedupKey, e);
            throw e;
        }
    }

    @Override
    public long sumMergeVersions() throws StorageException {
        try {
            return database.doSumMergeVersions(ensureConnection());
        } catch (StorageException e) {
            onFailure("READ_FAILED", "Summing merge versions", e);
            throw e;
        }
    }
}
