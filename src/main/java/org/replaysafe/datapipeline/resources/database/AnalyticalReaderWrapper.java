package org.replaysafe.datapipeline.resources.database;

import org.replaysafe.datapipeline.api.contracts.AnalyticalRow;
import org.replaysafe.datapipeline.api.resources.ResourceContext;
import org.replaysafe.datapipeline.api.resources.database.IAnalyticalReader;
import org.replaysafe.datapipeline.api.resources.database.StorageException;

import java.util.Optional;

public class AnalyticalReaderWrapper extends AbstractDatabaseWrapper implements IAnalyticalReader {

    AnalyticalReaderWrapper(AbstractDatabaseResource db, ResourceContext context) {
        super(db, context);
    }

    @Override
    public long countRows() throws StorageException {
        try {
            return database.doCountAnalyticalRows(ensureConnection());
        } catch (StorageException e) {
            onFailure("READ_FAILED", "Counting analytical rows", e);
            throw e;
        }
    }

    @Override
    public long countDistinctKeys() throws StorageException {
        try {
            return database.doCountAnalyticalKeys(ensureConnection());
        } catch (StorageException e) {
            onFailure("READ_FAILED", "Counting analytical keys", e);
            throw e;
        }
    }

    @Override
    public Optional<AnalyticalRow> findLatest(String dedupKey) throws StorageException {
        try {
            return database.doFindLatestAnalytical(ensureConnection(), dedupKey);
        } catch (StorageException e) {
            onFailure("READ_FAILED", "Reading analytical row " + dedupKey, e);
            throw e;
        }
    }
}
