package org.replaysafe.datapipeline.api.resources.database;

/**
 * An append to the analytical store failed. The append is retried independently of the
 * merge path.
 */
public class AnalyticalSinkException extends StorageException {

    public AnalyticalSinkException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
