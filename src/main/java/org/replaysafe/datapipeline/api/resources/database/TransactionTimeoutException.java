package org.replaysafe.datapipeline.api.resources.database;

/**
 * The merge transaction exceeded its statement timeout and was rolled back.
 */
public class TransactionTimeoutException extends StorageException {

    public TransactionTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
