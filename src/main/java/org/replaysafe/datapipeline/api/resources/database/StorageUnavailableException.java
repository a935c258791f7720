package org.replaysafe.datapipeline.api.resources.database;

/**
 * The store cannot be reached or rejected the operation for a non-transient reason.
 * Fatal for the batch: it must be parked and progress must not advance.
 */
public class StorageUnavailableException extends StorageException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
