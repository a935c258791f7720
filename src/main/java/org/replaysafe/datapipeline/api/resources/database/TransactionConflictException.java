package org.replaysafe.datapipeline.api.resources.database;

/**
 * The merge transaction collided with another writer (single-writer lock not acquired,
 * lock timeout, duplicate key or serialization failure) and was rolled back.
 */
public class TransactionConflictException extends StorageException {

    public TransactionConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
