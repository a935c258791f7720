package org.replaysafe.datapipeline.api.resources.database;

/**
 * Base class for failures of a storage operation that applies a whole batch.
 * <p>
 * A storage operation either applies the complete batch or nothing; callers can therefore
 * repeat it safely whenever {@link #isRetryable()} returns {@code true}.
 */
public abstract class StorageException extends Exception {

    protected StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return {@code true} if repeating the same operation may succeed.
     */
    public abstract boolean isRetryable();
}
