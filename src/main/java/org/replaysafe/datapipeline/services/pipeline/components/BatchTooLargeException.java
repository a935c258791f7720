package org.replaysafe.datapipeline.services.pipeline.components;

/**
 * A window holds more records than one merge transaction may carry. The caller splits
 * the window and processes the halves in order.
 */
public class BatchTooLargeException extends Exception {

    private final int size;
    private final int limit;

    public BatchTooLargeException(int size, int limit) {
        super("Batch of " + size + " records exceeds the limit of " + limit);
        this.size = size;
        this.limit = limit;
    }

    public int getSize() {
        return size;
    }

    public int getLimit() {
        return limit;
    }
}
