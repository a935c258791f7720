package org.replaysafe.datapipeline.api.contracts;

/**
 * Outcome of one merge transaction.
 */
public record MergeResult(int rowsInserted, int rowsUpdated, int rowsUnchanged) {

    public static final MergeResult EMPTY = new MergeResult(0, 0, 0);

    public int rowsTouched() {
        return rowsInserted + rowsUpdated + rowsUnchanged;
    }
}
