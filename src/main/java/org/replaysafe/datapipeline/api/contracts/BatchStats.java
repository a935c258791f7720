package org.replaysafe.datapipeline.api.contracts;

/**
 * Per-batch observability record, written as one JSON line per dispatched batch.
 */
public record BatchStats(
        long batchId,
        int recordCount,
        int skippedInvalid,
        int duplicatesInBatch,
        int uniqueCount,
        int rowsInserted,
        int rowsUpdated,
        int rowsUnchanged,
        int mergeAttempts,
        long latencyMs,
        Outcome outcome
) {

    public enum Outcome {
        COMMITTED,
        CHECKPOINT_FAILED,
        PARKED
    }
}
