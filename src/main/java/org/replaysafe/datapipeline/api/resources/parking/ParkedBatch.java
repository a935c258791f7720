package org.replaysafe.datapipeline.api.resources.parking;

import java.time.Instant;
import java.util.Map;

/**
 * A batch that could not be merged or checkpointed and waits for an operator.
 *
 * @param pipelineId  The pipeline that parked the batch.
 * @param batchId     Id the batch had when it was dispatched.
 * @param fromOffsets Last committed offsets; replay starts after these.
 * @param toOffsets   Offsets the batch would have committed.
 * @param recordCount Number of unique events in the batch.
 * @param reason      Error code, e.g. {@code RETRIES_EXHAUSTED}, {@code STORAGE_UNAVAILABLE} or {@code CHECKPOINT_FAILED}.
 * @param message     Message of the last failure.
 * @param attempts    Merge or checkpoint attempts made before parking.
 * @param parkedAt    When the batch was parked.
 */
public record ParkedBatch(
        String pipelineId,
        long batchId,
        Map<Integer, Long> fromOffsets,
        Map<Integer, Long> toOffsets,
        int recordCount,
        String reason,
        String message,
        int attempts,
        Instant parkedAt
) {
}
