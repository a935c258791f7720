package org.replaysafe.datapipeline.api.contracts;

import java.time.Instant;
import java.util.Map;

/**
 * Durable progress of one pipeline.
 *
 * @param offsets     Last processed offset per partition. Partitions without an entry start from the beginning.
 * @param batchId     Id of the batch that produced this checkpoint, 0 if none was committed yet.
 * @param committedAt Commit time, {@code null} if none was committed yet.
 */
public record Checkpoint(Map<Integer, Long> offsets, long batchId, Instant committedAt) {

    public Checkpoint {
        offsets = Map.copyOf(offsets);
    }

    public static Checkpoint empty() {
        return new Checkpoint(Map.of(), 0L, null);
    }

    public boolean isEmpty() {
        return batchId == 0L && offsets.isEmpty();
    }
}
