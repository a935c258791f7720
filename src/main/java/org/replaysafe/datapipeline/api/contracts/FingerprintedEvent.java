package org.replaysafe.datapipeline.api.contracts;

import java.time.Instant;

/**
 * An event together with its derived dedup key.
 *
 * @param event          The original event.
 * @param dedupKey       64 hex characters of SHA-256 over the canonical identity fields.
 * @param eventTimestamp The canonical event timestamp.
 */
public record FingerprintedEvent(Event event, String dedupKey, Instant eventTimestamp) {

    /**
     * Compares two events by arrival order: partition first, then offset.
     */
    public static int compareArrival(FingerprintedEvent a, FingerprintedEvent b) {
        int byPartition = Integer.compare(a.event().partitionId(), b.event().partitionId());
        return byPartition != 0 ? byPartition : Long.compare(a.event().offset(), b.event().offset());
    }
}
