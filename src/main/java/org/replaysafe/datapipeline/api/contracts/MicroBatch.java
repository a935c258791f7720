package org.replaysafe.datapipeline.api.contracts;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A deduplicated batch ready for the sinks.
 *
 * @param batchId Monotonically increasing batch id.
 * @param cutAt   When the trigger closed the window this batch was cut from.
 * @param events  Unique events, one per dedup key, in arrival order.
 * @param offsets Cumulative per-partition offsets that become durable once this batch is committed.
 */
public record MicroBatch(long batchId, Instant cutAt, List<FingerprintedEvent> events, Map<Integer, Long> offsets) {

    public MicroBatch {
        events = List.copyOf(events);
        offsets = Map.copyOf(offsets);
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public int size() {
        return events.size();
    }
}
