package org.replaysafe.datapipeline.api.contracts;

import java.time.Instant;

/**
 * One append to the analytical store. Several rows per dedup key may coexist until the
 * store compacts them; the highest {@code version} wins.
 */
public record AnalyticalRow(
        String dedupKey,
        String principalId,
        String eventType,
        Instant eventTimestamp,
        String payload,
        long version
) {

    public static AnalyticalRow of(FingerprintedEvent event, long version) {
        return new AnalyticalRow(event.dedupKey(), event.event().principalId(), event.event().eventType(),
                event.eventTimestamp(), event.event().payload(), version);
    }
}
