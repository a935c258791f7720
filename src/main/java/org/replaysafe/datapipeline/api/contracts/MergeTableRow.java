package org.replaysafe.datapipeline.api.contracts;

import java.time.Instant;

public record MergeTableRow(
        String dedupKey,
        String principalId,
        String eventType,
        Instant eventTimestamp,
        String payload,
        long mergeVersion
) {
}
