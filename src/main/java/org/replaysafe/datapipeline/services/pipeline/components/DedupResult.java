package org.replaysafe.datapipeline.services.pipeline.components;

import org.replaysafe.datapipeline.api.contracts.FingerprintedEvent;

import java.util.List;

/**
 * @param unique     One event per dedup key, in arrival order.
 * @param duplicates Number of input events that were dropped as intra-batch duplicates.
 */
public record DedupResult(List<FingerprintedEvent> unique, int duplicates) {

    public DedupResult {
        unique = List.copyOf(unique);
    }
}
