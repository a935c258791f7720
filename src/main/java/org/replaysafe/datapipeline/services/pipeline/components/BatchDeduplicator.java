package org.replaysafe.datapipeline.services.pipeline.components;

import org.replaysafe.datapipeline.api.contracts.FingerprintedEvent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses a batch to one event per dedup key.
 * <p>
 * The winner is chosen by arrival order, which is (partition, offset), never by the order
 * in which the caller happened to collect the events. Running {@code dedupe} over the
 * concatenation of per-partition results therefore gives the same answer as running it over
 * the whole batch at once, whatever the parallelism.
 * <p>
 * Stateless and thread-safe.
 */
public class BatchDeduplicator {

    private final DedupPolicy policy;
    private final int maxBatchRecords;

    /**
     * @param policy          Which occurrence of a key survives.
     * @param maxBatchRecords Largest batch accepted (must be positive).
     */
    public BatchDeduplicator(DedupPolicy policy, int maxBatchRecords) {
        if (maxBatchRecords <= 0) {
            throw new IllegalArgumentException("maxBatchRecords must be positive, got: " + maxBatchRecords);
        }
        this.policy = policy;
        this.maxBatchRecords = maxBatchRecords;
    }

    /**
     * @return The surviving events in arrival order plus the number of dropped duplicates.
     * @throws BatchTooLargeException if the batch has more than {@code maxBatchRecords} events.
     */
    public DedupResult dedupe(List<FingerprintedEvent> batch) throws BatchTooLargeException {
        checkSize(batch.size());

        List<FingerprintedEvent> ordered = new ArrayList<>(batch);
        ordered.sort(FingerprintedEvent::compareArrival);

        Map<String, FingerprintedEvent> winners = new LinkedHashMap<>();
        for (FingerprintedEvent event : ordered) {
            winners.merge(event.dedupKey(), event, this::pick);
        }

        List<FingerprintedEvent> unique = new ArrayList<>(winners.values());
        if (policy == DedupPolicy.HIGHEST_SEQUENCE) {
            // a later occurrence may have won
            unique.sort(FingerprintedEvent::compareArrival);
        }
        return new DedupResult(unique, batch.size() - unique.size());
    }

    /**
     * @throws BatchTooLargeException if {@code size} exceeds {@code maxBatchRecords}.
     */
    public void checkSize(int size) throws BatchTooLargeException {
        if (size > maxBatchRecords) {
            throw new BatchTooLargeException(size, maxBatchRecords);
        }
    }

    /**
     * {@code current} always arrived before {@code candidate}.
     */
    private FingerprintedEvent pick(FingerprintedEvent current, FingerprintedEvent candidate) {
        if (policy == DedupPolicy.HIGHEST_SEQUENCE) {
            Long currentSequence = current.event().sequence();
            Long candidateSequence = candidate.event().sequence();
            if (candidateSequence != null && (currentSequence == null || candidateSequence > currentSequence)) {
                return candidate;
            }
        }
        return current;
    }

    public DedupPolicy getPolicy() {
        return policy;
    }
}
