package org.replaysafe.datapipeline.services.pipeline.components;

/**
 * Which occurrence of a dedup key survives within one batch.
 */
public enum DedupPolicy {
    /** The occurrence with the lowest (partition, offset) wins. */
    FIRST_ARRIVAL,
    /**
     * The occurrence with the highest explicit {@code sequence} wins. Events without a sequence
     * rank below any event that has one; ties go to the first arrival.
     */
    HIGHEST_SEQUENCE
}
