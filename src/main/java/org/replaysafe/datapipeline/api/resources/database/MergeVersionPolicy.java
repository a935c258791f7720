package org.replaysafe.datapipeline.api.resources.database;

/**
 * Controls when a matched row of the merge table gets a new {@code merge_version}.
 */
public enum MergeVersionPolicy {
    /** Only rows whose payload changed are rewritten. Replays leave the table byte-identical. */
    ON_CHANGE,
    /** Every matched row is rewritten with {@code merge_version + 1}; the key set never changes. */
    ALWAYS
}
