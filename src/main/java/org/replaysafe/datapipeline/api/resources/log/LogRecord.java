package org.replaysafe.datapipeline.api.resources.log;

/**
 * One entry of the partitioned event log.
 *
 * @param partition Partition index, starting at 0.
 * @param offset    Offset inside the partition, starting at 0 and gap-free.
 * @param value     The raw record as written by the producer (a JSON object).
 */
public record LogRecord(int partition, long offset, String value) {
}
