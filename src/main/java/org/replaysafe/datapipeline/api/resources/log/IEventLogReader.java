package org.replaysafe.datapipeline.api.resources.log;

import org.replaysafe.datapipeline.api.resources.IResource;

import java.util.List;
import java.util.Map;

/**
 * Consumer side of the partitioned event log (usage type {@code log-read}).
 * <p>
 * Reading does not consume anything: progress is owned by the caller, which passes the
 * last processed offset per partition on every poll. Re-reading the same offsets returns
 * the same records, which is what makes replay after a crash possible.
 */
public interface IEventLogReader extends IResource {

    /**
     * Returns records strictly after the given offsets, ordered by partition and then offset.
     *
     * @param afterOffsets Last processed offset per partition; missing partitions are read from the start.
     * @param maxRecords   Upper bound for the number of returned records.
     * @return Up to {@code maxRecords} records, possibly empty.
     * @throws InterruptedException if interrupted while reading.
     */
    List<LogRecord> poll(Map<Integer, Long> afterOffsets, int maxRecords) throws InterruptedException;

    int getPartitionCount();
}
