package org.replaysafe.datapipeline.api.resources.log;

import org.replaysafe.datapipeline.api.resources.IResource;

/**
 * Producer side of the partitioned event log (usage type {@code log-write}).
 */
public interface IEventLogWriter extends IResource {

    /**
     * Appends a record to the partition chosen from the partition key.
     * Equal keys always map to the same partition.
     */
    LogRecord append(String partitionKey, String value);

    LogRecord append(int partition, String value);

    int getPartitionCount();
}
