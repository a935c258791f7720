package org.replaysafe.datapipeline.resources.log;

import com.typesafe.config.Config;
import org.replaysafe.datapipeline.api.resources.log.LogRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Event log held in memory, for tests and single-process runs. Content is lost with the JVM,
 * so replay after a restart only works with {@link H2EventLog}.
 */
public class InMemoryEventLog extends AbstractEventLogResource {

    private final List<List<String>> partitionData;

    public InMemoryEventLog(String name, Config options) {
        super(name, options);
        this.partitionData = new ArrayList<>(partitions);
        for (int i = 0; i < partitions; i++) {
            partitionData.add(new ArrayList<>());
        }
    }

    @Override
    protected LogRecord doAppend(int partition, String value) {
        List<String> data = partitionData.get(partition);
        synchronized (data) {
            data.add(value);
            return new LogRecord(partition, data.size() - 1L, value);
        }
    }

    @Override
    protected List<LogRecord> doRead(int partition, long afterOffset, int maxRecords) {
        List<LogRecord> result = new ArrayList<>();
        List<String> data = partitionData.get(partition);
        synchronized (data) {
            for (long offset = afterOffset + 1; offset < data.size() && result.size() < maxRecords; offset++) {
                result.add(new LogRecord(partition, offset, data.get((int) offset)));
            }
        }
        return result;
    }

    @Override
    public long getEndOffset(int partition) {
        checkPartition(partition);
        List<String> data = partitionData.get(partition);
        synchronized (data) {
            return data.size() - 1L;
        }
    }
}
