package org.replaysafe.datapipeline.resources.log;

import org.replaysafe.datapipeline.api.resources.IWrappedResource;
import org.replaysafe.datapipeline.api.resources.ResourceContext;
import org.replaysafe.datapipeline.api.resources.log.IEventLogWriter;
import org.replaysafe.datapipeline.api.resources.log.LogRecord;
import org.replaysafe.datapipeline.resources.AbstractResource;
import org.replaysafe.datapipeline.utils.monitoring.SlidingWindowCounter;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Producer binding ({@code log-write}) of an event log.
 */
public class EventLogWriterWrapper extends AbstractResource implements IEventLogWriter, IWrappedResource, AutoCloseable {

    private final AbstractEventLogResource eventLog;
    private final ResourceContext context;
    private final AtomicLong recordsWritten = new AtomicLong(0);
    private final AtomicLong writeErrors = new AtomicLong(0);
    private final SlidingWindowCounter writeThroughput;

    EventLogWriterWrapper(AbstractEventLogResource eventLog, ResourceContext context) {
        super(eventLog.getResourceName() + "-" + context.serviceName(), eventLog.getOptions());
        this.eventLog = eventLog;
        this.context = context;
        int metricsWindow = eventLog.getOptions().hasPath("metricsWindowSeconds")
            ? eventLog.getOptions().getInt("metricsWindowSeconds")
            : 60;
        this.writeThroughput = new SlidingWindowCounter(metricsWindow);
    }

    @Override
    public LogRecord append(String partitionKey, String value) {
        return append(eventLog.partitionFor(partitionKey), value);
    }

    @Override
    public LogRecord append(int partition, String value) {
        try {
            LogRecord record = eventLog.append(partition, value);
            recordsWritten.incrementAndGet();
            writeThroughput.recordCount();
            return record;
        } catch (RuntimeException e) {
            writeErrors.incrementAndGet();
            recordError("APPEND_FAILED", "Append to event log failed",
                "Service: " + context.serviceName() + ", Partition: " + partition + ", Error: " + e.getMessage());
            throw e;
        }
    }

    @Override
    public int getPartitionCount() {
        return eventLog.getPartitionCount();
    }

    @Override
    public String getResourceName() {
        return eventLog.getResourceName();
    }

    @Override
    public UsageState getUsageState(String usageType) {
        return eventLog.getUsageState(usageType);
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("records_written", recordsWritten.get());
        metrics.put("write_errors", writeErrors.get());
        metrics.put("write_throughput_per_sec", writeThroughput.getRate());
    }

    @Override
    public void close() {
        // nothing held per binding
    }
}
