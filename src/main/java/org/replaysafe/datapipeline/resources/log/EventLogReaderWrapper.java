package org.replaysafe.datapipeline.resources.log;

import org.replaysafe.datapipeline.api.resources.IWrappedResource;
import org.replaysafe.datapipeline.api.resources.ResourceContext;
import org.replaysafe.datapipeline.api.resources.log.IEventLogReader;
import org.replaysafe.datapipeline.api.resources.log.LogRecord;
import org.replaysafe.datapipeline.resources.AbstractResource;
import org.replaysafe.datapipeline.utils.monitoring.SlidingWindowCounter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Consumer binding ({@code log-read}) of an event log. Stateless apart from metrics: the
 * consumer passes its offsets on every poll.
 */
public class EventLogReaderWrapper extends AbstractResource implements IEventLogReader, IWrappedResource, AutoCloseable {

    private final AbstractEventLogResource eventLog;
    private final ResourceContext context;
    private final AtomicLong polls = new AtomicLong(0);
    private final AtomicLong recordsRead = new AtomicLong(0);
    private final AtomicLong readErrors = new AtomicLong(0);
    private final SlidingWindowCounter readThroughput;

    EventLogReaderWrapper(AbstractEventLogResource eventLog, ResourceContext context) {
        super(eventLog.getResourceName() + "-" + context.serviceName(), eventLog.getOptions());
        this.eventLog = eventLog;
        this.context = context;
        int metricsWindow = eventLog.getOptions().hasPath("metricsWindowSeconds")
            ? eventLog.getOptions().getInt("metricsWindowSeconds")
            : 60;
        this.readThroughput = new SlidingWindowCounter(metricsWindow);
    }

    @Override
    public List<LogRecord> poll(Map<Integer, Long> afterOffsets, int maxRecords) throws InterruptedException {
        try {
            List<LogRecord> records = eventLog.poll(afterOffsets, maxRecords);
            polls.incrementAndGet();
            recordsRead.addAndGet(records.size());
            readThroughput.recordSum(records.size());
            return records;
        } catch (RuntimeException e) {
            readErrors.incrementAndGet();
            recordError("POLL_FAILED", "Poll from event log failed",
                "Service: " + context.serviceName() + ", Error: " + e.getMessage());
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
        metrics.put("polls", polls.get());
        metrics.put("records_read", recordsRead.get());
        metrics.put("read_errors", readErrors.get());
        metrics.put("read_throughput_per_sec", readThroughput.getRate());
    }

    @Override
    public void close() {
        // nothing held per binding
    }
}
