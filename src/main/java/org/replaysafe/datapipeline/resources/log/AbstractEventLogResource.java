package org.replaysafe.datapipeline.resources.log;

import com.typesafe.config.Config;
import org.replaysafe.datapipeline.api.resources.IContextualResource;
import org.replaysafe.datapipeline.api.resources.IWrappedResource;
import org.replaysafe.datapipeline.api.resources.ResourceContext;
import org.replaysafe.datapipeline.api.resources.log.LogRecord;
import org.replaysafe.datapipeline.resources.AbstractResource;
import org.replaysafe.datapipeline.utils.monitoring.SlidingWindowCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Base class for partitioned, append-only event logs.
 * <p>
 * Services bind either {@code log-write} (producers, see {@link EventLogWriterWrapper}) or
 * {@code log-read} (consumers, see {@link EventLogReaderWrapper}). The wrappers keep
 * per-binding metrics; this class keeps the aggregate counters and the partitioning rule.
 * <p>
 * Offsets start at 0 in every partition and have no gaps. A consumer that has processed
 * nothing of a partition is at offset -1. A poll splits its record limit evenly across the
 * partitions, so a partition with a large backlog cannot starve the others.
 * <p>
 * Options: {@code partitions} (default 4), {@code metricsWindowSeconds} (default 60).
 */
public abstract class AbstractEventLogResource extends AbstractResource implements IContextualResource, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AbstractEventLogResource.class);

    /** Offset of a partition nothing has been processed from. */
    public static final long NO_OFFSET = -1L;

    protected final int partitions;
    protected final Set<AutoCloseable> activeWrappers = ConcurrentHashMap.newKeySet();

    protected final AtomicLong recordsAppended = new AtomicLong(0);
    protected final AtomicLong recordsRead = new AtomicLong(0);
    protected final SlidingWindowCounter writeThroughput;
    protected final SlidingWindowCounter readThroughput;

    protected AbstractEventLogResource(String name, Config options) {
        super(name, options);
        this.partitions = options.hasPath("partitions") ? options.getInt("partitions") : 4;
        if (partitions < 1) {
            throw new IllegalArgumentException("Event log '" + name + "' needs at least one partition, got: " + partitions);
        }
        int metricsWindow = options.hasPath("metricsWindowSeconds") ? options.getInt("metricsWindowSeconds") : 60;
        this.writeThroughput = new SlidingWindowCounter(metricsWindow);
        this.readThroughput = new SlidingWindowCounter(metricsWindow);
    }

    /**
     * Appends one record to the end of a partition.
     *
     * @return The stored record with its assigned offset.
     */
    protected abstract LogRecord doAppend(int partition, String value);

    /**
     * Reads up to {@code maxRecords} records of one partition strictly after {@code afterOffset},
     * in offset order.
     */
    protected abstract List<LogRecord> doRead(int partition, long afterOffset, int maxRecords) throws InterruptedException;

    /**
     * @return The offset of the last record in the partition, or {@link #NO_OFFSET} if it is empty.
     */
    public abstract long getEndOffset(int partition);

    public int getPartitionCount() {
        return partitions;
    }

    /**
     * Maps a partition key to a partition. Equal keys always land in the same partition.
     */
    public int partitionFor(String partitionKey) {
        return Math.floorMod(partitionKey == null ? 0 : partitionKey.hashCode(), partitions);
    }

    void checkPartition(int partition) {
        if (partition < 0 || partition >= partitions) {
            throw new IllegalArgumentException(String.format(
                "Partition %d does not exist in event log '%s' (partitions: %d)", partition, getResourceName(), partitions));
        }
    }

    final LogRecord append(int partition, String value) {
        checkPartition(partition);
        if (value == null) {
            throw new IllegalArgumentException("Event log records must not be null");
        }
        LogRecord record = doAppend(partition, value);
        recordsAppended.incrementAndGet();
        writeThroughput.recordCount();
        return record;
    }

    final List<LogRecord> poll(Map<Integer, Long> afterOffsets, int maxRecords) throws InterruptedException {
        if (maxRecords <= 0) {
            throw new IllegalArgumentException("maxRecords must be positive, got: " + maxRecords);
        }
        // equal shares first, what a partition leaves unused goes to the ones that still have a backlog
        List<List<LogRecord>> byPartition = new ArrayList<>(partitions);
        List<Integer> backlogged = new ArrayList<>(partitions);
        for (int partition = 0; partition < partitions; partition++) {
            byPartition.add(new ArrayList<>());
            backlogged.add(partition);
        }
        int remaining = maxRecords;
        while (remaining > 0 && !backlogged.isEmpty()) {
            int share = Math.max(1, remaining / backlogged.size());
            List<Integer> stillBacklogged = new ArrayList<>();
            for (int partition : backlogged) {
                if (remaining == 0) {
                    break;
                }
                List<LogRecord> read = byPartition.get(partition);
                long after = read.isEmpty()
                    ? afterOffsets.getOrDefault(partition, NO_OFFSET)
                    : read.get(read.size() - 1).offset();
                int limit = Math.min(share, remaining);
                List<LogRecord> batch = doRead(partition, after, limit);
                read.addAll(batch);
                remaining -= batch.size();
                if (batch.size() == limit) {
                    stillBacklogged.add(partition);
                }
            }
            backlogged = stillBacklogged;
        }

        List<LogRecord> records = new ArrayList<>(maxRecords - remaining);
        byPartition.forEach(records::addAll);
        recordsRead.addAndGet(records.size());
        readThroughput.recordSum(records.size());
        return records;
    }

    @Override
    public final IWrappedResource getWrappedResource(ResourceContext context) {
        if (context.usageType() == null) {
            throw new IllegalArgumentException(String.format(
                "Event log '%s' requires a usage type in the binding URI, e.g. 'log-read:%s' or 'log-write:%s'",
                getResourceName(), getResourceName(), getResourceName()));
        }
        IWrappedResource wrapper = switch (context.usageType()) {
            case "log-write" -> new EventLogWriterWrapper(this, context);
            case "log-read" -> new EventLogReaderWrapper(this, context);
            default -> throw new IllegalArgumentException(String.format(
                "Unsupported usage type '%s' for event log '%s'. Supported: log-write, log-read",
                context.usageType(), getResourceName()));
        };
        activeWrappers.add((AutoCloseable) wrapper);
        log.debug("Created {} wrapper of event log '{}' for service '{}'",
            context.usageType(), getResourceName(), context.serviceName());
        return wrapper;
    }

    @Override
    public UsageState getUsageState(String usageType) {
        if (usageType == null) {
            throw new IllegalArgumentException("Usage type cannot be null for event log '" + getResourceName() + "'");
        }
        return switch (usageType) {
            case "log-write" -> isHealthy() ? UsageState.ACTIVE : UsageState.FAILED;
            case "log-read" -> {
                if (!isHealthy()) {
                    yield UsageState.FAILED;
                }
                yield recordsAppended.get() > recordsRead.get() ? UsageState.ACTIVE : UsageState.WAITING;
            }
            default -> throw new IllegalArgumentException(String.format(
                "Unsupported usage type '%s' for event log '%s'. Supported: log-write, log-read",
                usageType, getResourceName()));
        };
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("partitions", partitions);
        metrics.put("records_appended", recordsAppended.get());
        metrics.put("records_read", recordsRead.get());
        metrics.put("write_throughput_per_sec", writeThroughput.getRate());
        metrics.put("read_throughput_per_sec", readThroughput.getRate());
    }

    @Override
    public void close() throws Exception {
        for (AutoCloseable wrapper : activeWrappers) {
            try {
                wrapper.close();
            } catch (Exception e) {
                log.warn("Failed to close wrapper of event log '{}': {}", getResourceName(), e.getMessage());
                recordError("WRAPPER_CLOSE_FAILED", "Failed to close wrapper", "Event log: " + getResourceName());
            }
        }
        activeWrappers.clear();
    }
}
