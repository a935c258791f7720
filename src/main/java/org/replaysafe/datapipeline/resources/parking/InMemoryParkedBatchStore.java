package org.replaysafe.datapipeline.resources.parking;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.replaysafe.datapipeline.api.resources.parking.IParkedBatchStore;
import org.replaysafe.datapipeline.api.resources.parking.ParkedBatch;
import org.replaysafe.datapipeline.resources.AbstractResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory quarantine for parked batches.
 * <p>
 * The records are informational: the events of a parked batch stay in the event log behind
 * the un-advanced checkpoint, so dropping a record when the store is full loses no data.
 * <p>
 * Options: {@code capacity} (default 1000).
 */
public class InMemoryParkedBatchStore extends AbstractResource implements IParkedBatchStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryParkedBatchStore.class);

    private final ConcurrentLinkedDeque<ParkedBatch> parked = new ConcurrentLinkedDeque<>();
    private final long capacityLimit;
    private final AtomicLong totalParked = new AtomicLong(0);
    private final AtomicLong droppedCount = new AtomicLong(0);

    public InMemoryParkedBatchStore(String name, Config options) {
        super(name, options);
        Config finalConfig = options.withFallback(ConfigFactory.parseMap(Map.of("capacity", 1000)));
        this.capacityLimit = finalConfig.getLong("capacity");
        if (capacityLimit <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacityLimit);
        }
    }

    @Override
    public synchronized boolean park(ParkedBatch batch) {
        if (parked.size() >= capacityLimit) {
            droppedCount.incrementAndGet();
            log.warn("Parked batch store '{}' is full, dropped record of batch {} (total dropped: {})",
                getResourceName(), batch.batchId(), droppedCount.get());
            recordError("PARKED_RECORD_DROPPED", "Parked batch store capacity exceeded",
                String.format("Pipeline: %s, Batch: %d, Total dropped: %d", batch.pipelineId(), batch.batchId(), droppedCount.get()));
            return false;
        }
        parked.add(batch);
        totalParked.incrementAndGet();
        return true;
    }

    @Override
    public List<ParkedBatch> list() {
        return new ArrayList<>(parked);
    }

    @Override
    public int size() {
        return parked.size();
    }

    @Override
    public long getCapacityLimit() {
        return capacityLimit;
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }

    @Override
    public UsageState getUsageState(String usageType) {
        return parked.size() < capacityLimit ? UsageState.ACTIVE : UsageState.FAILED;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("parked_batches", parked.size());
        metrics.put("total_parked", totalParked.get());
        metrics.put("dropped_records", droppedCount.get());
        metrics.put("capacity", capacityLimit);
    }
}
