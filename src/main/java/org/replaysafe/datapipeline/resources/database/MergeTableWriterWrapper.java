package org.replaysafe.datapipeline.resources.database;

import org.replaysafe.datapipeline.api.contracts.FingerprintedEvent;
import org.replaysafe.datapipeline.api.contracts.MergeResult;
import org.replaysafe.datapipeline.api.resources.ResourceContext;
import org.replaysafe.datapipeline.api.resources.database.IMergeTableWriter;
import org.replaysafe.datapipeline.api.resources.database.MergeVersionPolicy;
import org.replaysafe.datapipeline.api.resources.database.StorageException;
import org.replaysafe.datapipeline.utils.monitoring.SlidingWindowCounter;
import org.replaysafe.datapipeline.utils.monitoring.SlidingWindowPercentiles;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Binding for {@code db-merge}. Binding parameters override the database options:
 * <pre>
 * resources { merge = "db-merge:merge-db?mergeVersionPolicy=ALWAYS&amp;mergeTimeoutMs=10000" }
 * </pre>
 */
public class MergeTableWriterWrapper extends AbstractDatabaseWrapper implements IMergeTableWriter {

    private final MergeVersionPolicy policy;
    private final long mergeTimeoutMs;

    private final AtomicLong merges = new AtomicLong(0);
    private final AtomicLong failedMerges = new AtomicLong(0);
    private final SlidingWindowCounter mergedRows;
    private final SlidingWindowPercentiles mergeLatency;

    MergeTableWriterWrapper(AbstractDatabaseResource db, ResourceContext context) {
        super(db, context);
        this.policy = MergeVersionPolicy.valueOf(setting("mergeVersionPolicy", "ON_CHANGE").toUpperCase(Locale.ROOT));
        this.mergeTimeoutMs = Long.parseLong(setting("mergeTimeoutMs", "30000"));
        if (mergeTimeoutMs <= 0) {
            throw new IllegalArgumentException("mergeTimeoutMs must be positive, got: " + mergeTimeoutMs);
        }
        this.mergedRows = new SlidingWindowCounter(metricsWindowSeconds);
        this.mergeLatency = new SlidingWindowPercentiles(metricsWindowSeconds);
    }

    private String setting(String key, String defaultValue) {
        String fromBinding = context.parameters().get(key);
        if (fromBinding != null) {
            return fromBinding;
        }
        return database.getOptions().hasPath(key) ? database.getOptions().getString(key) : defaultValue;
    }

    @Override
    public MergeResult merge(List<FingerprintedEvent> batch) throws StorageException {
        long startNanos = System.nanoTime();
        try {
            MergeResult result = database.doMerge(ensureConnection(), batch, policy, mergeTimeoutMs);
            merges.incrementAndGet();
            mergedRows.recordSum(result.rowsTouched());
            mergeLatency.record(System.nanoTime() - startNanos);
            return result;
        } catch (StorageException e) {
            failedMerges.incrementAndGet();
            onFailure("MERGE_FAILED", "Merge of " + batch.size() + " rows", e);
            throw e;
        }
    }

    public MergeVersionPolicy getPolicy() {
        return policy;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("merges", merges.get());
        metrics.put("failed_merges", failedMerges.get());
        metrics.put("merged_rows_per_sec", mergedRows.getRate());
        metrics.put("merge_latency_p50_ms", mergeLatency.getPercentile(50) / 1_000_000.0);
        metrics.put("merge_latency_p99_ms", mergeLatency.getPercentile(99) / 1_000_000.0);
        metrics.put("merge_latency_avg_ms", mergeLatency.getAverage() / 1_000_000.0);
    }
}
