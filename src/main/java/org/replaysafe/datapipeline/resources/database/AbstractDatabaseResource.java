package org.replaysafe.datapipeline.resources.database;

import com.typesafe.config.Config;
import org.replaysafe.datapipeline.api.contracts.AnalyticalRow;
import org.replaysafe.datapipeline.api.contracts.Checkpoint;
import org.replaysafe.datapipeline.api.contracts.FingerprintedEvent;
import org.replaysafe.datapipeline.api.contracts.MergeResult;
import org.replaysafe.datapipeline.api.contracts.MergeTableRow;
import org.replaysafe.datapipeline.api.resources.IContextualResource;
import org.replaysafe.datapipeline.api.resources.IWrappedResource;
import org.replaysafe.datapipeline.api.resources.ResourceContext;
import org.replaysafe.datapipeline.api.resources.database.AnalyticalSinkException;
import org.replaysafe.datapipeline.api.resources.database.MergeVersionPolicy;
import org.replaysafe.datapipeline.api.resources.database.StorageException;
import org.replaysafe.datapipeline.resources.AbstractResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Base class for database resources backing the merge table, the analytical table and the
 * checkpoint table.
 * <p>
 * Services never call the {@code do*} methods directly. They bind one of the usage types
 * below and receive a wrapper that owns a dedicated connection and per-binding metrics:
 * <ul>
 *   <li>{@code db-merge} → {@link MergeTableWriterWrapper}</li>
 *   <li>{@code db-merge-read} → {@link MergeTableReaderWrapper}</li>
 *   <li>{@code db-analytical} → {@link AnalyticalWriterWrapper}</li>
 *   <li>{@code db-analytical-read} → {@link AnalyticalReaderWrapper}</li>
 *   <li>{@code db-checkpoint} → {@link CheckpointStoreWrapper}</li>
 * </ul>
 * Each {@code do*} method runs exactly one transaction on the given connection and either
 * commits it or rolls it back before returning.
 */
public abstract class AbstractDatabaseResource extends AbstractResource implements IContextualResource, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AbstractDatabaseResource.class);

    protected final AtomicLong mergeTransactions = new AtomicLong(0);
    protected final AtomicLong rowsInserted = new AtomicLong(0);
    protected final AtomicLong rowsUpdated = new AtomicLong(0);
    protected final AtomicLong analyticalRowsAppended = new AtomicLong(0);
    protected final AtomicLong checkpointCommits = new AtomicLong(0);
    protected final AtomicLong writeErrors = new AtomicLong(0);
    protected final AtomicLong readErrors = new AtomicLong(0);

    private final List<AutoCloseable> activeWrappers = Collections.synchronizedList(new ArrayList<>());

    protected AbstractDatabaseResource(String name, Config options) {
        super(name, options);
    }

    @Override
    public final IWrappedResource getWrappedResource(ResourceContext context) {
        String usageType = context.usageType();
        if (usageType == null) {
            throw new IllegalArgumentException(String.format(
                    "Database resource '%s' requires a usage type (e.g. 'db-merge:%s')", getResourceName(), getResourceName()));
        }
        AbstractDatabaseWrapper wrapper = switch (usageType) {
            case "db-merge" -> new MergeTableWriterWrapper(this, context);
            case "db-merge-read" -> new MergeTableReaderWrapper(this, context);
            case "db-analytical" -> new AnalyticalWriterWrapper(this, context);
            case "db-analytical-read" -> new AnalyticalReaderWrapper(this, context);
            case "db-checkpoint" -> new CheckpointStoreWrapper(this, context);
            default -> throw new IllegalArgumentException("Unknown database usage type: " + usageType
                    + ". Supported: db-merge, db-merge-read, db-analytical, db-analytical-read, db-checkpoint");
        };
        activeWrappers.add(wrapper);
        return wrapper;
    }

    protected void closeAllWrappers() {
        if (!activeWrappers.isEmpty()) {
            log.debug("Closing {} wrappers for database '{}'", activeWrappers.size(), getResourceName());
        }
        synchronized (activeWrappers) {
            for (AutoCloseable wrapper : activeWrappers) {
                try {
                    wrapper.close();
                } catch (Exception e) {
                    log.warn("Failed to close wrapper for database '{}': {}", getResourceName(), e.getMessage());
                    recordError("WRAPPER_CLOSE_FAILED", "Failed to close wrapper", "Database: " + getResourceName());
                }
            }
            activeWrappers.clear();
        }
    }

    /**
     * Opens a connection with auto-commit disabled, held by one wrapper until it is closed.
     */
    protected abstract Connection acquireDedicatedConnection() throws SQLException;

    // ========================================================================
    // Merge table
    // ========================================================================

    /**
     * Upserts the batch in one transaction under the single-writer discipline.
     *
     * @param statementTimeoutMs Upper bound for the whole transaction.
     */
    protected abstract MergeResult doMerge(Connection connection, List<FingerprintedEvent> batch,
                                           MergeVersionPolicy policy, long statementTimeoutMs) throws StorageException;

    protected abstract long doCountMergeRows(Connection connection) throws StorageException;

    protected abstract long doSumMergeVersions(Connection connection) throws StorageException;

    protected abstract Optional<MergeTableRow> doFindMergeRow(Connection connection, String dedupKey) throws StorageException;

    // ========================================================================
    // Analytical table
    // ========================================================================

    protected abstract void doAppendAnalytical(Connection connection, List<AnalyticalRow> rows) throws AnalyticalSinkException;

    protected abstract long doCountAnalyticalRows(Connection connection) throws StorageException;

    protected abstract long doCountAnalyticalKeys(Connection connection) throws StorageException;

    protected abstract Optional<AnalyticalRow> doFindLatestAnalytical(Connection connection, String dedupKey) throws StorageException;

    /**
     * Collapses the analytical table to the newest version per key.
     *
     * @return Number of superseded rows removed.
     */
    public abstract int compactAnalytical() throws StorageException;

    // ========================================================================
    // Checkpoints
    // ========================================================================

    protected abstract void doCommitCheckpoint(Connection connection, String pipelineId, long batchId,
                                               Map<Integer, Long> offsets) throws StorageException;

    protected abstract Checkpoint doLoadCheckpoint(Connection connection, String pipelineId) throws StorageException;

    @Override
    public void close() {
        closeAllWrappers();
        try {
            closeConnectionPool();
        } catch (Exception e) {
            log.warn("Failed to close connection pool of database '{}': {}", getResourceName(), e.getMessage());
            recordError("POOL_CLOSE_FAILED", "Failed to close connection pool",
                "Database: " + getResourceName() + ", Error: " + e.getMessage());
        }
    }

    protected abstract void closeConnectionPool() throws Exception;

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("merge_transactions", mergeTransactions.get());
        metrics.put("rows_inserted", rowsInserted.get());
        metrics.put("rows_updated", rowsUpdated.get());
        metrics.put("analytical_rows_appended", analyticalRowsAppended.get());
        metrics.put("checkpoint_commits", checkpointCommits.get());
        metrics.put("write_errors", writeErrors.get());
        metrics.put("read_errors", readErrors.get());
    }

    @Override
    public UsageState getUsageState(String usageType) {
        return isHealthy() ? UsageState.ACTIVE : UsageState.FAILED;
    }
}
