package org.replaysafe.datapipeline.resources.database;

import org.replaysafe.datapipeline.api.resources.IResource;
import org.replaysafe.datapipeline.api.resources.IWrappedResource;
import org.replaysafe.datapipeline.api.resources.ResourceContext;
import org.replaysafe.datapipeline.api.resources.database.StorageException;
import org.replaysafe.datapipeline.api.resources.database.StorageUnavailableException;
import org.replaysafe.datapipeline.resources.AbstractResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;

/**
 * Base class for per-binding database wrappers.
 * <p>
 * A wrapper acquires its dedicated connection lazily on first use and keeps it until
 * {@link #close()}. After a fatal storage error the connection is dropped, so the next
 * call starts on a fresh connection from the pool.
 */
public abstract class AbstractDatabaseWrapper extends AbstractResource implements IWrappedResource, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AbstractDatabaseWrapper.class);

    protected final AbstractDatabaseResource database;
    protected final ResourceContext context;
    protected final int metricsWindowSeconds;

    private Connection cachedConnection;

    protected AbstractDatabaseWrapper(AbstractDatabaseResource db, ResourceContext context) {
        super(db.getResourceName() + "-" + context.usageType(), db.getOptions());
        this.database = db;
        this.context = context;
        this.metricsWindowSeconds = db.getOptions().hasPath("metricsWindowSeconds")
            ? db.getOptions().getInt("metricsWindowSeconds")
            : 5;
    }

    /**
     * @return The cached connection, acquiring a new one if there is none or it was closed.
     * @throws StorageUnavailableException if no connection can be obtained.
     */
    protected synchronized Connection ensureConnection() throws StorageUnavailableException {
        if (cachedConnection == null || isClosed(cachedConnection)) {
            try {
                cachedConnection = database.acquireDedicatedConnection();
                log.debug("Acquired database connection for service '{}' ({})", context.serviceName(), context.usageType());
            } catch (SQLException e) {
                cachedConnection = null;
                throw new StorageUnavailableException("Failed to acquire connection to database '"
                        + database.getResourceName() + "': " + e.getMessage(), e);
            }
        }
        return cachedConnection;
    }

    public synchronized void releaseConnection() {
        if (cachedConnection != null) {
            try {
                cachedConnection.close();
                log.debug("Released database connection for service '{}'", context.serviceName());
            } catch (SQLException e) {
                log.debug("Failed to release connection (may already be closed): {}", e.getMessage());
            } finally {
                cachedConnection = null;
            }
        }
    }

    /**
     * Common failure bookkeeping: counts and records the error, and drops the connection if
     * the failure was not transient.
     */
    protected void onFailure(String code, String operation, StorageException e) {
        log.warn("{} failed on database '{}' for service '{}': {}", operation, database.getResourceName(),
                context.serviceName(), e.getMessage());
        recordError(code, operation + " failed", e.getClass().getSimpleName() + ": " + e.getMessage());
        if (!e.isRetryable()) {
            releaseConnection();
        }
    }

    private static boolean isClosed(Connection connection) {
        try {
            return connection.isClosed();
        } catch (SQLException e) {
            return true;
        }
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("connection_cached", cachedConnection != null ? 1 : 0);
    }

    @Override
    public boolean isHealthy() {
        return super.isHealthy() && database.isHealthy();
    }

    @Override
    public String getResourceName() {
        return database.getResourceName();
    }

    @Override
    public IResource.UsageState getUsageState(String usageType) {
        return database.getUsageState(usageType);
    }

    @Override
    public void close() {
        releaseConnection();
    }
}
