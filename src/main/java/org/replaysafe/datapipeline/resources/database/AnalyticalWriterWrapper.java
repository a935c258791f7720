package org.replaysafe.datapipeline.resources.database;

import org.replaysafe.datapipeline.api.contracts.AnalyticalRow;
import org.replaysafe.datapipeline.api.resources.ResourceContext;
import org.replaysafe.datapipeline.api.resources.database.AnalyticalSinkException;
import org.replaysafe.datapipeline.api.resources.database.IAnalyticalWriter;
import org.replaysafe.datapipeline.api.resources.database.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.replaysafe.datapipeline.utils.monitoring.SlidingWindowCounter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Binding for {@code db-analytical}. Failures are not recorded here: the caller retries
 * them and escalates once its retry budget is spent.
 */
public class AnalyticalWriterWrapper extends AbstractDatabaseWrapper implements IAnalyticalWriter {

    private static final Logger log = LoggerFactory.getLogger(AnalyticalWriterWrapper.class);

    private final AtomicLong appends = new AtomicLong(0);
    private final AtomicLong failedAppends = new AtomicLong(0);
    private final SlidingWindowCounter appendedRows;

    AnalyticalWriterWrapper(AbstractDatabaseResource db, ResourceContext context) {
        super(db, context);
        this.appendedRows = new SlidingWindowCounter(metricsWindowSeconds);
    }

    @Override
    public void append(List<AnalyticalRow> rows) throws AnalyticalSinkException {
        try {
            database.doAppendAnalytical(ensureConnection(), rows);
        } catch (AnalyticalSinkException e) {
            failedAppends.incrementAndGet();
            log.debug("Analytical append of {} rows failed: {}", rows.size(), e.getMessage());
            releaseConnection();
            throw e;
        } catch (StorageUnavailableException e) {
            failedAppends.incrementAndGet();
            log.debug("Analytical store '{}' unavailable: {}", database.getResourceName(), e.getMessage());
            throw new AnalyticalSinkException(e.getMessage(), e);
        }
        appends.incrementAndGet();
        appendedRows.recordSum(rows.size());
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("appends", appends.get());
        metrics.put("failed_appends", failedAppends.get());
        metrics.put("appended_rows_per_sec", appendedRows.getRate());
    }
}
