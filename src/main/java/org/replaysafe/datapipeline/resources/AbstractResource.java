package org.replaysafe.datapipeline.resources;

import com.typesafe.config.Config;
import org.replaysafe.datapipeline.api.resources.IMonitorable;
import org.replaysafe.datapipeline.api.resources.IResource;
import org.replaysafe.datapipeline.api.resources.OperationalError;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Base class for all resources: name and options handling plus the error and metrics
 * plumbing shared with {@link org.replaysafe.datapipeline.services.AbstractService}.
 * <p>
 * <strong>Error handling guidelines for resources:</strong>
 * <ul>
 *   <li>Transient errors (resource keeps working): {@code log.warn(...)} without the exception,
 *       {@link #recordError(String, String, String)}, and throw if the caller has to react.</li>
 *   <li>Fatal errors (resource unusable): {@code log.error(...)} without the exception and throw.</li>
 *   <li>Retry attempts are logged at DEBUG; only the final outcome is recorded.</li>
 * </ul>
 */
public abstract class AbstractResource implements IResource, IMonitorable {

    protected final String resourceName;
    protected final Config options;

    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    protected AbstractResource(String name, Config options) {
        this.resourceName = Objects.requireNonNull(name, "Resource name cannot be null");
        this.options = Objects.requireNonNull(options, "Resource options cannot be null");
    }

    /**
     * Upper bound of retained errors; the oldest ones are evicted first.
     */
    protected int getMaxErrors() {
        return 10000;
    }

    @Override
    public String getResourceName() {
        return resourceName;
    }

    public Config getOptions() {
        return options;
    }

    /**
     * Records a transient error. Every recorded error makes {@link #isHealthy()} return
     * {@code false} until the errors are cleared.
     *
     * @param code    Error code, e.g. "MERGE_FAILED".
     * @param message Human-readable message.
     * @param details Additional context.
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        int maxErrors = getMaxErrors();
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    @Override
    public boolean isHealthy() {
        return errors.isEmpty();
    }

    /**
     * Returns {@code error_count} plus whatever {@link #addCustomMetrics(Map)} contributes.
     */
    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook for resource-specific metrics. Overrides must call {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics Mutable map that already contains the base metrics.
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // no custom metrics by default
    }
}
