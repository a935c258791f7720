package org.replaysafe.datapipeline.api.resources;

import java.util.List;
import java.util.Map;

/**
 * Implemented by components that expose metrics, operational errors and a health flag.
 */
public interface IMonitorable {

    /**
     * @return A snapshot of the current metrics, keyed by metric name.
     */
    Map<String, Number> getMetrics();

    /**
     * @return The operational errors recorded so far, oldest first.
     */
    List<OperationalError> getErrors();

    void clearErrors();

    /**
     * @return {@code true} if the component works without known problems.
     */
    boolean isHealthy();
}
