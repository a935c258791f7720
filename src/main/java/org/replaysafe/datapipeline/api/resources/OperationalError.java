package org.replaysafe.datapipeline.api.resources;

import java.time.Instant;

/**
 * A transient error recorded by a service or resource. It does not stop the component
 * but marks it unhealthy until the errors are cleared.
 *
 * @param timestamp When the error occurred.
 * @param errorType A short code for categorization, e.g. "MISSING_FIELD".
 * @param message   Human-readable description.
 * @param details   Additional context.
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
