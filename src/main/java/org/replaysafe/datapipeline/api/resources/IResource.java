package org.replaysafe.datapipeline.api.resources;

/**
 * The base interface for all resources in the pipeline, such as the event log,
 * the databases behind the merge and analytical sinks, or the parked-batch store.
 */
public interface IResource {

    /**
     * The state of a resource from the point of view of one usage type.
     */
    enum UsageState {
        /** The resource can serve the usage type right now. */
        ACTIVE,
        /** The resource is reachable but currently has nothing to offer (e.g. empty log). */
        WAITING,
        /** The resource cannot serve the usage type. */
        FAILED
    }

    /**
     * @return The unique name of this resource instance from the configuration.
     */
    String getResourceName();

    /**
     * Returns the state of this resource for the given usage type.
     *
     * @param usageType The usage type as declared in a service binding (e.g. "db-merge").
     * @return The current usage state.
     * @throws IllegalArgumentException if the usage type is not supported by this resource.
     */
    UsageState getUsageState(String usageType);
}
