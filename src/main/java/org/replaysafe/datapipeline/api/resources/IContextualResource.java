package org.replaysafe.datapipeline.api.resources;

/**
 * A resource that hands out a dedicated wrapper per service binding. The wrapper
 * carries the binding's usage type and keeps per-binding state such as a cached
 * connection or per-port metrics.
 */
public interface IContextualResource extends IResource {

    /**
     * Creates the wrapper for one binding.
     *
     * @param context The binding context parsed from the service configuration.
     * @return A wrapper implementing the capability interface of the requested usage type.
     * @throws IllegalArgumentException if the usage type is not supported.
     */
    IWrappedResource getWrappedResource(ResourceContext context);
}
