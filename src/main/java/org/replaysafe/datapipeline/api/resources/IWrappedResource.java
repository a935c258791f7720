package org.replaysafe.datapipeline.api.resources;

/**
 * Marker for per-binding wrappers created by an {@link IContextualResource}.
 */
public interface IWrappedResource extends IResource {
}
