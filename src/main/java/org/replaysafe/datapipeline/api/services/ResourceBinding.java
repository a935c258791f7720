package org.replaysafe.datapipeline.api.services;

import org.replaysafe.datapipeline.api.resources.IResource;
import org.replaysafe.datapipeline.api.resources.ResourceContext;

/**
 * Connects a service port to the (possibly wrapped) resource instance injected into it.
 *
 * @param context  The parsed binding.
 * @param service  The service instance owning the port.
 * @param resource The resource instance the service actually talks to.
 */
public record ResourceBinding(
    ResourceContext context,
    IService service,
    IResource resource
) {
}
