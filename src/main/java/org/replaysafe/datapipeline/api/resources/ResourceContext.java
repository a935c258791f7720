package org.replaysafe.datapipeline.api.resources;

import java.util.Map;

/**
 * Describes one binding of a resource to a service port, parsed from a URI of the form
 * {@code usageType:resourceName?key=value&key2=value2}.
 *
 * @param serviceName  Name of the service owning the binding.
 * @param portName     Port name inside the service.
 * @param usageType    Usage type, or {@code null} for non-contextual resources.
 * @param resourceName Name of the bound resource.
 * @param parameters   Optional binding parameters.
 */
public record ResourceContext(
        String serviceName,
        String portName,
        String usageType,
        String resourceName,
        Map<String, String> parameters
) {
}
