package org.replaysafe.datapipeline.api.services;

import org.replaysafe.datapipeline.api.resources.OperationalError;

import java.util.List;
import java.util.Map;

public record ServiceStatus(
    IService.State state,
    boolean healthy,
    Map<String, Number> metrics,
    List<OperationalError> errors,
    List<ResourceBinding> resourceBindings
) {
}
