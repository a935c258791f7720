package org.replaysafe.datapipeline;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import org.replaysafe.datapipeline.api.resources.IContextualResource;
import org.replaysafe.datapipeline.api.resources.IMonitorable;
import org.replaysafe.datapipeline.api.resources.IResource;
import org.replaysafe.datapipeline.api.resources.ResourceContext;
import org.replaysafe.datapipeline.api.services.IService;
import org.replaysafe.datapipeline.api.services.IServiceFactory;
import org.replaysafe.datapipeline.api.services.ResourceBinding;
import org.replaysafe.datapipeline.api.services.ServiceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds resources and services from the {@code pipeline} section of the configuration and
 * drives their lifecycle.
 * <p>
 * Resources are created once and live until {@link #shutdown()}. Services are created from
 * factories on every start, so a stopped service can be started again with fresh state while
 * the durable state stays in its resources.
 */
public class ServiceManager {

    private static final Logger log = LoggerFactory.getLogger(ServiceManager.class);

    private final Config pipelineConfig;
    private final Map<String, IServiceFactory> serviceFactories = new LinkedHashMap<>();
    // Contains all service instances (RUNNING, PAUSED, STOPPED, ERROR)
    private final Map<String, IService> services = new ConcurrentHashMap<>();
    private final Map<String, IResource> resources = new LinkedHashMap<>();
    private final Map<String, List<ResourceBinding>> serviceResourceBindings = new ConcurrentHashMap<>();
    private final List<String> startupSequence;
    private final Map<String, List<PendingBinding>> pendingBindingsMap = new ConcurrentHashMap<>();
    // Wrapped resources of the service currently being created, handed from startService to its factory
    private final Map<String, Map<String, List<IResource>>> activeWrappedResources = new ConcurrentHashMap<>();

    public ServiceManager(Config rootConfig) {
        this.pipelineConfig = loadPipelineConfig(rootConfig);
        log.info("Initializing ServiceManager...");

        instantiateResources(this.pipelineConfig);
        buildServiceFactories(this.pipelineConfig);

        if (pipelineConfig.hasPath("startupSequence")) {
            this.startupSequence = pipelineConfig.getStringList("startupSequence");
        } else {
            this.startupSequence = new ArrayList<>(serviceFactories.keySet());
        }

        log.info("ServiceManager initialized with {} resources and {} service factories.", resources.size(), serviceFactories.size());

        boolean autoStart = !pipelineConfig.hasPath("autoStart") || pipelineConfig.getBoolean("autoStart");
        if (autoStart && !this.startupSequence.isEmpty()) {
            log.info("\u001B[34m════════════════════════════════ Service Startup ════════════════════════════════════════\u001B[0m");
            startAllInternal();
        } else if (!autoStart) {
            log.info("Auto-start is disabled. Services must be started explicitly.");
        } else {
            log.info("No services to start.");
        }
    }

    private Config loadPipelineConfig(Config rootConfig) {
        if (!rootConfig.hasPath("pipeline")) {
            throw new IllegalArgumentException("Configuration must contain 'pipeline' section");
        }
        return rootConfig.getConfig("pipeline");
    }

    private void instantiateResources(Config config) {
        if (!config.hasPath("resources")) {
            log.debug("No resources configured.");
            return;
        }
        log.info("\u001B[34m══════════════════════════════ Resource Initialization ══════════════════════════════════\u001B[0m");
        Config resourcesConfig = config.getConfig("resources");
        for (String resourceName : resourcesConfig.root().keySet()) {
            try {
                Config resourceDefinition = resourcesConfig.getConfig(resourceName);
                String className = resourceDefinition.getString("className");
                Config options = resourceDefinition.hasPath("options")
                        ? resourceDefinition.getConfig("options")
                        : ConfigFactory.empty();

                IResource resource = (IResource) Class.forName(className)
                        .getConstructor(String.class, Config.class)
                        .newInstance(resourceName, options);
                resources.put(resourceName, resource);
                log.info("Instantiated resource '{}' of type {}", resourceName, className);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Failed to instantiate resource '{}': {}. Skipping this resource.", resourceName, cause.getMessage());
                log.debug("Resource instantiation failure:", cause);
            } catch (Exception e) {
                log.error("Failed to instantiate resource '{}': {}. Skipping this resource.", resourceName, e.getMessage(), e);
            }
        }
    }

    private void buildServiceFactories(Config config) {
        if (!config.hasPath("services")) {
            log.debug("No services configured.");
            return;
        }
        log.info("\u001B[34m═══════════════════════════════ Service Initialization ══════════════════════════════════\u001B[0m");
        Config servicesConfig = config.getConfig("services");
        for (String serviceName : servicesConfig.root().keySet()) {
            try {
                Config serviceDefinition = servicesConfig.getConfig(serviceName);
                String className = serviceDefinition.getString("className");
                Config options = serviceDefinition.hasPath("options") ? serviceDefinition.getConfig("options") : ConfigFactory.empty();

                List<PendingBinding> pendingBindings = new ArrayList<>();
                if (serviceDefinition.hasPath("resources")) {
                    Config resourcesConfig = serviceDefinition.getConfig("resources");
                    for (Map.Entry<String, ConfigValue> entry : resourcesConfig.root().entrySet()) {
                        String portName = entry.getKey();
                        String resourceUri = entry.getValue().unwrapped().toString();
                        ResourceContext context = parseResourceUri(resourceUri, serviceName, portName);
                        IResource baseResource = resources.get(context.resourceName());
                        if (baseResource == null) {
                            throw new IllegalArgumentException(String.format("Service '%s' references unknown resource '%s' for port '%s'", serviceName, context.resourceName(), portName));
                        }
                        pendingBindings.add(new PendingBinding(context, baseResource));
                    }
                }
                pendingBindingsMap.put(serviceName, pendingBindings);

                Constructor<?> constructor = Class.forName(className)
                        .getConstructor(String.class, Config.class, Map.class);

                IServiceFactory factory = () -> {
                    Map<String, List<IResource>> injectableResources = activeWrappedResources.get(serviceName);
                    if (injectableResources == null) {
                        throw new IllegalStateException("No wrapped resources prepared for service: " + serviceName);
                    }
                    try {
                        return (IService) constructor.newInstance(serviceName, options, injectableResources);
                    } catch (InvocationTargetException e) {
                        Throwable cause = e.getCause();
                        if (cause instanceof RuntimeException runtime) {
                            throw runtime;
                        }
                        throw new IllegalStateException("Failed to create an instance of service '" + serviceName + "'", cause);
                    } catch (ReflectiveOperationException e) {
                        throw new IllegalStateException("Failed to create an instance of service '" + serviceName + "'", e);
                    }
                };
                serviceFactories.put(serviceName, factory);

                log.info("Built factory for service '{}' of type {}", serviceName, className);
            } catch (Exception e) {
                log.error("Failed to build factory for service '{}': {}. Skipping this service.", serviceName, e.getMessage());
                log.debug("Factory failure:", e);
            }
        }
    }

    /**
     * Parses {@code usageType:resourceName?key=value&key2=value2}. The usage type is optional.
     */
    static ResourceContext parseResourceUri(String uri, String serviceName, String portName) {
        String[] mainParts = uri.split(":", 2);

        String usageType;
        String resourceAndParamsStr;

        if (mainParts.length == 2) {
            usageType = mainParts[0];
            resourceAndParamsStr = mainParts[1];
        } else {
            usageType = null;
            resourceAndParamsStr = uri;
        }

        String[] resourceAndParams = resourceAndParamsStr.split("\\?", 2);
        String resourceName = resourceAndParams[0];
        Map<String, String> params = new HashMap<>();
        if (resourceAndParams.length > 1) {
            Arrays.stream(resourceAndParams[1].split("&"))
                  .map(p -> p.split("=", 2))
                  .filter(p -> p.length == 2)
                  .forEach(p -> params.put(p[0], p[1]));
        }
        return new ResourceContext(serviceName, portName, usageType, resourceName, Collections.unmodifiableMap(params));
    }

    private record PendingBinding(ResourceContext context, IResource baseResource) {}

    private void applyToAllServices(Consumer<String> action, List<String> serviceNames) {
        for (String serviceName : serviceNames) {
            try {
                action.accept(serviceName);
            } catch (IllegalStateException | IllegalArgumentException e) {
                log.warn("Could not perform action on service '{}': {}", serviceName, e.getMessage());
            }
        }
    }

    private void startAllInternal() {
        applyToAllServices(this::startService, new ArrayList<>(startupSequence));
    }

    /**
     * Stops all running or paused services in reverse startup order. Resources stay open.
     */
    public void stopAll() {
        log.info("\u001B[34m═════════════════════════════════ Stopping Services ═════════════════════════════════════\u001B[0m");
        List<String> toStop = new ArrayList<>(startupSequence);
        Collections.reverse(toStop);
        services.keySet().stream().filter(s -> !toStop.contains(s)).forEach(toStop::add);
        List<String> actuallyStoppable = toStop.stream()
                .filter(name -> {
                    IService service = services.get(name);
                    if (service == null) return false;
                    IService.State state = service.getCurrentState();
                    return state == IService.State.RUNNING || state == IService.State.PAUSED;
                })
                .collect(Collectors.toList());
        applyToAllServices(this::stopService, actuallyStoppable);
    }

    /**
     * Stops all services and closes all resources. Once resources are closed the manager cannot
     * start services again.
     */
    public void shutdown() {
        stopAll();
        closeAllResources();
    }

    private void closeAllResources() {
        log.info("\u001B[34m════════════════════════════════ Closing Resources ══════════════════════════════════════\u001B[0m");

        for (Map.Entry<String, IResource> entry : resources.entrySet()) {
            String resourceName = entry.getKey();
            IResource resource = entry.getValue();

            if (resource instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                    log.info("Closed resource: {}", resourceName);
                } catch (Exception e) {
                    log.error("Failed to close resource '{}': {}", resourceName, e.getMessage());
                }
            } else {
                log.debug("Resource '{}' does not implement AutoCloseable, skipping", resourceName);
            }
        }
    }

    public void startService(String name) {
        IService existing = services.get(name);
        if (existing != null) {
            IService.State state = existing.getCurrentState();
            if (state == IService.State.STOPPED || state == IService.State.ERROR) {
                log.debug("Removing previous instance of service '{}' (state: {}) before creating new instance", name, state);
                services.remove(name);
                serviceResourceBindings.remove(name);
            } else {
                throw new IllegalStateException("Service '" + name + "' is already running (state: " + state + "). Stop it first.");
            }
        }

        IServiceFactory factory = serviceFactories.get(name);
        if (factory == null) {
            throw new IllegalArgumentException("Service '" + name + "' is not defined.");
        }

        try {
            log.debug("Creating a new instance for service '{}'.", name);

            // Wrapped resources are created once and shared by injection and bindings
            List<PendingBinding> pendingBindings = pendingBindingsMap.getOrDefault(name, Collections.emptyList());
            Map<String, List<IResource>> wrappedResourcesMap = new HashMap<>();
            Map<ResourceContext, IResource> contextToWrappedResource = new HashMap<>();

            for (PendingBinding pb : pendingBindings) {
                IResource wrappedResource = (pb.baseResource() instanceof IContextualResource contextual)
                        ? contextual.getWrappedResource(pb.context())
                        : pb.baseResource();
                wrappedResourcesMap.computeIfAbsent(pb.context().portName(), k -> new ArrayList<>()).add(wrappedResource);
                contextToWrappedResource.put(pb.context(), wrappedResource);
            }

            activeWrappedResources.put(name, wrappedResourcesMap);

            try {
                IService newServiceInstance = factory.create();

                List<ResourceBinding> finalBindings = pendingBindings.stream()
                        .map(pb -> new ResourceBinding(pb.context(), newServiceInstance, contextToWrappedResource.get(pb.context())))
                        .collect(Collectors.toList());
                serviceResourceBindings.put(name, Collections.unmodifiableList(finalBindings));

                services.put(name, newServiceInstance);

                newServiceInstance.start();
            } finally {
                activeWrappedResources.remove(name);
            }
        } catch (IllegalArgumentException e) {
            services.remove(name);
            serviceResourceBindings.remove(name);
            log.error("Configuration error for service '{}': {}", name, e.getMessage());
        } catch (RuntimeException e) {
            services.remove(name);
            serviceResourceBindings.remove(name);
            log.error("Failed to create and start a new instance for service '{}'.", name, e);
            throw e;
        }
    }

    public void stopService(String name) {
        IService service = services.get(name);
        if (service != null) {
            stopAndAwait(service, name);
            // The instance stays registered with state STOPPED for monitoring until the next start.
        } else {
            log.warn("Attempted to stop service '{}', but it was not found among services.", name);
        }
    }

    public void pauseService(String serviceName) {
        getServiceOrFail(serviceName).pause();
    }

    public void resumeService(String serviceName) {
        getServiceOrFail(serviceName).resume();
    }

    private void stopAndAwait(IService service, String serviceName) {
        log.info("Stopping service '{}'...", serviceName);
        service.stop();

        try {
            for (int i = 0; i < 100; i++) {
                if (service.getCurrentState() == IService.State.STOPPED) {
                    log.debug("Service '{}' has stopped.", serviceName);
                    return;
                }
                Thread.sleep(50);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for service '{}' to stop.", serviceName);
        }

        if (service.getCurrentState() != IService.State.STOPPED) {
            log.warn("Service '{}' did not stop within the allocated time.", serviceName);
        }
    }

    private IService getServiceOrFail(String serviceName) {
        IService service = services.get(serviceName);
        if (service == null) {
            throw new IllegalArgumentException("Service not found: " + serviceName);
        }
        return service;
    }

    /**
     * @return The running instance of a service, if it has been started.
     */
    public Optional<IService> getService(String serviceName) {
        return Optional.ofNullable(services.get(serviceName));
    }

    /**
     * @return The base resource registered under the name, if it was instantiated.
     */
    public Optional<IResource> getResource(String resourceName) {
        return Optional.ofNullable(resources.get(resourceName));
    }

    public Map<String, ServiceStatus> getAllServiceStatus() {
        return serviceFactories.keySet().stream()
                .collect(Collectors.toMap(Function.identity(), this::getServiceStatus, (v1, v2) -> v1, LinkedHashMap::new));
    }

    public Map<String, IResource> getAllResources() {
        return Collections.unmodifiableMap(resources);
    }

    public ServiceStatus getServiceStatus(String serviceName) {
        if (!serviceFactories.containsKey(serviceName)) {
            throw new IllegalArgumentException("Service not found: " + serviceName);
        }

        IService service = services.get(serviceName);
        if (service == null) {
            return new ServiceStatus(IService.State.STOPPED, true, Collections.emptyMap(), Collections.emptyList(), Collections.emptyList());
        }

        List<ResourceBinding> resourceBindings = serviceResourceBindings.getOrDefault(serviceName, Collections.emptyList());
        Map<String, Number> serviceMetrics = (service instanceof IMonitorable monitorable) ? monitorable.getMetrics() : Collections.emptyMap();
        boolean healthy = (service instanceof IMonitorable monitorable) ? monitorable.isHealthy() : (service.getCurrentState() != IService.State.ERROR);

        return new ServiceStatus(
                service.getCurrentState(),
                healthy,
                serviceMetrics,
                service.getErrors(),
                resourceBindings
        );
    }
}
