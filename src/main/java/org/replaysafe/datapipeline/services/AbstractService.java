package org.replaysafe.datapipeline.services;

import com.typesafe.config.Config;
import org.replaysafe.datapipeline.api.resources.IMonitorable;
import org.replaysafe.datapipeline.api.resources.IResource;
import org.replaysafe.datapipeline.api.resources.OperationalError;
import org.replaysafe.datapipeline.api.services.IService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An abstract base class for all services, providing lifecycle management, thread handling,
 * resource access utilities and error tracking. Subclasses implement {@link #run()}.
 * <p>
 * Work wrapped in {@link #runUninterruptibly(CriticalSection)} is never interrupted by
 * {@link #stop()}: the stop request is delivered as soon as the section returns. Services use
 * this for storage transactions, which must either commit or roll back completely.
 */
public abstract class AbstractService implements IService, IMonitorable {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String serviceName;
    protected final Config options;
    protected final Map<String, List<IResource>> resources;
    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private final Object pauseLock = new Object();
    private final Object interruptLock = new Object();
    private final long stopTimeoutMs;
    private volatile Thread serviceThread;
    private boolean stopRequested;
    private boolean inCriticalSection;

    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    /**
     * A unit of work that must not be interrupted halfway.
     *
     * @param <T> Result type.
     * @param <E> Checked exception thrown by the work.
     */
    @FunctionalInterface
    protected interface CriticalSection<T, E extends Exception> {
        T call() throws E;
    }

    /**
     * @param name      The name of the service instance.
     * @param options   The configuration for this service.
     * @param resources Resource ports mapped to the (wrapped) resources bound to them.
     */
    protected AbstractService(String name, Config options, Map<String, List<IResource>> resources) {
        this.serviceName = name;
        this.options = options;
        this.resources = resources;
        this.stopTimeoutMs = options.hasPath("stopTimeoutMs") ? options.getLong("stopTimeoutMs") : 30_000L;
    }

    protected int getMaxErrors() {
        return 10000;
    }

    @Override
    public final void start() {
        if (!currentState.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot start service '%s' as it is already in state %s", serviceName, getCurrentState()));
        }
        synchronized (interruptLock) {
            stopRequested = false;
            inCriticalSection = false;
        }
        serviceThread = new Thread(this::runService);
        serviceThread.setName(serviceName);
        serviceThread.start();
        logStarted();
    }

    /**
     * Logs the startup. Services override this to print their effective settings.
     */
    protected void logStarted() {
        log.info("{} started", this.getClass().getSimpleName());
    }

    @Override
    public final void stop() {
        State state = getCurrentState();
        if (state != State.RUNNING && state != State.PAUSED) {
            throw new IllegalStateException(String.format("Cannot stop service '%s' as it is in state %s", serviceName, state));
        }
        if (state == State.PAUSED) {
            synchronized (pauseLock) {
                pauseLock.notifyAll();
            }
        }

        Thread thread = serviceThread;
        if (thread != null) {
            synchronized (interruptLock) {
                stopRequested = true;
                if (!inCriticalSection) {
                    thread.interrupt();
                }
            }
            try {
                thread.join(stopTimeoutMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted while waiting for service thread to stop", this.getClass().getSimpleName());
            }

            if (thread.isAlive()) {
                log.error("{} thread did not stop within {} ms, forcing ERROR state", this.getClass().getSimpleName(), stopTimeoutMs);
                currentState.set(State.ERROR);
                return;
            }
        }

        if (getCurrentState() != State.STOPPED && getCurrentState() != State.ERROR) {
            currentState.set(State.STOPPED);
        }
        log.debug("{} stopped", this.getClass().getSimpleName());
    }

    @Override
    public final void pause() {
        if (!currentState.compareAndSet(State.RUNNING, State.PAUSED)) {
            throw new IllegalStateException(String.format("Cannot pause service '%s' as it is in state %s", serviceName, getCurrentState()));
        }
        log.info("{} paused", this.getClass().getSimpleName());
    }

    @Override
    public final void resume() {
        if (!currentState.compareAndSet(State.PAUSED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot resume service '%s' as it is in state %s", serviceName, getCurrentState()));
        }
        log.info("{} resumed", this.getClass().getSimpleName());
        synchronized (pauseLock) {
            pauseLock.notifyAll();
        }
    }

    @Override
    public void restart() {
        if (getCurrentState() == State.RUNNING || getCurrentState() == State.PAUSED) {
            stop();
        }
        if (getCurrentState() == State.ERROR) {
            currentState.set(State.STOPPED);
        }
        start();
    }

    @Override
    public State getCurrentState() {
        return currentState.get();
    }

    /**
     * Runs {@link #run()} and maps its outcome to the service state: a clean return or an
     * interruption ends in STOPPED, any other exception in ERROR.
     */
    private void runService() {
        try {
            run();
        } catch (InterruptedException e) {
            log.debug("Service thread interrupted, shutting down.");
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("{} stopped with ERROR due to {}: {}",
                this.getClass().getSimpleName(), e.getClass().getSimpleName(), e.getMessage());
            log.debug("Exception details:", e);
            currentState.set(State.ERROR);
        } finally {
            if (getCurrentState() != State.ERROR) {
                currentState.set(State.STOPPED);
            }
            log.debug("Service thread for {} has terminated.", this.getClass().getSimpleName());
        }
    }

    /**
     * The main logic of the service, executed in a dedicated thread.
     * <p>
     * <strong>Error handling guidelines:</strong>
     * <ul>
     *   <li>Transient errors: {@code log.warn(...)} without the exception, {@link #recordError(String, String, String)}, keep running.</li>
     *   <li>Fatal errors: {@code log.error(...)} and throw; the service ends in ERROR.</li>
     *   <li>Shutdown: let {@link InterruptedException} propagate.</li>
     *   <li>Retries: log attempts at DEBUG or WARN, record only the final outcome.</li>
     * </ul>
     *
     * @throws InterruptedException if the service thread is interrupted.
     */
    protected abstract void run() throws InterruptedException;

    /**
     * Blocks while the service is PAUSED.
     *
     * @return {@code true} if the call actually waited, i.e. the service was paused and has been resumed.
     * @throws InterruptedException if the thread is interrupted while waiting.
     */
    protected boolean checkPause() throws InterruptedException {
        boolean waited = false;
        synchronized (pauseLock) {
            while (getCurrentState() == State.PAUSED) {
                if (isStopRequested()) {
                    throw new InterruptedException("Stop requested while paused");
                }
                waited = true;
                log.debug("Service is paused, waiting...");
                pauseLock.wait();
                log.debug("Woke up from pause.");
            }
        }
        return waited;
    }

    /**
     * Executes the section with interrupts held back. A pending interrupt is cleared before
     * the section starts and restored afterwards; a stop requested meanwhile is delivered as an
     * interrupt once the section has returned or thrown.
     */
    protected final <T, E extends Exception> T runUninterruptibly(CriticalSection<T, E> section) throws E {
        boolean wasInterrupted;
        synchronized (interruptLock) {
            inCriticalSection = true;
            wasInterrupted = Thread.interrupted();
        }
        try {
            return section.call();
        } finally {
            synchronized (interruptLock) {
                inCriticalSection = false;
                if (wasInterrupted || stopRequested) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    protected boolean isStopRequested() {
        synchronized (interruptLock) {
            return stopRequested;
        }
    }

    /**
     * Gets the single resource bound to a port.
     *
     * @throws IllegalStateException if the port is missing, has not exactly one resource, or the type does not match.
     */
    protected <T extends IResource> T getRequiredResource(String portName, Class<T> expectedType) {
        List<IResource> resourceList = resources.get(portName);
        if (resourceList == null) {
            throw new IllegalStateException("Resource port '" + portName + "' is not configured.");
        }
        if (resourceList.size() != 1) {
            throw new IllegalStateException("Resource port '" + portName + "' has " + resourceList.size() + " resources, but exactly one is required.");
        }
        return cast(portName, resourceList.get(0), expectedType);
    }

    /**
     * Gets the resource bound to a port if the port is configured.
     *
     * @throws IllegalStateException if the port has more than one resource or the type does not match.
     */
    protected <T extends IResource> Optional<T> getOptionalResource(String portName, Class<T> expectedType) {
        List<IResource> resourceList = resources.get(portName);
        if (resourceList == null || resourceList.isEmpty()) {
            return Optional.empty();
        }
        if (resourceList.size() > 1) {
            throw new IllegalStateException("Resource port '" + portName + "' has " + resourceList.size() + " resources, but at most one is allowed.");
        }
        return Optional.of(cast(portName, resourceList.get(0), expectedType));
    }

    private static <T> T cast(String portName, IResource resource, Class<T> expectedType) {
        if (!expectedType.isInstance(resource)) {
            throw new IllegalStateException("Resource at port '" + portName + "' is of type " + resource.getClass().getName() + ", but expected type is " + expectedType.getName());
        }
        return expectedType.cast(resource);
    }

    /**
     * Records a transient error. Use only when the service keeps running; fatal errors are thrown.
     *
     * @param code    Error code, e.g. "MISSING_FIELD".
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

    /**
     * ERROR state or any recorded error makes the service unhealthy.
     */
    @Override
    public boolean isHealthy() {
        if (getCurrentState() == State.ERROR) {
            return false;
        }
        return errors.isEmpty();
    }

    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook for service-specific metrics. Overrides must call {@code super.addCustomMetrics(metrics)} first.
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // no custom metrics by default
    }
}
