package org.ascenoria.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class for services: lifecycle, the service thread and error tracking.
 * Subclasses implement {@link #run()}.
 * <p>
 * Error handling in {@link #run()}:
 * <ul>
 *   <li>Transient errors: {@code log.warn(...)} without the exception, {@link #recordError}, keep running.</li>
 *   <li>Fatal errors: {@code log.error(...)} without the exception, then throw; the state becomes ERROR.</li>
 *   <li>Shutdown: let the {@link InterruptedException} propagate.</li>
 * </ul>
 * Stack traces are logged at DEBUG only.
 */
public abstract class AbstractService implements IService, IMonitorable {

    private static final long STOP_TIMEOUT_MS = 5000;

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String serviceName;
    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();
    private Thread serviceThread;

    protected AbstractService(String name) {
        this.serviceName = name;
    }

    /**
     * Maximum number of recorded errors kept in memory; the oldest are dropped first.
     */
    protected int getMaxErrors() {
        return 1000;
    }

    @Override
    public final void start() {
        if (!currentState.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot start service '%s' as it is already in state %s", serviceName, getCurrentState()));
        }
        serviceThread = new Thread(this::runService);
        serviceThread.setName(serviceName);
        serviceThread.setDaemon(true);
        serviceThread.start();
        log.info("{} started", serviceName);
    }

    @Override
    public final void stop() {
        final State state = getCurrentState();
        if (state != State.RUNNING) {
            throw new IllegalStateException(String.format("Cannot stop service '%s' as it is in state %s", serviceName, state));
        }
        if (serviceThread != null) {
            serviceThread.interrupt();
            try {
                serviceThread.join(STOP_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted while waiting for service thread to stop", serviceName);
            }
            if (serviceThread.isAlive()) {
                log.error("{} thread did not stop within {} ms, forcing ERROR state", serviceName, STOP_TIMEOUT_MS);
                currentState.set(State.ERROR);
                return;
            }
        }
        onStopped();
        log.debug("{} stopped", serviceName);
    }

    /**
     * Called on the stopping thread after the service thread has finished.
     */
    protected void onStopped() {
    }

    @Override
    public State getCurrentState() {
        return currentState.get();
    }

    private void runService() {
        try {
            run();
        } catch (InterruptedException e) {
            log.debug("Service thread interrupted, shutting down.");
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("{} stopped with ERROR due to {}", serviceName, e.getClass().getSimpleName());
            log.debug("Exception details:", e);
            currentState.set(State.ERROR);
        } finally {
            if (getCurrentState() != State.ERROR) {
                currentState.set(State.STOPPED);
            }
            log.debug("Service thread for {} has terminated.", serviceName);
        }
    }

    /**
     * The service loop, executed on the service thread until interrupted.
     *
     * @throws InterruptedException when the service is being stopped.
     */
    protected abstract void run() throws InterruptedException;

    /**
     * Records a transient error the service recovered from. Affects {@link #isHealthy()}.
     *
     * @param code    Error category.
     * @param message Human-readable message.
     * @param details Additional context.
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        while (errors.size() > getMaxErrors()) {
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

    @Override
    public boolean isHealthy() {
        if (getCurrentState() == State.ERROR) {
            return false;
        }
        return errors.isEmpty();
    }

    @Override
    public final Map<String, Number> getMetrics() {
        final Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Adds service-specific metrics. Overrides should call {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics Mutable map already holding the base metrics.
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
    }
}
