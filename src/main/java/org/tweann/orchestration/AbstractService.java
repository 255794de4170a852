package org.tweann.orchestration;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tweann.orchestration.api.IMonitorable;
import org.tweann.orchestration.api.IService;
import org.tweann.orchestration.api.OperationalError;

/**
 * Base class for services that run their work loop on a dedicated thread.
 * <p>
 * Provides the lifecycle ({@code STOPPED → RUNNING ⇄ PAUSED → STOPPED}, or {@code ERROR} when
 * {@link #run()} throws), cooperative pausing through {@link #checkPause()}, graceful stopping
 * through {@link #isStopRequested()} and a bounded collection of {@link OperationalError}s.
 * <p>
 * Error handling conventions for subclasses:
 * <ul>
 *   <li><strong>Transient</strong> (the service keeps running): {@code log.warn} without the
 *       exception, then {@link #recordError(String, String, String)}.</li>
 *   <li><strong>Fatal</strong> (the service must stop): {@code log.error} without the exception,
 *       then throw. The service moves to {@code ERROR}; the stack trace is logged at DEBUG.</li>
 *   <li><strong>Shutdown</strong>: let {@link InterruptedException} propagate.</li>
 * </ul>
 * Options: {@code shutdown-timeout} (duration, default 5s) is the grace period {@link #stop()}
 * grants a service in the {@code PROCESSING} phase before interrupting it.
 */
public abstract class AbstractService implements IService, IMonitorable {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String serviceName;
    protected final Config options;
    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final Object pauseLock = new Object();
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();
    private final Duration shutdownTimeout;
    private volatile ShutdownPhase currentShutdownPhase = ShutdownPhase.WAITING;
    private Thread serviceThread;

    protected AbstractService(String name, Config options) {
        this.serviceName = name;
        this.options = options;
        this.shutdownTimeout = options.hasPath("shutdown-timeout")
                ? options.getDuration("shutdown-timeout")
                : Duration.ofSeconds(5);
    }

    /**
     * Maximum number of errors kept; the oldest are dropped beyond it.
     */
    protected int getMaxErrors() {
        return 1000;
    }

    @Override
    public final void start() {
        if (!currentState.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot start service '%s' as it is already in state %s",
                    serviceName, getCurrentState()));
        }
        stopRequested.set(false);
        serviceThread = new Thread(this::runService, serviceName);
        serviceThread.start();
        logStarted();
    }

    /**
     * Logs the start of the service. Subclasses may log their configuration instead.
     */
    protected void logStarted() {
        log.info("{} started", this.getClass().getSimpleName());
    }

    /**
     * Requests a graceful stop and waits for the service thread.
     * <p>
     * A service in the {@code WAITING} phase is interrupted at once. A {@code PROCESSING} service
     * gets the shutdown timeout to finish its current unit of work and is interrupted afterwards.
     * If the thread is still alive after that, the service is put into {@code ERROR}.
     *
     * @throws IllegalStateException if the service is neither running nor paused.
     */
    @Override
    public final void stop() {
        State state = getCurrentState();
        if (state != State.RUNNING && state != State.PAUSED) {
            throw new IllegalStateException(String.format("Cannot stop service '%s' as it is in state %s",
                    serviceName, state));
        }

        stopRequested.set(true);
        synchronized (pauseLock) {
            pauseLock.notifyAll();
        }

        if (serviceThread != null) {
            try {
                if (getShutdownPhase() == ShutdownPhase.WAITING) {
                    serviceThread.interrupt();
                }
                serviceThread.join(shutdownTimeout.toMillis());
                if (serviceThread.isAlive()) {
                    log.warn("{} did not stop within {}, forcing interrupt",
                            this.getClass().getSimpleName(), shutdownTimeout);
                    serviceThread.interrupt();
                    serviceThread.join(1000);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted while waiting for service shutdown", this.getClass().getSimpleName());
            }

            if (serviceThread.isAlive()) {
                log.error("{} thread did not stop after forced interrupt, setting ERROR state",
                        this.getClass().getSimpleName());
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
            throw new IllegalStateException(String.format("Cannot pause service '%s' as it is in state %s",
                    serviceName, getCurrentState()));
        }
        log.info("{} paused", this.getClass().getSimpleName());
    }

    @Override
    public final void resume() {
        if (!currentState.compareAndSet(State.PAUSED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot resume service '%s' as it is in state %s",
                    serviceName, getCurrentState()));
        }
        log.info("{} resumed", this.getClass().getSimpleName());
        synchronized (pauseLock) {
            pauseLock.notifyAll();
        }
    }

    @Override
    public State getCurrentState() {
        return currentState.get();
    }

    @Override
    public ShutdownPhase getShutdownPhase() {
        return currentShutdownPhase;
    }

    /**
     * Marks the start or end of a unit of work that must not be interrupted.
     * <p>
     * When entering {@code PROCESSING}, callers should clear a pending interrupt with
     * {@code Thread.interrupted()}: {@link #stop()} may have interrupted the thread while it was
     * still {@code WAITING}.
     */
    protected void setShutdownPhase(ShutdownPhase phase) {
        this.currentShutdownPhase = phase;
    }

    /**
     * Blocks while the service is paused. Call it from the {@link #run()} loop.
     *
     * @throws InterruptedException if interrupted while paused.
     */
    protected void checkPause() throws InterruptedException {
        synchronized (pauseLock) {
            while (getCurrentState() == State.PAUSED && !isStopRequested()) {
                log.debug("Service is paused, waiting...");
                pauseLock.wait();
            }
        }
    }

    /**
     * @return {@code true} once {@link #stop()} has been called. The {@link #run()} loop should
     *         finish its current unit of work and return.
     */
    protected boolean isStopRequested() {
        return stopRequested.get();
    }

    /**
     * The work loop, executed on the service thread.
     *
     * @throws InterruptedException if the thread is interrupted; treated as a clean shutdown.
     */
    protected abstract void run() throws InterruptedException;

    private void runService() {
        try {
            run();
        } catch (InterruptedException e) {
            log.debug("Service thread interrupted, shutting down.");
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            if (isInterruptInduced(e)) {
                log.debug("Service thread interrupted, shutting down.");
                Thread.currentThread().interrupt();
            } else {
                log.error("{} stopped with ERROR due to {}: {}", this.getClass().getSimpleName(),
                        e.getClass().getSimpleName(), e.getMessage());
                log.debug("Exception details:", e);
                currentState.set(State.ERROR);
            }
        } finally {
            if (getCurrentState() != State.ERROR) {
                currentState.set(State.STOPPED);
            }
            log.debug("Service thread for {} has terminated.", this.getClass().getSimpleName());
        }
    }

    private static boolean isInterruptInduced(Throwable t) {
        for (Throwable current = t; current != null; current = current.getCause()) {
            if (current instanceof InterruptedException) {
                return true;
            }
        }
        return false;
    }

    /**
     * Records a transient error. Not for fatal errors: those are logged and thrown.
     *
     * @param code    Category, e.g. {@code STEP_FAILED}.
     * @param message Human-readable summary.
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
     * Unhealthy in {@code ERROR} state or once any error has been recorded.
     */
    @Override
    public boolean isHealthy() {
        if (getCurrentState() == State.ERROR) return false;
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
     * Hook for service-specific metrics. Overrides should call {@code super} first.
     *
     * @param metrics Mutable map already holding the base metrics.
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }
}
