package org.tweann.orchestration.api;

/**
 * Lifecycle of a long-running service that owns its own thread.
 */
public interface IService {

    /**
     * Lifecycle states.
     */
    enum State {
        STOPPED,
        RUNNING,
        PAUSED,
        ERROR
    }

    /**
     * Whether the service thread may be interrupted right now.
     * <p>
     * {@code WAITING} services are idle or blocked and are interrupted immediately on stop.
     * {@code PROCESSING} services are in the middle of a unit of work that would be lost if
     * interrupted; stop waits for the grace period before interrupting them.
     */
    enum ShutdownPhase {
        WAITING,
        PROCESSING
    }

    void start();

    void stop();

    void pause();

    void resume();

    State getCurrentState();

    ShutdownPhase getShutdownPhase();
}
