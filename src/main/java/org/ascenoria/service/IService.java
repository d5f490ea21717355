package org.ascenoria.service;

/**
 * A component with its own thread and a start/stop lifecycle.
 */
public interface IService {

    /**
     * The operational state of a service.
     */
    enum State {
        /** Not running; {@link #start()} makes it active. */
        STOPPED,
        /** The service thread is active. */
        RUNNING,
        /** The service thread died from an unexpected error. */
        ERROR
    }

    /**
     * Starts the service thread.
     *
     * @throws IllegalStateException if the service is not stopped.
     */
    void start();

    /**
     * Interrupts the service thread and waits for it to finish.
     *
     * @throws IllegalStateException if the service is not running.
     */
    void stop();

    State getCurrentState();
}
