package org.ascenoria.content.reload;

/**
 * States of the hot-reload loop.
 */
public enum SupervisorState {
    /** Waiting for change events and debouncing bursts. */
    IDLE,
    /** Building a candidate snapshot; a new event supersedes it. */
    LOADING,
    /** Swapping the current snapshot reference. */
    PUBLISHING
}
