package org.ascenoria.content.api;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation flag polled by the pipeline between stages and files.
 */
@FunctionalInterface
public interface CancellationSignal {

    /** A signal that is never cancelled. */
    CancellationSignal NONE = () -> false;

    boolean isCancelled();

    /**
     * @throws CancellationException if the run was cancelled.
     */
    default void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("content load superseded");
        }
    }
}
