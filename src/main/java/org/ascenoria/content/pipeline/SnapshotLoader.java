package org.ascenoria.content.pipeline;

import org.ascenoria.content.api.CancellationSignal;
import org.ascenoria.content.api.ContentLoadException;
import org.ascenoria.content.api.Snapshot;

/**
 * Builds a complete candidate snapshot from the current file-system contents.
 */
@FunctionalInterface
public interface SnapshotLoader {

    /**
     * @param signal Polled between stages; the load stops with a
     *               {@link java.util.concurrent.CancellationException} once it is set.
     * @return The candidate snapshot.
     * @throws ContentLoadException if the candidate has fatal diagnostics.
     */
    Snapshot load(CancellationSignal signal) throws ContentLoadException;
}
