package org.ascenoria.content.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owner of the current snapshot.
 * <p>
 * Readers call {@link #current()} without locking and see either the old or the new snapshot,
 * never a mix. Publishing is a single atomic reference swap.
 */
public final class SnapshotHandle {

    private static final Logger log = LoggerFactory.getLogger(SnapshotHandle.class);

    private final AtomicReference<Snapshot> current = new AtomicReference<>();
    private final List<SnapshotListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * @return The current snapshot.
     * @throws IllegalStateException if nothing has been published yet.
     */
    public Snapshot current() {
        final Snapshot snapshot = current.get();
        if (snapshot == null) {
            throw new IllegalStateException("No content snapshot has been published yet");
        }
        return snapshot;
    }

    public boolean isPublished() {
        return current.get() != null;
    }

    /**
     * Makes a snapshot current and notifies the listeners.
     *
     * @param snapshot The new snapshot.
     * @return The replaced snapshot, or {@code null}.
     */
    public Snapshot publish(Snapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot must not be null");
        }
        final Snapshot previous = current.getAndSet(snapshot);
        for (SnapshotListener listener : listeners) {
            try {
                listener.onPublished(previous, snapshot);
            } catch (RuntimeException e) {
                log.warn("Snapshot listener {} failed: {}", listener, e.getMessage());
                log.debug("Exception details:", e);
            }
        }
        return previous;
    }

    public void addListener(SnapshotListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SnapshotListener listener) {
        listeners.remove(listener);
    }
}
