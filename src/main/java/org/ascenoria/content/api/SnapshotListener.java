package org.ascenoria.content.api;

/**
 * Notified after a new snapshot has become current.
 */
@FunctionalInterface
public interface SnapshotListener {

    /**
     * @param previous The snapshot that was replaced, or {@code null} on the first publication.
     * @param current  The snapshot that is now current.
     */
    void onPublished(Snapshot previous, Snapshot current);
}
