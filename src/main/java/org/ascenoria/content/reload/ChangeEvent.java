package org.ascenoria.content.reload;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A signal that content may have changed.
 *
 * @param kind      What happened.
 * @param path      The affected path, or {@code null} for manual requests.
 * @param timestamp When the event was observed.
 */
public record ChangeEvent(Kind kind, Path path, Instant timestamp) {

    public enum Kind {
        /** A file or directory under a watched root was created, modified or deleted. */
        FILE_CHANGED,
        /** The watcher lost events; the content must be reloaded anyway. */
        OVERFLOW,
        /** A reload requested explicitly, e.g. by an operator. */
        MANUAL
    }

    public static ChangeEvent fileChanged(Path path) {
        return new ChangeEvent(Kind.FILE_CHANGED, path, Instant.now());
    }

    public static ChangeEvent overflow(Path directory) {
        return new ChangeEvent(Kind.OVERFLOW, directory, Instant.now());
    }

    public static ChangeEvent manual() {
        return new ChangeEvent(Kind.MANUAL, null, Instant.now());
    }
}
