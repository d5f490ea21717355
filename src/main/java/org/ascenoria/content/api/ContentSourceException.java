package org.ascenoria.content.api;

import org.ascenoria.content.diagnostics.DiagnosticCode;

import java.nio.file.Path;

/**
 * Thrown when a single file or pack cannot be used.
 * <p>
 * These failures are recovered locally: the offending source is excluded and loading continues.
 */
public class ContentSourceException extends Exception {

    private final DiagnosticCode code;
    private final Path path;

    /**
     * @param code    The problem code.
     * @param path    The offending file or pack directory.
     * @param message The detail message.
     */
    public ContentSourceException(DiagnosticCode code, Path path, String message) {
        this(code, path, message, null);
    }

    /**
     * @param code    The problem code.
     * @param path    The offending file or pack directory.
     * @param message The detail message.
     * @param cause   The cause.
     */
    public ContentSourceException(DiagnosticCode code, Path path, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.path = path;
    }

    public DiagnosticCode code() {
        return code;
    }

    public Path path() {
        return path;
    }
}
