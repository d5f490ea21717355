package org.ascenoria.content.diagnostics;

/**
 * A single problem found while loading content.
 *
 * @param severity   Whether the problem blocks publication.
 * @param code       The machine-readable problem code.
 * @param collection The affected collection name, or {@code null} if not collection specific.
 * @param id         The affected record key, or {@code null}.
 * @param source     The pack or file the problem was found in, or {@code null}.
 * @param message    Human-readable description.
 */
public record Diagnostic(
        Severity severity,
        DiagnosticCode code,
        String collection,
        String id,
        String source,
        String message
) {
    /**
     * The severity of a diagnostic.
     */
    public enum Severity {
        /** Aborts the candidate load. */
        FATAL,
        /** Reported, but does not prevent publication. */
        WARNING
    }

    public boolean isFatal() {
        return severity == Severity.FATAL;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append('[').append(severity).append("] ").append(code);
        if (collection != null) {
            sb.append(' ').append(collection);
            if (id != null) {
                sb.append('/').append(id);
            }
        }
        if (source != null) {
            sb.append(" (").append(source).append(')');
        }
        return sb.append(": ").append(message).toString();
    }
}
