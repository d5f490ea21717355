package org.ascenoria.content.api;

import org.ascenoria.content.diagnostics.Diagnostic;

import java.util.List;

/**
 * Thrown when a candidate load is aborted by at least one fatal diagnostic.
 * <p>
 * Carries every diagnostic of the aborted run, fatal and advisory, so callers can report them.
 */
public class ContentLoadException extends Exception {

    private final List<Diagnostic> diagnostics;

    public ContentLoadException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public List<Diagnostic> fatalDiagnostics() {
        return diagnostics.stream().filter(Diagnostic::isFatal).toList();
    }
}
