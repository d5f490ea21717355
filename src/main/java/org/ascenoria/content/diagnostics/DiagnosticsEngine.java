package org.ascenoria.content.diagnostics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of one pipeline run.
 * <p>
 * This decouples problem reporting from the stages that detect problems. Not thread-safe;
 * each run owns its own engine.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports a problem that aborts the candidate load.
     */
    public void reportFatal(DiagnosticCode code, String collection, String id, String source, String message) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.FATAL, code, collection, id, source, message));
    }

    /**
     * Reports an advisory problem.
     */
    public void reportWarning(DiagnosticCode code, String collection, String id, String source, String message) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.WARNING, code, collection, id, source, message));
    }

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public void reportAll(Collection<Diagnostic> more) {
        diagnostics.addAll(more);
    }

    /**
     * @return {@code true} if at least one fatal diagnostic was reported.
     */
    public boolean hasFatal() {
        return diagnostics.stream().anyMatch(Diagnostic::isFatal);
    }

    public long fatalCount() {
        return diagnostics.stream().filter(Diagnostic::isFatal).count();
    }

    public long warningCount() {
        return diagnostics.size() - fatalCount();
    }

    /**
     * @return An unmodifiable view of all diagnostics, in report order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return All diagnostics, one per line.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
