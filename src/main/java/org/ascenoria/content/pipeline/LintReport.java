package org.ascenoria.content.pipeline;

import org.ascenoria.content.diagnostics.Diagnostic;

import java.util.List;

/**
 * Result of a lint run.
 *
 * @param diagnostics All diagnostics, in report order.
 * @param sources     The packs that were resolved, in load order.
 */
public record LintReport(List<Diagnostic> diagnostics, List<String> sources) {

    public LintReport {
        diagnostics = List.copyOf(diagnostics);
        sources = List.copyOf(sources);
    }

    public boolean hasFatal() {
        return diagnostics.stream().anyMatch(Diagnostic::isFatal);
    }

    public long fatalCount() {
        return diagnostics.stream().filter(Diagnostic::isFatal).count();
    }

    public long warningCount() {
        return diagnostics.size() - fatalCount();
    }
}
