package org.ascenoria.content.validation;

import org.ascenoria.content.diagnostics.DiagnosticsEngine;
import org.ascenoria.content.merge.MergedContent;

/**
 * One check over the fully merged content.
 * <p>
 * Rules never modify the content; they only report diagnostics.
 */
@FunctionalInterface
public interface ValidationRule {

    /**
     * @param content     The merged content.
     * @param diagnostics Receives every violation found.
     */
    void validate(MergedContent content, DiagnosticsEngine diagnostics);
}
