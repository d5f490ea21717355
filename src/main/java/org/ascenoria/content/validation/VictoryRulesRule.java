package org.ascenoria.content.validation;

import org.ascenoria.content.diagnostics.DiagnosticCode;
import org.ascenoria.content.diagnostics.DiagnosticsEngine;
import org.ascenoria.content.merge.MergedContent;
import org.ascenoria.content.model.ContentCollections;
import org.ascenoria.content.model.VictoryRules;

/**
 * Range checks for the victory rules singleton.
 */
public class VictoryRulesRule implements ValidationRule {

    @Override
    public void validate(MergedContent content, DiagnosticsEngine diagnostics) {
        final VictoryRules rules = content.victoryRules();
        final double threshold = rules.dominationThreshold();
        if (!Double.isFinite(threshold) || threshold <= 0 || threshold > 1) {
            diagnostics.reportFatal(DiagnosticCode.INVARIANT_VIOLATION, ContentCollections.VICTORY_RULES_KEY, null,
                    content.victoryRulesSource(), "domination_threshold must be in (0, 1] (was " + threshold + ")");
        }
        if (rules.turnLimit() != null && rules.turnLimit() <= 0) {
            diagnostics.reportFatal(DiagnosticCode.INVARIANT_VIOLATION, ContentCollections.VICTORY_RULES_KEY, null,
                    content.victoryRulesSource(), "turn_limit must be greater than zero (was " + rules.turnLimit() + ")");
        }
    }
}
