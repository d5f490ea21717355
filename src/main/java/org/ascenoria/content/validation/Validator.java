package org.ascenoria.content.validation;

import org.ascenoria.content.diagnostics.DiagnosticsEngine;
import org.ascenoria.content.merge.MergedContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the fixed rule set over merged content.
 * <p>
 * Fatal rules: duplicate ids, numeric constraints and structural invariants, unresolved
 * references. Advisory rules: missing localization and naming convention. The caller decides
 * what to do with the result; any fatal diagnostic aborts the candidate load as a whole.
 */
public class Validator {

    private static final Logger log = LoggerFactory.getLogger(Validator.class);

    private final List<ValidationRule> rules;

    public Validator(List<ValidationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Creates a validator with the standard rule set.
     *
     * @param locales Locales checked by the localization rule.
     * @return The validator.
     */
    public static Validator standard(List<String> locales) {
        return new Validator(List.of(
                new DuplicateIdRule(),
                new ConstraintRule(),
                new ReferenceRule(),
                new PrerequisiteCycleRule(),
                new VictoryRulesRule(),
                new LocalizationRule(locales),
                new NamingConventionRule()));
    }

    /**
     * @param content     The merged content.
     * @param diagnostics Receives every violation.
     * @return {@code true} if no fatal diagnostic was reported by this validation.
     */
    public boolean validate(MergedContent content, DiagnosticsEngine diagnostics) {
        final long fatalBefore = diagnostics.fatalCount();
        for (ValidationRule rule : rules) {
            rule.validate(content, diagnostics);
        }
        final long fatal = diagnostics.fatalCount() - fatalBefore;
        log.debug("Validation finished with {} fatal diagnostic(s)", fatal);
        return fatal == 0;
    }
}
