package org.ascenoria.content.validation;

import org.ascenoria.content.diagnostics.DiagnosticCode;
import org.ascenoria.content.diagnostics.DiagnosticsEngine;
import org.ascenoria.content.merge.MergedCollection;
import org.ascenoria.content.merge.MergedContent;
import org.ascenoria.content.model.ContentRecord;
import org.ascenoria.content.model.FieldConstraint;
import org.ascenoria.content.model.RecordCheck;

/**
 * Checks the numeric constraints and record checks each collection declares.
 */
public class ConstraintRule implements ValidationRule {

    @Override
    public void validate(MergedContent content, DiagnosticsEngine diagnostics) {
        for (MergedCollection<?> collection : content.all()) {
            check(collection, diagnostics);
        }
    }

    private <R extends ContentRecord> void check(MergedCollection<R> collection, DiagnosticsEngine diagnostics) {
        if (collection.type().constraints().isEmpty() && collection.type().checks().isEmpty()) {
            return;
        }
        for (R record : collection.records().values()) {
            for (FieldConstraint<R> constraint : collection.type().constraints()) {
                if (!constraint.isSatisfiedBy(record)) {
                    diagnostics.reportFatal(DiagnosticCode.INVARIANT_VIOLATION, collection.type().name(), record.key(),
                            collection.lastWriter(record.key()),
                            String.format("%s (was %s)", constraint, format(constraint.valueOf(record))));
                }
            }
            for (RecordCheck<R> check : collection.type().checks()) {
                check.violation(record).ifPresent(message -> diagnostics.reportFatal(
                        DiagnosticCode.INVARIANT_VIOLATION, collection.type().name(), record.key(),
                        collection.lastWriter(record.key()), message));
            }
        }
    }

    private static String format(double value) {
        return value == Math.rint(value) && Double.isFinite(value) ? Long.toString((long) value) : Double.toString(value);
    }
}
