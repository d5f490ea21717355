package org.ascenoria.content.validation;

import org.ascenoria.content.diagnostics.DiagnosticCode;
import org.ascenoria.content.diagnostics.DiagnosticsEngine;
import org.ascenoria.content.merge.MergedCollection;
import org.ascenoria.content.merge.MergedContent;
import org.ascenoria.content.model.ContentRecord;
import org.ascenoria.content.model.ReferenceField;

import java.util.Set;

/**
 * Checks that every declared cross-collection reference names an existing id.
 * Unset optional references are skipped.
 */
public class ReferenceRule implements ValidationRule {

    @Override
    public void validate(MergedContent content, DiagnosticsEngine diagnostics) {
        for (MergedCollection<?> collection : content.all()) {
            check(content, collection, diagnostics);
        }
    }

    private <R extends ContentRecord> void check(MergedContent content, MergedCollection<R> collection,
                                                 DiagnosticsEngine diagnostics) {
        for (ReferenceField<R> reference : collection.type().references()) {
            final Set<String> targetIds = content.collection(reference.target()).records().keySet();
            for (R record : collection.records().values()) {
                final String value = reference.valueOf(record);
                if (value != null && !targetIds.contains(value)) {
                    diagnostics.reportFatal(DiagnosticCode.UNRESOLVED_REFERENCE, collection.type().name(), record.key(),
                            collection.lastWriter(record.key()),
                            String.format("%s '%s' does not name an existing %s", reference.field(), value,
                                    reference.target().name()));
                }
            }
        }
    }
}
