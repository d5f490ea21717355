package org.ascenoria.content.validation;

import org.ascenoria.content.diagnostics.DiagnosticCode;
import org.ascenoria.content.diagnostics.DiagnosticsEngine;
import org.ascenoria.content.merge.DuplicateKey;
import org.ascenoria.content.merge.MergedCollection;
import org.ascenoria.content.merge.MergedContent;
import org.ascenoria.content.model.ContentRecord;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Reports keys defined twice in one source, and re-checks that merged keys are unique.
 */
public class DuplicateIdRule implements ValidationRule {

    @Override
    public void validate(MergedContent content, DiagnosticsEngine diagnostics) {
        for (MergedCollection<?> collection : content.all()) {
            final String name = collection.type().name();
            for (DuplicateKey duplicate : collection.duplicates()) {
                diagnostics.reportFatal(DiagnosticCode.DUPLICATE_ID, name, duplicate.key(), duplicate.source(),
                        "'" + duplicate.key() + "' is defined more than once in the same source");
            }
            final Set<String> seen = new HashSet<>();
            for (Map.Entry<String, ? extends ContentRecord> entry : collection.records().entrySet()) {
                final String key = entry.getValue().key();
                if (!key.equals(entry.getKey()) || !seen.add(key)) {
                    diagnostics.reportFatal(DiagnosticCode.DUPLICATE_ID, name, key, collection.lastWriter(entry.getKey()),
                            "'" + key + "' is not unique after merge");
                }
            }
        }
    }
}
