package org.ascenoria.content.validation;

import org.ascenoria.content.diagnostics.DiagnosticCode;
import org.ascenoria.content.diagnostics.DiagnosticsEngine;
import org.ascenoria.content.merge.MergedCollection;
import org.ascenoria.content.merge.MergedContent;

import java.util.regex.Pattern;

/**
 * Warns about entity ids that are not lowercase words separated by single underscores.
 */
public class NamingConventionRule implements ValidationRule {

    static final Pattern ID_PATTERN = Pattern.compile("^[a-z][a-z0-9]*(_[a-z0-9]+)*$");

    @Override
    public void validate(MergedContent content, DiagnosticsEngine diagnostics) {
        for (MergedCollection<?> collection : content.all()) {
            if (!collection.type().isEntityCollection()) {
                continue;
            }
            for (String id : collection.records().keySet()) {
                if (!ID_PATTERN.matcher(id).matches()) {
                    diagnostics.reportWarning(DiagnosticCode.NAMING_CONVENTION, collection.type().name(), id,
                            collection.lastWriter(id), "id should be lowercase words separated by '_'");
                }
            }
        }
    }
}
