package org.ascenoria.content.validation;

import org.ascenoria.content.diagnostics.DiagnosticCode;
import org.ascenoria.content.diagnostics.DiagnosticsEngine;
import org.ascenoria.content.merge.MergedCollection;
import org.ascenoria.content.merge.MergedContent;
import org.ascenoria.content.model.ContentRecord;
import org.ascenoria.content.model.EntityDefinition;
import org.ascenoria.content.model.LocalizedText;

import java.util.ArrayList;
import java.util.List;

/**
 * Warns about entities whose name or description lacks one of the configured locales.
 * English is enforced at decode time and is not checked here.
 */
public class LocalizationRule implements ValidationRule {

    private final List<String> locales;

    /**
     * @param locales The locales every text should provide.
     */
    public LocalizationRule(List<String> locales) {
        this.locales = locales.stream().filter(l -> !LocalizedText.ENGLISH.equals(l)).toList();
    }

    @Override
    public void validate(MergedContent content, DiagnosticsEngine diagnostics) {
        if (locales.isEmpty()) {
            return;
        }
        for (MergedCollection<?> collection : content.all()) {
            if (!collection.type().isEntityCollection()) {
                continue;
            }
            for (ContentRecord record : collection.records().values()) {
                check(collection, (EntityDefinition) record, diagnostics);
            }
        }
    }

    private void check(MergedCollection<?> collection, EntityDefinition entity, DiagnosticsEngine diagnostics) {
        for (String locale : locales) {
            final List<String> missing = new ArrayList<>(2);
            if (!entity.name().has(locale)) {
                missing.add("name");
            }
            if (entity.description() != null && !entity.description().has(locale)) {
                missing.add("description");
            }
            if (!missing.isEmpty()) {
                diagnostics.reportWarning(DiagnosticCode.MISSING_LOCALIZATION, collection.type().name(), entity.id(),
                        collection.lastWriter(entity.id()),
                        "missing '" + locale + "' text for " + String.join(", ", missing));
            }
        }
    }
}
