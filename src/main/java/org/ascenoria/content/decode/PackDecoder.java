package org.ascenoria.content.decode;

import org.ascenoria.content.api.CancellationSignal;
import org.ascenoria.content.api.ContentSourceException;
import org.ascenoria.content.diagnostics.Diagnostic;
import org.ascenoria.content.diagnostics.DiagnosticCode;
import org.ascenoria.content.diagnostics.DiagnosticsEngine;
import org.ascenoria.content.model.CollectionType;
import org.ascenoria.content.model.ContentCollections;
import org.ascenoria.content.model.ContentRecord;
import org.ascenoria.content.model.VictoryRules;
import org.ascenoria.content.sources.PackSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decodes every file of one pack.
 * <p>
 * Each file is decoded independently so that all broken files of a pack are reported at once.
 * If any file fails, the whole pack is excluded: a broken mod yields warnings, a broken base
 * pack yields fatal diagnostics since it cannot be excluded.
 */
public class PackDecoder {

    private static final Logger log = LoggerFactory.getLogger(PackDecoder.class);

    private final FileDecoder fileDecoder;

    public PackDecoder(FileDecoder fileDecoder) {
        this.fileDecoder = fileDecoder;
    }

    /**
     * @param source      The pack to decode.
     * @param diagnostics Receives one diagnostic per failing or ambiguous file.
     * @param signal      Checked before each file.
     * @return The decoded pack, or empty if the pack had to be excluded.
     */
    public Optional<DecodedSource> decode(PackSource source, DiagnosticsEngine diagnostics, CancellationSignal signal) {
        final Map<CollectionType<?, ?>, List<? extends ContentRecord>> records = new LinkedHashMap<>();
        boolean failed = false;

        for (CollectionType<?, ?> collection : ContentCollections.ALL) {
            signal.throwIfCancelled();
            final Optional<Path> file = locate(source, collection.fileName(), collection.name(), diagnostics);
            if (file.isEmpty()) {
                continue;
            }
            try {
                final List<? extends ContentRecord> decoded = fileDecoder.decodeCollection(file.get(), collection);
                records.put(collection, decoded);
                log.debug("Decoded {} {} record(s) from {}", decoded.size(), collection, file.get());
            } catch (ContentSourceException e) {
                failed = true;
                reportFailure(source, collection.name(), e, diagnostics);
            }
        }

        VictoryRules victoryRules = null;
        signal.throwIfCancelled();
        final Optional<Path> rulesFile = locate(source, ContentCollections.VICTORY_RULES_FILE,
                ContentCollections.VICTORY_RULES_KEY, diagnostics);
        if (rulesFile.isPresent()) {
            try {
                victoryRules = fileDecoder.decodeVictoryRules(rulesFile.get());
            } catch (ContentSourceException e) {
                failed = true;
                reportFailure(source, ContentCollections.VICTORY_RULES_KEY, e, diagnostics);
            }
        }

        if (failed) {
            if (source.isBase()) {
                log.debug("Base pack has undecodable files");
            } else {
                log.warn("Excluding {}: one or more data files could not be decoded", source);
            }
            return Optional.empty();
        }
        return Optional.of(new DecodedSource(source, records, victoryRules));
    }

    private Optional<Path> locate(PackSource source, String baseName, String collection, DiagnosticsEngine diagnostics) {
        final List<Path> candidates = DataFormat.candidates(source.dataDirectory(), baseName);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        if (candidates.size() > 1) {
            diagnostics.reportWarning(DiagnosticCode.AMBIGUOUS_FILE, collection, null, source.toString(),
                    "both " + candidates + " exist; using " + candidates.get(0).getFileName());
        }
        return Optional.of(candidates.get(0));
    }

    private static void reportFailure(PackSource source, String collection, ContentSourceException e,
                                      DiagnosticsEngine diagnostics) {
        final Diagnostic.Severity severity = source.isBase() ? Diagnostic.Severity.FATAL : Diagnostic.Severity.WARNING;
        final String message = e.path().getFileName() + ": " + e.getMessage();
        diagnostics.report(new Diagnostic(severity, e.code(), collection, null, source.toString(), message));
        log.debug("Decoding failed for {}", e.path(), e);
    }
}
