package org.ascenoria.content.merge;

import org.ascenoria.content.decode.DecodedSource;
import org.ascenoria.content.model.CollectionType;
import org.ascenoria.content.model.ContentCollections;
import org.ascenoria.content.model.ContentRecord;
import org.ascenoria.content.model.VictoryRules;
import org.ascenoria.content.sources.PackSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds decoded sources, in load order, into one ordered map per collection.
 * <p>
 * The first occurrence of a key fixes its position; every later occurrence replaces the stored
 * record entirely. Relation records fold on their composite key the same way. The engine does
 * not validate anything; keys defined twice inside one source are only recorded.
 */
public class MergeEngine {

    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    /**
     * @param decoded Decoded sources in load order.
     * @return The merged content.
     */
    public MergedContent merge(List<DecodedSource> decoded) {
        final Map<CollectionType<?, ?>, MergedCollection<?>> collections = new LinkedHashMap<>();
        for (CollectionType<?, ?> type : ContentCollections.ALL) {
            collections.put(type, mergeCollection(type, decoded));
        }

        VictoryRules rules = VictoryRules.DEFAULTS;
        String rulesSource = null;
        for (DecodedSource source : decoded) {
            if (source.victoryRules() != null) {
                rules = source.victoryRules();
                rulesSource = source.source().toString();
            }
        }

        final List<PackSource> sources = decoded.stream().map(DecodedSource::source).toList();
        log.debug("Merged {} source(s)", sources.size());
        return new MergedContent(collections, rules, rulesSource, sources);
    }

    private <R extends ContentRecord> MergedCollection<R> mergeCollection(CollectionType<R, ?> type,
                                                                          List<DecodedSource> decoded) {
        final LinkedHashMap<String, R> records = new LinkedHashMap<>();
        final Map<String, String> writers = new HashMap<>();
        final Map<String, Integer> overrides = new HashMap<>();
        final List<DuplicateKey> duplicates = new ArrayList<>();

        for (DecodedSource source : decoded) {
            final String sourceName = source.source().toString();
            final Set<String> seenInSource = new HashSet<>();
            for (R record : source.records(type)) {
                final String key = record.key();
                if (!seenInSource.add(key)) {
                    duplicates.add(new DuplicateKey(key, sourceName));
                }
                if (records.put(key, record) != null) {
                    overrides.merge(key, 1, Integer::sum);
                    log.trace("{} '{}' overridden by {}", type, key, sourceName);
                }
                writers.put(key, sourceName);
            }
        }
        return new MergedCollection<>(type, records, writers, overrides, duplicates);
    }
}
