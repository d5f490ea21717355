package org.ascenoria.content.merge;

import org.ascenoria.content.model.CollectionType;
import org.ascenoria.content.model.ContentRecord;
import org.ascenoria.content.model.VictoryRules;
import org.ascenoria.content.sources.PackSource;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The merged view of every collection plus the winning victory rules.
 *
 * @param collections        Merged collections, in stable collection order.
 * @param victoryRules       The last-written victory rules, or the defaults.
 * @param victoryRulesSource The source that wrote the rules, or {@code null} for the defaults.
 * @param sources            The sources that were merged, in load order.
 */
public record MergedContent(
        Map<CollectionType<?, ?>, MergedCollection<?>> collections,
        VictoryRules victoryRules,
        String victoryRulesSource,
        List<PackSource> sources
) {

    public MergedContent {
        collections = Collections.unmodifiableMap(new LinkedHashMap<>(collections));
        sources = List.copyOf(sources);
    }

    @SuppressWarnings("unchecked")
    public <R extends ContentRecord> MergedCollection<R> collection(CollectionType<R, ?> type) {
        final MergedCollection<?> merged = collections.get(type);
        if (merged == null) {
            throw new IllegalArgumentException("Collection was not merged: " + type);
        }
        return (MergedCollection<R>) merged;
    }

    public Collection<MergedCollection<?>> all() {
        return collections.values();
    }
}
