package org.ascenoria.content.registry;

import org.ascenoria.content.derived.DerivedStats;
import org.ascenoria.content.derived.DerivedStatsTable;
import org.ascenoria.content.merge.MergedCollection;
import org.ascenoria.content.merge.MergedContent;
import org.ascenoria.content.model.ContentRecord;
import org.ascenoria.content.model.CollectionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link GameRegistry} from validated content and its derived stats.
 * <p>
 * Indexes follow the merge order, so identical inputs yield identical assignments.
 */
public class RegistryBuilder {

    private static final Logger log = LoggerFactory.getLogger(RegistryBuilder.class);

    /**
     * @param content    Validated content.
     * @param stats      Derived stats of the same content.
     * @param generation The generation stamped on every issued index.
     * @return The registry.
     */
    public GameRegistry build(MergedContent content, DerivedStatsTable stats, long generation) {
        final Map<CollectionType<?, ?>, CollectionIndex<?>> collections = new LinkedHashMap<>();
        for (MergedCollection<?> collection : content.all()) {
            collections.put(collection.type(), index(collection, stats));
        }
        log.debug("Built registry generation {}", generation);
        return new GameRegistry(generation, collections, content.victoryRules());
    }

    private <R extends ContentRecord> CollectionIndex<R> index(MergedCollection<R> collection, DerivedStatsTable stats) {
        final int size = collection.size();
        final List<String> keys = new ArrayList<>(size);
        final Map<String, Integer> positions = new HashMap<>();
        final List<R> records = new ArrayList<>(size);
        final List<DerivedStats> derived = new ArrayList<>(size);
        for (Map.Entry<String, R> entry : collection.records().entrySet()) {
            positions.put(entry.getKey(), keys.size());
            keys.add(entry.getKey());
            records.add(entry.getValue());
            derived.add(stats.get(collection.type(), entry.getKey()));
        }
        return new CollectionIndex<>(collection.type(), keys, positions, records, derived);
    }
}
