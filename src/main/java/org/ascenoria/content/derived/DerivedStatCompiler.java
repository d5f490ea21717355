package org.ascenoria.content.derived;

import org.ascenoria.content.merge.MergedCollection;
import org.ascenoria.content.merge.MergedContent;
import org.ascenoria.content.model.CollectionType;
import org.ascenoria.content.model.ContentCollections;
import org.ascenoria.content.model.ContentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stateless transformation from validated content to derived stats.
 * <p>
 * Every value is recomputed from scratch on each call. Collections without a registered
 * deriver get {@link NoDerivedStats} for each record.
 */
public class DerivedStatCompiler {

    private static final Logger log = LoggerFactory.getLogger(DerivedStatCompiler.class);

    private final Map<CollectionType<?, ?>, StatDeriver<?, ?>> derivers = new LinkedHashMap<>();

    public DerivedStatCompiler() {
        register(ContentCollections.WEAPONS, StatDeriver.perRecord(StatFormulas::weapon));
        register(ContentCollections.ENGINES, StatDeriver.perRecord(StatFormulas::engine));
        register(ContentCollections.SURFACE_BUILDINGS, StatDeriver.perRecord(StatFormulas::building));
        register(ContentCollections.ORBITAL_ITEMS, StatDeriver.perRecord(StatFormulas::orbitalItem));
        register(ContentCollections.HULL_CLASSES, StatDeriver.perRecord(StatFormulas::hull));
        register(ContentCollections.SCENARIOS, StatDeriver.perRecord(StatFormulas::scenario));
        register(ContentCollections.TECHNOLOGIES, new TechnologyStatDeriver());
    }

    private <R extends ContentRecord, D extends DerivedStats> void register(CollectionType<R, D> collection,
                                                                          StatDeriver<R, D> deriver) {
        derivers.put(collection, deriver);
    }

    /**
     * @param content Validated content.
     * @return Stats for every record of every collection.
     */
    public DerivedStatsTable compile(MergedContent content) {
        final Map<CollectionType<?, ?>, Map<String, ? extends DerivedStats>> stats = new LinkedHashMap<>();
        for (MergedCollection<?> collection : content.all()) {
            stats.put(collection.type(), compileCollection(collection, content));
        }
        log.debug("Compiled derived stats for {} collection(s)", stats.size());
        return new DerivedStatsTable(stats);
    }

    @SuppressWarnings("unchecked")
    private <R extends ContentRecord> Map<String, ? extends DerivedStats> compileCollection(
            MergedCollection<R> collection, MergedContent content) {
        final StatDeriver<R, ?> deriver = (StatDeriver<R, ?>) derivers.get(collection.type());
        if (deriver == null) {
            final Map<String, NoDerivedStats> empty = new LinkedHashMap<>();
            collection.records().keySet().forEach(key -> empty.put(key, NoDerivedStats.INSTANCE));
            return Map.copyOf(empty);
        }
        return Map.copyOf(deriver.derive(collection, content));
    }
}
