package org.ascenoria.content.derived;

import org.ascenoria.content.model.CollectionType;

import java.util.Map;

/**
 * Derived stats of every collection, keyed by record key.
 */
public final class DerivedStatsTable {

    private final Map<CollectionType<?, ?>, Map<String, ? extends DerivedStats>> stats;

    DerivedStatsTable(Map<CollectionType<?, ?>, Map<String, ? extends DerivedStats>> stats) {
        this.stats = Map.copyOf(stats);
    }

    /**
     * @param collection The collection.
     * @param key        The record key.
     * @return The stats.
     * @throws IllegalArgumentException if the key has no stats in that collection.
     */
    public <D extends DerivedStats> D get(CollectionType<?, D> collection, String key) {
        final Map<String, ? extends DerivedStats> perKey = stats.getOrDefault(collection, Map.of());
        final DerivedStats value = perKey.get(key);
        if (value == null) {
            throw new IllegalArgumentException("No derived stats for " + collection + " '" + key + "'");
        }
        return collection.statsType().cast(value);
    }

    /**
     * @param collection The collection.
     * @return Read-only stats of every record in the collection, empty if it was not compiled.
     */
    public Map<String, ? extends DerivedStats> stats(CollectionType<?, ?> collection) {
        return stats.getOrDefault(collection, Map.of());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DerivedStatsTable other && stats.equals(other.stats);
    }

    @Override
    public int hashCode() {
        return stats.hashCode();
    }
}
