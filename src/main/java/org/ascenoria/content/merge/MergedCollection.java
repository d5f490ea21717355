package org.ascenoria.content.merge;

import org.ascenoria.content.model.CollectionType;
import org.ascenoria.content.model.ContentRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The merged view of one collection.
 * <p>
 * Iteration order is the order in which keys were first seen across all sources; the stored
 * record for each key is the last one written.
 *
 * @param <R> The record type.
 */
public final class MergedCollection<R extends ContentRecord> {

    private final CollectionType<R, ?> type;
    private final Map<String, R> records;
    private final Map<String, String> lastWriters;
    private final Map<String, Integer> overrideCounts;
    private final List<DuplicateKey> duplicates;

    MergedCollection(CollectionType<R, ?> type, LinkedHashMap<String, R> records, Map<String, String> lastWriters,
                     Map<String, Integer> overrideCounts, List<DuplicateKey> duplicates) {
        this.type = type;
        this.records = Collections.unmodifiableMap(records);
        this.lastWriters = Map.copyOf(lastWriters);
        this.overrideCounts = Map.copyOf(overrideCounts);
        this.duplicates = List.copyOf(duplicates);
    }

    public CollectionType<R, ?> type() {
        return type;
    }

    /**
     * @return Key to record, in stable first-seen order.
     */
    public Map<String, R> records() {
        return records;
    }

    public int size() {
        return records.size();
    }

    /**
     * @param key A record key.
     * @return The source that last wrote the key, or {@code null} if unknown.
     */
    public String lastWriter(String key) {
        return lastWriters.get(key);
    }

    public Map<String, String> lastWriters() {
        return lastWriters;
    }

    /**
     * @param key A record key.
     * @return How many times a later write replaced an earlier one.
     */
    public int overrideCount(String key) {
        return overrideCounts.getOrDefault(key, 0);
    }

    /**
     * @return Keys defined more than once inside the same source.
     */
    public List<DuplicateKey> duplicates() {
        return duplicates;
    }
}
