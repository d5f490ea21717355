package org.ascenoria.content.derived;

import org.ascenoria.content.merge.MergedCollection;
import org.ascenoria.content.merge.MergedContent;
import org.ascenoria.content.model.ContentRecord;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Computes the derived stats of one collection from validated base fields.
 * <p>
 * Implementations must be pure: the same content always yields equal stats.
 *
 * @param <R> The record type.
 * @param <D> The stats type.
 */
@FunctionalInterface
public interface StatDeriver<R extends ContentRecord, D extends DerivedStats> {

    /**
     * @param collection The validated collection.
     * @param content    All validated content, for derivations that need other collections.
     * @return Stats per record key, in the collection's iteration order.
     */
    Map<String, D> derive(MergedCollection<R> collection, MergedContent content);

    /**
     * Adapts a function of a single record.
     */
    static <R extends ContentRecord, D extends DerivedStats> StatDeriver<R, D> perRecord(Function<R, D> function) {
        return (collection, content) -> {
            final Map<String, D> stats = new LinkedHashMap<>();
            collection.records().forEach((key, record) -> stats.put(key, function.apply(record)));
            return stats;
        };
    }
}
