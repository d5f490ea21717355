package org.ascenoria.content.registry;

import org.ascenoria.content.derived.DerivedStats;
import org.ascenoria.content.model.CollectionType;
import org.ascenoria.content.model.ContentRecord;

import java.util.List;
import java.util.Map;

/**
 * Two-way key/index mapping of one collection plus its records and stats in index order.
 */
record CollectionIndex<R extends ContentRecord>(
        CollectionType<R, ?> type,
        List<String> keys,
        Map<String, Integer> positions,
        List<R> records,
        List<DerivedStats> stats
) {

    CollectionIndex {
        keys = List.copyOf(keys);
        positions = Map.copyOf(positions);
        records = List.copyOf(records);
        stats = List.copyOf(stats);
    }
}
