package org.ascenoria.content.decode;

import org.ascenoria.content.model.CollectionType;
import org.ascenoria.content.model.ContentRecord;
import org.ascenoria.content.model.VictoryRules;
import org.ascenoria.content.sources.PackSource;

import java.util.List;
import java.util.Map;

/**
 * All records decoded from one pack, per collection, in file order.
 *
 * @param source       The pack.
 * @param records      Records per collection; collections without a file are absent.
 * @param victoryRules The pack's victory rules, or {@code null} if it defines none.
 */
public record DecodedSource(
        PackSource source,
        Map<CollectionType<?, ?>, List<? extends ContentRecord>> records,
        VictoryRules victoryRules
) {

    public DecodedSource {
        records = Map.copyOf(records);
    }

    @SuppressWarnings("unchecked")
    public <R extends ContentRecord> List<R> records(CollectionType<R, ?> collection) {
        return (List<R>) records.getOrDefault(collection, List.of());
    }

    public int recordCount() {
        return records.values().stream().mapToInt(List::size).sum();
    }
}
