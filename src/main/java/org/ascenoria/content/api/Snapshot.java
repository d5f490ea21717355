package org.ascenoria.content.api;

import org.ascenoria.content.diagnostics.Diagnostic;
import org.ascenoria.content.model.CollectionType;
import org.ascenoria.content.registry.GameRegistry;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One complete, validated load: the registry with its derived stats, the advisory diagnostics
 * of the load and the merge trail. Immutable once built.
 *
 * @param generation             Monotonic load counter; also stamped on every registry index.
 * @param registry               The typed registry.
 * @param diagnostics            Advisory diagnostics of the load.
 * @param effectiveSchemaVersion Lowest schema version among the merged packs.
 * @param sources                Names of the merged packs in load order.
 * @param trail                  Per collection, the pack that last wrote each key.
 * @param loadedAt               When the load finished.
 */
public record Snapshot(
        long generation,
        GameRegistry registry,
        List<Diagnostic> diagnostics,
        int effectiveSchemaVersion,
        List<String> sources,
        Map<CollectionType<?, ?>, Map<String, String>> trail,
        Instant loadedAt
) {

    public Snapshot {
        diagnostics = List.copyOf(diagnostics);
        sources = List.copyOf(sources);
        trail = Map.copyOf(trail);
    }

    /**
     * @param collection The collection.
     * @param key        A record key.
     * @return The pack that last wrote the record, if the record exists.
     */
    public Optional<String> sourceOf(CollectionType<?, ?> collection, String key) {
        return Optional.ofNullable(trail.getOrDefault(collection, Map.of()).get(key));
    }
}
