package org.ascenoria.content.registry;

import org.ascenoria.content.derived.DerivedStats;
import org.ascenoria.content.model.CollectionType;
import org.ascenoria.content.model.ContentRecord;
import org.ascenoria.content.model.VictoryRules;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The validated, immutable content of one load, addressable by id or by dense index.
 * <p>
 * All accessors are read-only and safe for concurrent use.
 */
public final class GameRegistry {

    private final long generation;
    private final Map<CollectionType<?, ?>, CollectionIndex<?>> collections;
    private final VictoryRules victoryRules;

    GameRegistry(long generation, Map<CollectionType<?, ?>, CollectionIndex<?>> collections, VictoryRules victoryRules) {
        this.generation = generation;
        this.collections = Map.copyOf(collections);
        this.victoryRules = victoryRules;
    }

    /**
     * @return The generation of the load that built this registry.
     */
    public long generation() {
        return generation;
    }

    /**
     * Resolves an id to its dense index.
     *
     * @param collection The collection.
     * @param id         The id (or relation key).
     * @return The index, or empty if the id does not exist.
     */
    public <R extends ContentRecord, D extends DerivedStats> Optional<RegistryIndex<R>> resolve(
            CollectionType<R, D> collection, String id) {
        final Integer position = index(collection).positions().get(id);
        return position == null ? Optional.empty() : Optional.of(new RegistryIndex<>(collection, position, generation));
    }

    /**
     * @param collection The collection.
     * @param typedId    An id issued by this registry.
     * @return The index of the id.
     */
    public <R extends ContentRecord, D extends DerivedStats> RegistryIndex<R> resolve(
            CollectionType<R, D> collection, TypedId<R> typedId) {
        checkCollection(collection, typedId.collection());
        return resolve(collection, typedId.id())
                .orElseThrow(() -> new IllegalArgumentException(typedId + " is not present in this registry"));
    }

    /**
     * @param collection The collection.
     * @param index      An index issued by this registry for this collection.
     * @return The record.
     * @throws IllegalArgumentException if the index belongs to another collection or generation.
     */
    public <R extends ContentRecord, D extends DerivedStats> R get(CollectionType<R, D> collection, RegistryIndex<R> index) {
        return index(collection).records().get(checked(collection, index));
    }

    /**
     * @param collection The collection.
     * @param index      An index issued by this registry for this collection.
     * @return The derived stats of the record.
     * @throws IllegalArgumentException if the index belongs to another collection or generation.
     */
    public <R extends ContentRecord, D extends DerivedStats> D getDerived(CollectionType<R, D> collection,
                                                                         RegistryIndex<R> index) {
        return collection.statsType().cast(index(collection).stats().get(checked(collection, index)));
    }

    public <R extends ContentRecord, D extends DerivedStats> Optional<TypedId<R>> typedId(
            CollectionType<R, D> collection, String id) {
        return index(collection).positions().containsKey(id)
                ? Optional.of(new TypedId<>(collection, id))
                : Optional.empty();
    }

    public <R extends ContentRecord, D extends DerivedStats> TypedId<R> typedId(CollectionType<R, D> collection,
                                                                             RegistryIndex<R> index) {
        return new TypedId<>(collection, index(collection).keys().get(checked(collection, index)));
    }

    /**
     * Convenience lookup by id.
     */
    public <R extends ContentRecord, D extends DerivedStats> Optional<R> find(CollectionType<R, D> collection, String id) {
        final CollectionIndex<R> index = index(collection);
        final Integer position = index.positions().get(id);
        return position == null ? Optional.empty() : Optional.of(index.records().get(position));
    }

    /**
     * @return All records of the collection in index order.
     */
    public <R extends ContentRecord, D extends DerivedStats> List<R> records(CollectionType<R, D> collection) {
        return index(collection).records();
    }

    /**
     * @return All keys of the collection in index order.
     */
    public List<String> keys(CollectionType<?, ?> collection) {
        return index(collection).keys();
    }

    public int size(CollectionType<?, ?> collection) {
        return index(collection).records().size();
    }

    public VictoryRules victoryRules() {
        return victoryRules;
    }

    @SuppressWarnings("unchecked")
    private <R extends ContentRecord> CollectionIndex<R> index(CollectionType<R, ?> collection) {
        final CollectionIndex<?> index = collections.get(collection);
        if (index == null) {
            throw new IllegalArgumentException("Unknown collection: " + collection);
        }
        return (CollectionIndex<R>) index;
    }

    private int checked(CollectionType<?, ?> collection, RegistryIndex<?> index) {
        checkCollection(collection, index.collection());
        if (index.generation() != generation) {
            throw new IllegalArgumentException(String.format(
                    "%s was issued by generation %d, this registry is generation %d", index, index.generation(), generation));
        }
        return index.value();
    }

    private static void checkCollection(CollectionType<?, ?> expected, CollectionType<?, ?> actual) {
        if (expected != actual) {
            throw new IllegalArgumentException("Expected an id of " + expected + " but got one of " + actual);
        }
    }
}
