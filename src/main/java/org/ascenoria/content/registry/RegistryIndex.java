package org.ascenoria.content.registry;

import org.ascenoria.content.model.CollectionType;
import org.ascenoria.content.model.ContentRecord;

import java.util.Objects;

/**
 * A dense, zero-based position in one collection of one registry generation.
 * <p>
 * Only the registry issues indexes. The type parameter prevents presenting an index to
 * another collection's accessor at compile time; the registry re-checks collection and
 * generation at run time.
 *
 * @param <R> The record type of the owning collection.
 */
public final class RegistryIndex<R extends ContentRecord> {

    private final CollectionType<R, ?> collection;
    private final int value;
    private final long generation;

    RegistryIndex(CollectionType<R, ?> collection, int value, long generation) {
        this.collection = collection;
        this.value = value;
        this.generation = generation;
    }

    public CollectionType<R, ?> collection() {
        return collection;
    }

    public int value() {
        return value;
    }

    public long generation() {
        return generation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RegistryIndex<?> other)) {
            return false;
        }
        return value == other.value && generation == other.generation && collection == other.collection;
    }

    @Override
    public int hashCode() {
        return Objects.hash(collection.name(), value, generation);
    }

    @Override
    public String toString() {
        return collection + "#" + value + "@" + generation;
    }
}
