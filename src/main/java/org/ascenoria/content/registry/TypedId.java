package org.ascenoria.content.registry;

import org.ascenoria.content.model.CollectionType;
import org.ascenoria.content.model.ContentRecord;

import java.util.Objects;

/**
 * An id tagged with its owning collection. Created only by the registry, so holding one
 * proves the id was valid in the registry that issued it.
 *
 * @param <R> The record type of the owning collection.
 */
public final class TypedId<R extends ContentRecord> {

    private final CollectionType<R, ?> collection;
    private final String id;

    TypedId(CollectionType<R, ?> collection, String id) {
        this.collection = collection;
        this.id = id;
    }

    public CollectionType<R, ?> collection() {
        return collection;
    }

    public String id() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TypedId<?> other)) {
            return false;
        }
        return collection == other.collection && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(collection.name(), id);
    }

    @Override
    public String toString() {
        return collection + ":" + id;
    }
}
