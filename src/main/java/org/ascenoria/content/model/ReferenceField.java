package org.ascenoria.content.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * A field whose value names an id in another collection.
 * <p>
 * An accessor returning {@code null} means the reference is optional and not set.
 *
 * @param <R> The record type holding the reference.
 */
public final class ReferenceField<R> {

    private final String field;
    private final CollectionType<?, ?> target;
    private final Function<R, String> accessor;

    public ReferenceField(final String field, final CollectionType<?, ?> target, final Function<R, String> accessor) {
        this.field = Objects.requireNonNull(field, "field");
        this.target = Objects.requireNonNull(target, "target");
        this.accessor = Objects.requireNonNull(accessor, "accessor");
    }

    public String field() {
        return field;
    }

    public CollectionType<?, ?> target() {
        return target;
    }

    public String valueOf(final R record) {
        return accessor.apply(record);
    }
}
