package org.ascenoria.content.model;

import org.ascenoria.content.derived.DerivedStats;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/**
 * Describes one content collection: its name, file, record class and the rules its records obey.
 * <p>
 * Instances are singletons declared in {@link ContentCollections}; identity comparison is intended.
 * The type parameters tie registry lookups to the right record and stats types at compile time.
 *
 * @param <R> The record type.
 * @param <D> The derived stats type.
 */
public final class CollectionType<R extends ContentRecord, D extends DerivedStats> {

    private final String name;
    private final String fileName;
    private final Class<R> recordType;
    private final Class<D> statsType;
    private final List<FieldConstraint<R>> constraints;
    private final List<ReferenceField<R>> references;
    private final List<RecordCheck<R>> checks;

    private CollectionType(final Builder<R, D> builder) {
        this.name = builder.name;
        this.fileName = builder.fileName;
        this.recordType = builder.recordType;
        this.statsType = builder.statsType;
        this.constraints = List.copyOf(builder.constraints);
        this.references = List.copyOf(builder.references);
        this.checks = List.copyOf(builder.checks);
    }

    public static <R extends ContentRecord, D extends DerivedStats> Builder<R, D> builder(
            final String name, final Class<R> recordType, final Class<D> statsType) {
        return new Builder<>(name, recordType, statsType);
    }

    /**
     * @return The collection name, which is also the list key inside its data file.
     */
    public String name() {
        return name;
    }

    /**
     * @return The data file base name, without extension.
     */
    public String fileName() {
        return fileName;
    }

    public Class<R> recordType() {
        return recordType;
    }

    public Class<D> statsType() {
        return statsType;
    }

    public List<FieldConstraint<R>> constraints() {
        return constraints;
    }

    public List<ReferenceField<R>> references() {
        return references;
    }

    public List<RecordCheck<R>> checks() {
        return checks;
    }

    /**
     * @return {@code true} if records are id-keyed entities rather than relation records.
     */
    public boolean isEntityCollection() {
        return EntityDefinition.class.isAssignableFrom(recordType);
    }

    /**
     * Casts a record of unknown static type to this collection's record type.
     *
     * @param record The record.
     * @return The same record, typed.
     * @throws ClassCastException if the record does not belong to this collection.
     */
    public R cast(final ContentRecord record) {
        return recordType.cast(record);
    }

    @Override
    public String toString() {
        return name;
    }

    public static final class Builder<R extends ContentRecord, D extends DerivedStats> {
        private final String name;
        private final Class<R> recordType;
        private final Class<D> statsType;
        private String fileName;
        private final List<FieldConstraint<R>> constraints = new ArrayList<>();
        private final List<ReferenceField<R>> references = new ArrayList<>();
        private final List<RecordCheck<R>> checks = new ArrayList<>();

        private Builder(final String name, final Class<R> recordType, final Class<D> statsType) {
            this.name = Objects.requireNonNull(name, "name");
            this.recordType = Objects.requireNonNull(recordType, "recordType");
            this.statsType = Objects.requireNonNull(statsType, "statsType");
            this.fileName = name;
        }

        public Builder<R, D> file(final String fileName) {
            this.fileName = Objects.requireNonNull(fileName, "fileName");
            return this;
        }

        public Builder<R, D> positive(final String field, final ToDoubleFunction<R> accessor) {
            constraints.add(new FieldConstraint<>(field, accessor, FieldConstraint.Bound.POSITIVE));
            return this;
        }

        public Builder<R, D> nonNegative(final String field, final ToDoubleFunction<R> accessor) {
            constraints.add(new FieldConstraint<>(field, accessor, FieldConstraint.Bound.NON_NEGATIVE));
            return this;
        }

        public Builder<R, D> unitInterval(final String field, final ToDoubleFunction<R> accessor) {
            constraints.add(new FieldConstraint<>(field, accessor, FieldConstraint.Bound.UNIT_INTERVAL));
            return this;
        }

        public Builder<R, D> references(final String field, final CollectionType<?, ?> target,
                                        final Function<R, String> accessor) {
            references.add(new ReferenceField<>(field, target, accessor));
            return this;
        }

        public Builder<R, D> check(final RecordCheck<R> check) {
            checks.add(Objects.requireNonNull(check, "check"));
            return this;
        }

        public CollectionType<R, D> build() {
            return new CollectionType<>(this);
        }
    }
}
