package org.ascenoria.content.model;

import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * A numeric bound declared on one field of a collection's records.
 *
 * @param <R> The record type.
 */
public final class FieldConstraint<R> {

    /**
     * The permitted range of a constrained field. Non-finite values never satisfy a bound.
     */
    public enum Bound {
        POSITIVE("must be greater than zero") {
            @Override
            boolean test(final double value) {
                return value > 0;
            }
        },
        NON_NEGATIVE("must not be negative") {
            @Override
            boolean test(final double value) {
                return value >= 0;
            }
        },
        UNIT_INTERVAL("must be between 0.0 and 1.0") {
            @Override
            boolean test(final double value) {
                return value >= 0 && value <= 1;
            }
        };

        private final String description;

        Bound(final String description) {
            this.description = description;
        }

        abstract boolean test(double value);

        public boolean accepts(final double value) {
            return Double.isFinite(value) && test(value);
        }

        public String description() {
            return description;
        }
    }

    private final String field;
    private final ToDoubleFunction<R> accessor;
    private final Bound bound;

    public FieldConstraint(final String field, final ToDoubleFunction<R> accessor, final Bound bound) {
        this.field = Objects.requireNonNull(field, "field");
        this.accessor = Objects.requireNonNull(accessor, "accessor");
        this.bound = Objects.requireNonNull(bound, "bound");
    }

    public String field() {
        return field;
    }

    public Bound bound() {
        return bound;
    }

    public double valueOf(final R record) {
        return accessor.applyAsDouble(record);
    }

    public boolean isSatisfiedBy(final R record) {
        return bound.accepts(valueOf(record));
    }

    @Override
    public String toString() {
        return field + " " + bound.description();
    }
}
