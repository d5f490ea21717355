package org.ascenoria.content.model;

import java.util.Optional;

/**
 * A structural check over a whole record, for rules that a single field bound cannot express.
 *
 * @param <R> The record type.
 */
@FunctionalInterface
public interface RecordCheck<R> {

    /**
     * @param record The record.
     * @return A description of the violation, or empty if the record passes.
     */
    Optional<String> violation(R record);
}
