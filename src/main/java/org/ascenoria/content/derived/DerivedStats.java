package org.ascenoria.content.derived;

/**
 * Marker for read-only values computed from validated base fields.
 * <p>
 * Implementations are immutable and are always recomputed in full for each load.
 */
public interface DerivedStats {
}
