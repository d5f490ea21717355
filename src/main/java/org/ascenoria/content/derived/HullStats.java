package org.ascenoria.content.derived;

/**
 * @param itemsPerSize Module capacity per size index.
 */
public record HullStats(double itemsPerSize) implements DerivedStats {
}
