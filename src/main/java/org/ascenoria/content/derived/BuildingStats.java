package org.ascenoria.content.derived;

/**
 * @param netYield     Sum of all per-turn yields.
 * @param yieldPerCost Net yield per production point spent.
 */
public record BuildingStats(long netYield, double yieldPerCost) implements DerivedStats {
}
