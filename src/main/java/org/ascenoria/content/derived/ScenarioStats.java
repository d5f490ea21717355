package org.ascenoria.content.derived;

/**
 * @param cellCount           Number of surface tiles.
 * @param expectedBlackCells  Rounded expected number of unusable tiles.
 * @param expectedUsableCells Tiles left for building.
 */
public record ScenarioStats(long cellCount, long expectedBlackCells, long expectedUsableCells) implements DerivedStats {
}
