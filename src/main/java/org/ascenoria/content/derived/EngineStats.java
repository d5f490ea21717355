package org.ascenoria.content.derived;

/**
 * @param efficiency Thrust per point of power draw, {@code null} when the engine draws no power.
 */
public record EngineStats(Double efficiency) implements DerivedStats {
}
