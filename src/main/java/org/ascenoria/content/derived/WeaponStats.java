package org.ascenoria.content.derived;

/**
 * @param throughput         Damage per turn: damage multiplied by fire rate.
 * @param throughputPerPower Throughput per point of power draw, {@code null} when the weapon draws no power.
 */
public record WeaponStats(double throughput, Double throughputPerPower) implements DerivedStats {
}
