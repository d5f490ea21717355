package org.ascenoria.content.derived;

/**
 * @param totalBonus Sum of the industry, research, prosperity and population bonuses.
 */
public record OrbitalItemStats(long totalBonus) implements DerivedStats {
}
