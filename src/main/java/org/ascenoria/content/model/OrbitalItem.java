package org.ascenoria.content.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A satellite or station built in a planet's orbital slots.
 *
 * @param id                 Unique identifier.
 * @param name               Display name.
 * @param description        Optional description.
 * @param industryBonus      Added industry, zero or more.
 * @param researchBonus      Added research, zero or more.
 * @param prosperityBonus    Added prosperity, zero or more.
 * @param maxPopulationBonus Added population cap, zero or more.
 * @param slotSize           Orbital slots occupied, strictly positive.
 * @param industryCost       Industry cost to build.
 * @param unlockedByTechId   Technology that unlocks the item, or {@code null} if available from the start.
 */
public record OrbitalItem(
        @JsonProperty(value = "id", required = true) String id,
        @JsonProperty(value = "name", required = true) LocalizedText name,
        @JsonProperty("description") LocalizedText description,
        @JsonProperty("industry_bonus") int industryBonus,
        @JsonProperty("research_bonus") int researchBonus,
        @JsonProperty("prosperity_bonus") int prosperityBonus,
        @JsonProperty("max_population_bonus") int maxPopulationBonus,
        @JsonProperty(value = "slot_size", required = true) int slotSize,
        @JsonProperty("industry_cost") int industryCost,
        @JsonProperty("unlocked_by_tech_id") String unlockedByTechId
) implements EntityDefinition {
}
