package org.ascenoria.content.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * A building that can be placed on the planet surface.
 *
 * @param id                 Unique identifier, e.g. {@code building_farm_1}.
 * @param name               Display name.
 * @param description        Optional description.
 * @param buildableOn        Tile colour the building can be placed on.
 * @param countsForAdjacency Whether the building extends the power grid to adjacent tiles.
 * @param productionCost     Production points to construct, strictly positive.
 * @param yieldsFood         Food per turn, negative for upkeep.
 * @param yieldsHousing      Housing per turn.
 * @param yieldsProduction   Production per turn.
 * @param yieldsScience      Science per turn.
 * @param unlockedByTechId   Technology that unlocks the building, or {@code null}.
 * @param specialBehavior    Behaviour on placement, {@link SpecialBehavior#NONE} when omitted.
 */
public record SurfaceBuilding(
        @JsonProperty(value = "id", required = true) String id,
        @JsonProperty(value = "name", required = true) LocalizedText name,
        @JsonProperty("description") LocalizedText description,
        @JsonProperty(value = "buildable_on", required = true) BuildableOn buildableOn,
        @JsonProperty("counts_for_adjacency") boolean countsForAdjacency,
        @JsonProperty(value = "production_cost", required = true) int productionCost,
        @JsonProperty("yields_food") int yieldsFood,
        @JsonProperty("yields_housing") int yieldsHousing,
        @JsonProperty("yields_production") int yieldsProduction,
        @JsonProperty("yields_science") int yieldsScience,
        @JsonProperty("unlocked_by_tech_id") String unlockedByTechId,
        @JsonProperty("special_behavior") SpecialBehavior specialBehavior
) implements EntityDefinition {

    public SurfaceBuilding {
        if (specialBehavior == null) {
            specialBehavior = SpecialBehavior.NONE;
        }
    }

    public Optional<String> unlockedByTech() {
        return Optional.ofNullable(unlockedByTechId);
    }
}
