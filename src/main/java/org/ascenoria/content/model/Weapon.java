package org.ascenoria.content.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * A ship weapon module.
 *
 * @param id               Unique identifier.
 * @param name             Display name.
 * @param description      Optional description.
 * @param damage           Damage per shot, strictly positive.
 * @param fireRate         Shots per turn, strictly positive.
 * @param range            Weapon range, strictly positive.
 * @param powerUse         Power draw.
 * @param industryCost     Industry cost to build.
 * @param unlockedByTechId Technology that unlocks the weapon, or {@code null}.
 */
public record Weapon(
        @JsonProperty(value = "id", required = true) String id,
        @JsonProperty(value = "name", required = true) LocalizedText name,
        @JsonProperty("description") LocalizedText description,
        @JsonProperty(value = "damage", required = true) double damage,
        @JsonProperty(value = "fire_rate", required = true) double fireRate,
        @JsonProperty(value = "range", required = true) int range,
        @JsonProperty("power_use") int powerUse,
        @JsonProperty("industry_cost") int industryCost,
        @JsonProperty("unlocked_by_tech_id") String unlockedByTechId
) implements EntityDefinition {

    public Optional<String> unlockedByTech() {
        return Optional.ofNullable(unlockedByTechId);
    }
}
