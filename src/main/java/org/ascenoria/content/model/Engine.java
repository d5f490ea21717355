package org.ascenoria.content.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A ship engine module.
 *
 * @param id           Unique identifier.
 * @param name         Display name.
 * @param description  Optional description.
 * @param powerUse     Power draw.
 * @param thrustRating Thrust used for movement, strictly positive.
 * @param industryCost Industry cost to build.
 */
public record Engine(
        @JsonProperty(value = "id", required = true) String id,
        @JsonProperty(value = "name", required = true) LocalizedText name,
        @JsonProperty("description") LocalizedText description,
        @JsonProperty("power_use") int powerUse,
        @JsonProperty(value = "thrust_rating", required = true) double thrustRating,
        @JsonProperty("industry_cost") int industryCost
) implements EntityDefinition {
}
