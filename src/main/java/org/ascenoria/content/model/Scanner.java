package org.ascenoria.content.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A ship scanner module.
 *
 * @param id           Unique identifier.
 * @param name         Display name.
 * @param description  Optional description.
 * @param range        Detection range, strictly positive.
 * @param strength     Detection strength, strictly positive.
 * @param industryCost Industry cost to build.
 */
public record Scanner(
        @JsonProperty(value = "id", required = true) String id,
        @JsonProperty(value = "name", required = true) LocalizedText name,
        @JsonProperty("description") LocalizedText description,
        @JsonProperty(value = "range", required = true) int range,
        @JsonProperty(value = "strength", required = true) double strength,
        @JsonProperty("industry_cost") int industryCost
) implements EntityDefinition {
}
