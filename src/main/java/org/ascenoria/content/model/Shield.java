package org.ascenoria.content.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A ship shield module.
 *
 * @param id           Unique identifier.
 * @param name         Display name.
 * @param description  Optional description.
 * @param strength     Shield strength, strictly positive.
 * @param industryCost Industry cost to build.
 */
public record Shield(
        @JsonProperty(value = "id", required = true) String id,
        @JsonProperty(value = "name", required = true) LocalizedText name,
        @JsonProperty("description") LocalizedText description,
        @JsonProperty(value = "strength", required = true) double strength,
        @JsonProperty("industry_cost") int industryCost
) implements EntityDefinition {
}
