package org.ascenoria.content.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A one-off project a colony can spend industry on.
 */
public record PlanetaryProject(
        @JsonProperty(value = "id", required = true) String id,
        @JsonProperty(value = "name", required = true) LocalizedText name,
        @JsonProperty("description") LocalizedText description,
        @JsonProperty("industry_cost") int industryCost
) implements EntityDefinition {
}
