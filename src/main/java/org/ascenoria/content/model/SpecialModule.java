package org.ascenoria.content.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A ship module with a special effect, such as a cloak or tractor beam.
 */
public record SpecialModule(
        @JsonProperty(value = "id", required = true) String id,
        @JsonProperty(value = "name", required = true) LocalizedText name,
        @JsonProperty("description") LocalizedText description,
        @JsonProperty("power_use") int powerUse,
        @JsonProperty("range") int range,
        @JsonProperty("industry_cost") int industryCost
) implements EntityDefinition {
}
