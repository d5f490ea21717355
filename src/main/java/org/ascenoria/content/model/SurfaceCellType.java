package org.ascenoria.content.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A terrain type of the planet surface grid.
 *
 * @param id          Unique identifier, e.g. {@code plains}.
 * @param name        Display name.
 * @param description Optional description.
 * @param usable      Whether buildings can be placed on cells of this type.
 */
public record SurfaceCellType(
        @JsonProperty(value = "id", required = true) String id,
        @JsonProperty(value = "name", required = true) LocalizedText name,
        @JsonProperty("description") LocalizedText description,
        @JsonProperty(value = "is_usable", required = true) boolean usable
) implements EntityDefinition {
}
