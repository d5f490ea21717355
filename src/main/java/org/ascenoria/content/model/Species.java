package org.ascenoria.content.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A playable species.
 *
 * @param id          Unique identifier.
 * @param name        Display name.
 * @param description Optional description.
 */
public record Species(
        @JsonProperty(value = "id", required = true) String id,
        @JsonProperty(value = "name", required = true) LocalizedText name,
        @JsonProperty("description") LocalizedText description
) implements EntityDefinition {
}
