package org.ascenoria.content.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A planet size archetype describing the available building slots.
 *
 * @param id           Unique identifier.
 * @param name         Display name.
 * @param description  Optional description.
 * @param surfaceSlots Surface building slots, strictly positive.
 * @param orbitalSlots Orbital building slots, zero or more.
 */
public record PlanetSize(
        @JsonProperty(value = "id", required = true) String id,
        @JsonProperty(value = "name", required = true) LocalizedText name,
        @JsonProperty("description") LocalizedText description,
        @JsonProperty(value = "surface_slots", required = true) int surfaceSlots,
        @JsonProperty("orbital_slots") int orbitalSlots
) implements EntityDefinition {
}
