package org.ascenoria.content.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A planet surface archetype, e.g. a desert or ocean world.
 *
 * @param id               Unique identifier.
 * @param name             Display name.
 * @param description      Optional description.
 * @param tileDistribution Share of each tile color when the surface is generated.
 */
public record PlanetSurfaceType(
        @JsonProperty(value = "id", required = true) String id,
        @JsonProperty(value = "name", required = true) LocalizedText name,
        @JsonProperty("description") LocalizedText description,
        @JsonProperty(value = "tile_distribution", required = true) TileDistribution tileDistribution
) implements EntityDefinition {
}
