package org.ascenoria.content.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A game scenario: starting conditions, map generation parameters and the win criterion.
 *
 * @param id                 Unique identifier.
 * @param name               Display name.
 * @param description        Optional description.
 * @param gridWidth          Planet grid width in tiles, strictly positive.
 * @param gridHeight         Planet grid height in tiles, strictly positive.
 * @param startBuildingId    Building placed at game start.
 * @param generationMode     Surface generation algorithm.
 * @param blackRatio         Fraction of unbuildable tiles, between 0.0 and 1.0.
 * @param victoryConditionId Victory condition used by the scenario.
 */
public record Scenario(
        @JsonProperty(value = "id", required = true) String id,
        @JsonProperty(value = "name", required = true) LocalizedText name,
        @JsonProperty("description") LocalizedText description,
        @JsonProperty(value = "grid_width", required = true) int gridWidth,
        @JsonProperty(value = "grid_height", required = true) int gridHeight,
        @JsonProperty(value = "start_building_id", required = true) String startBuildingId,
        @JsonProperty(value = "generation_mode", required = true) GenerationMode generationMode,
        @JsonProperty(value = "black_ratio", required = true) double blackRatio,
        @JsonProperty(value = "victory_condition_id", required = true) String victoryConditionId
) implements EntityDefinition {
}
