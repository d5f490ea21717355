package org.ascenoria.content.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A win condition archetype referenced by scenarios.
 *
 * @param id            Unique identifier.
 * @param name          Display name.
 * @param description   Optional description.
 * @param conditionType The check performed by the gameplay rules.
 */
public record VictoryCondition(
        @JsonProperty(value = "id", required = true) String id,
        @JsonProperty(value = "name", required = true) LocalizedText name,
        @JsonProperty("description") LocalizedText description,
        @JsonProperty(value = "type", required = true) VictoryType conditionType
) implements EntityDefinition {
}
