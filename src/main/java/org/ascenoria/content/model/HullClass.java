package org.ascenoria.content.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A ship hull template used by the ship designer.
 *
 * @param id          Unique identifier.
 * @param name        Display name.
 * @param description Optional description.
 * @param sizeIndex   Balancing size index, strictly positive.
 * @param maxItems    Module capacity, strictly positive.
 */
public record HullClass(
        @JsonProperty(value = "id", required = true) String id,
        @JsonProperty(value = "name", required = true) LocalizedText name,
        @JsonProperty("description") LocalizedText description,
        @JsonProperty(value = "size_index", required = true) int sizeIndex,
        @JsonProperty(value = "max_items", required = true) int maxItems
) implements EntityDefinition {
}
