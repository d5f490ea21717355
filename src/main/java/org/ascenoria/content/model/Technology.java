package org.ascenoria.content.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A technology of the research tree.
 * <p>
 * Prerequisites are not stored on the technology itself; they are separate
 * {@link TechnologyPrerequisite} relation records so that mods can add edges
 * without redefining either endpoint.
 *
 * @param id          Unique identifier.
 * @param name        Display name.
 * @param description Optional description.
 * @param scienceCost Science points required to research, strictly positive.
 */
public record Technology(
        @JsonProperty(value = "id", required = true) String id,
        @JsonProperty(value = "name", required = true) LocalizedText name,
        @JsonProperty("description") LocalizedText description,
        @JsonProperty(value = "science_cost", required = true) int scienceCost
) implements EntityDefinition {
}
