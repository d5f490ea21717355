package org.ascenoria.content.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Special behaviour triggered when a building is placed.
 */
public enum SpecialBehavior {
    /** Only provides yields. */
    @JsonProperty("none")
    NONE,
    /** Converts adjacent black tiles to white. */
    @JsonProperty("terraformer")
    TERRAFORMER
}
