package org.ascenoria.content.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The tile colour a building may be placed on.
 */
public enum BuildableOn {
    /** Usable tiles. */
    @JsonProperty("white")
    WHITE,
    /** Unusable tiles, e.g. for a terraformer. */
    @JsonProperty("black")
    BLACK
}
