package org.ascenoria.content.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The kind of check a victory condition performs.
 */
public enum VictoryType {
    @JsonProperty("cover_all_tiles")
    COVER_ALL_TILES,
    @JsonProperty("domination")
    DOMINATION,
    @JsonProperty("research")
    RESEARCH
}
