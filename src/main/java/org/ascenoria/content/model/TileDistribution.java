package org.ascenoria.content.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Percentage of each tile color on a planet surface. The five shares add up to 100.
 */
public record TileDistribution(
        @JsonProperty(value = "black", required = true) int black,
        @JsonProperty(value = "white", required = true) int white,
        @JsonProperty(value = "red", required = true) int red,
        @JsonProperty(value = "green", required = true) int green,
        @JsonProperty(value = "blue", required = true) int blue
) {

    /** The sum every distribution must reach. */
    public static final int TOTAL_PERCENT = 100;

    public long total() {
        return (long) black + white + red + green + blue;
    }
}
