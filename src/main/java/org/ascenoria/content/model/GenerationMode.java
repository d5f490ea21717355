package org.ascenoria.content.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Planet surface generation algorithms available to scenarios.
 */
public enum GenerationMode {
    /** Random placement of white and black tiles driven by the scenario's black ratio. */
    @JsonProperty("random_white_black")
    RANDOM_WHITE_BLACK
}
