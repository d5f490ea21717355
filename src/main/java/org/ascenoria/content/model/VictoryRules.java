package org.ascenoria.content.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tunable parameters for the victory checks. A singleton: the last source defining it wins.
 *
 * @param dominationThreshold Fraction of systems required to claim domination, in (0, 1].
 * @param turnLimit           Optional turn limit, strictly positive when present.
 */
public record VictoryRules(
        @JsonProperty(value = "domination_threshold", required = true) double dominationThreshold,
        @JsonProperty("turn_limit") Integer turnLimit
) {

    /** Rules used when no source defines any. */
    public static final VictoryRules DEFAULTS = new VictoryRules(0.5, null);
}
