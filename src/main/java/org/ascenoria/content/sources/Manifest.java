package org.ascenoria.content.sources;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Contents of the base pack's {@code manifest.toml}.
 */
public record Manifest(@JsonProperty(value = "schema_version", required = true) int schemaVersion) {
}
