package org.ascenoria.content.sources;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Contents of an optional {@code mod.toml}. Absent values fall back to priority 0 and the
 * runtime's schema version.
 */
public record ModDescriptor(
        @JsonProperty("priority") Integer priority,
        @JsonProperty("schema_version") Integer schemaVersion
) {
}
