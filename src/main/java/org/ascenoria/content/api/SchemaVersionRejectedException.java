package org.ascenoria.content.api;

import org.ascenoria.content.diagnostics.DiagnosticCode;

import java.nio.file.Path;

/**
 * A pack declares a schema version newer than the one the runtime understands.
 */
public class SchemaVersionRejectedException extends ContentSourceException {

    private final int declared;
    private final int supported;

    public SchemaVersionRejectedException(Path path, int declared, int supported) {
        super(DiagnosticCode.SCHEMA_VERSION_REJECTED, path,
                String.format("schema_version %d is newer than supported version %d", declared, supported));
        this.declared = declared;
        this.supported = supported;
    }

    public int declared() {
        return declared;
    }

    public int supported() {
        return supported;
    }
}
