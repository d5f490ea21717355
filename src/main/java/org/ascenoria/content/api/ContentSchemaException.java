package org.ascenoria.content.api;

import org.ascenoria.content.diagnostics.DiagnosticCode;

import java.nio.file.Path;

/**
 * The file is well-formed, but its structure does not match the collection's record shape.
 */
public class ContentSchemaException extends ContentSourceException {

    public ContentSchemaException(Path path, String message) {
        super(DiagnosticCode.SCHEMA_ERROR, path, message, null);
    }

    public ContentSchemaException(Path path, String message, Throwable cause) {
        super(DiagnosticCode.SCHEMA_ERROR, path, message, cause);
    }
}
