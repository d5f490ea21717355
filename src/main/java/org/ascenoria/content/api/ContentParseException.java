package org.ascenoria.content.api;

import org.ascenoria.content.diagnostics.DiagnosticCode;

import java.nio.file.Path;

/**
 * The file is not syntactically valid TOML or JSON.
 */
public class ContentParseException extends ContentSourceException {

    public ContentParseException(Path path, String message, Throwable cause) {
        super(DiagnosticCode.PARSE_ERROR, path, message, cause);
    }
}
