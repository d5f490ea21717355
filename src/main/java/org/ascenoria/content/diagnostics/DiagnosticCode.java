package org.ascenoria.content.diagnostics;

/**
 * Defines unique, testable codes for every problem the content pipeline can report.
 * This decouples tests and tooling from the wording of diagnostic messages.
 */
public enum DiagnosticCode {
    // region File and source level
    /** A data file or descriptor is not syntactically valid. */
    PARSE_ERROR,
    /** A data file is well-formed but has missing, unknown or ill-typed fields. */
    SCHEMA_ERROR,
    /** A data file could not be read. */
    IO_ERROR,
    /** A pack declares a schema version newer than the runtime understands. */
    SCHEMA_VERSION_REJECTED,
    /** The same file exists in more than one encoding; the preferred one was used. */
    AMBIGUOUS_FILE,
    // endregion

    // region Validation, fatal
    /** An id (or relation key) occurs more than once in a collection. */
    DUPLICATE_ID,
    /** A numeric constraint or structural invariant does not hold. */
    INVARIANT_VIOLATION,
    /** A reference names an id that does not exist in its target collection. */
    UNRESOLVED_REFERENCE,
    // endregion

    // region Validation, advisory
    /** A configured locale is missing from a localized text. */
    MISSING_LOCALIZATION,
    /** An id does not follow the lowercase, underscore-separated convention. */
    NAMING_CONVENTION
    // endregion
}
