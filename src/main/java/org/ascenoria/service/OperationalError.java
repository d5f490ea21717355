package org.ascenoria.service;

import java.time.Instant;

/**
 * A transient error that a long-running component recovered from.
 *
 * @param timestamp When the error occurred.
 * @param errorType Category, e.g. {@code RELOAD_FAILED}.
 * @param message   Human-readable description.
 * @param details   Optional context, such as the diagnostics of a failed load.
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
