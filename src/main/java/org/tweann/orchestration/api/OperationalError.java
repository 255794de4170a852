package org.tweann.orchestration.api;

import java.time.Instant;

/**
 * A transient error that did not stop the service.
 *
 * @param timestamp When the error occurred.
 * @param code      Category, e.g. {@code STEP_FAILED}.
 * @param message   Human-readable summary.
 * @param details   Additional context.
 */
public record OperationalError(Instant timestamp, String code, String message, String details) {
}
