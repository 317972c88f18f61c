package com.questrail.concord.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the coordination engine.
 */
public record CoordinationErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
