package com.questrail.hostlink.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the dispatch core that is not
 * tied to a single rejected submission.
 */
public record DispatchErrorEvent(
    Instant timestamp,
    DispatchErrorKind kind,
    String message,
    Throwable cause
) {
}
