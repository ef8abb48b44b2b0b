package com.questrail.replay.observability;

import java.time.Instant;

/**
 * Record representing a rejected decode.
 */
public record ReplayErrorEvent(
        Instant timestamp,
        String message,
        Throwable cause
) {
}
