package com.questrail.replay.codec;

import java.util.List;
import java.util.Objects;

/**
 * Output of a {@link PayloadExpander}.
 *
 * @param body           bytes to decode the header and command stream from
 * @param status         how {@code body} was obtained
 * @param headerOffset   offset of the detected stream header in the prolog, {@code -1} if none
 * @param attempt        name of the successful attempt, empty unless {@link Status#EXPANDED}
 * @param failedAttempts attempts that were tried and rejected, in order
 */
public record ExpandedPayload(
        byte[] body,
        Status status,
        int headerOffset,
        String attempt,
        List<String> failedAttempts
) {
    public enum Status
    {
        /** No stream header found; the prolog is the body. */
        NOT_COMPRESSED,
        /** A compressed stream was inflated and validated. */
        EXPANDED,
        /** A stream header was found but no attempt validated; the prolog is the body. */
        FALLBACK_RAW
    }

    public ExpandedPayload {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(attempt, "attempt");
        failedAttempts = List.copyOf(failedAttempts);
    }

    public boolean isCompressed()
    {
        return status == Status.EXPANDED;
    }

    public static ExpandedPayload notCompressed(byte[] prolog)
    {
        return new ExpandedPayload(prolog, Status.NOT_COMPRESSED, -1, "", List.of());
    }
}
