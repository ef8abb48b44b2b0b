package com.questrail.replay.observability;

import com.questrail.replay.model.Reliability;

/**
 * Summary of a completed decode.
 */
public record DecodeCompletedEvent(
        int inputBytes,
        long frames,
        int players,
        int commands,
        int issues,
        Reliability reliability
) {
}
