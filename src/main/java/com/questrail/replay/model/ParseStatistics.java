package com.questrail.replay.model;

import java.util.List;
import java.util.Objects;

/**
 * Counters and reliability of one decode.
 *
 * @param inputBytes          size of the raw input
 * @param bodyBytes           size of the (expanded) body the header was read from
 * @param compressed          true if a compressed body was expanded
 * @param commandsDecoded     commands emitted
 * @param commandsDropped     records dropped for an out-of-range or unknown player
 * @param unknownOpcodes      unknown opcode bytes skipped during resynchronisation
 * @param finalFrame          frame counter when the command loop stopped
 * @param iterationCapReached true if the loop stopped on its iteration cap
 * @param streamTruncated     true if the stream ended in the middle of a record
 * @param reliability         derived tier
 * @param errors              recoverable issues, in the order they occurred
 */
public record ParseStatistics(
        int inputBytes,
        int bodyBytes,
        boolean compressed,
        int commandsDecoded,
        int commandsDropped,
        int unknownOpcodes,
        long finalFrame,
        boolean iterationCapReached,
        boolean streamTruncated,
        Reliability reliability,
        List<ParseIssue> errors
) {
    public ParseStatistics {
        Objects.requireNonNull(reliability, "reliability");
        errors = List.copyOf(errors);
    }

    public boolean hasIssue(String code)
    {
        return errors.stream().anyMatch(e -> e.code().equals(code));
    }
}
