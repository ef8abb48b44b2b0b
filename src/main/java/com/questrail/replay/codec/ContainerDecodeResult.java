package com.questrail.replay.codec;

import com.questrail.replay.model.ParseIssue;
import com.questrail.replay.model.PlayerRecord;
import com.questrail.replay.model.ReplayHeader;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Output of a {@link ContainerDecoder}.
 *
 * @param header         decoded header
 * @param players        roster after kind filtering, never empty; {@code slot}
 *                       is the list index and {@code tableSlot} is unique
 * @param body           the (expanded) body the header was read from
 * @param commandOffset  offset of the command section within {@code body}
 * @param payloadStatus  how {@code body} was obtained
 * @param degradations   fallbacks that fired
 * @param issues         issues recorded, in order
 */
public record ContainerDecodeResult(
        ReplayHeader header,
        List<PlayerRecord> players,
        byte[] body,
        int commandOffset,
        ExpandedPayload.Status payloadStatus,
        Set<Degradation> degradations,
        List<ParseIssue> issues
) {
    public enum Degradation
    {
        PAYLOAD_FALLBACK_RAW,
        FRAMES_FALLBACK,
        FRAMES_DEFAULTED,
        MAP_NAME_FALLBACK,
        MAP_NAME_DEFAULTED,
        PLAYERS_FALLBACK,
        PLAYERS_SYNTHESIZED,
        COMMAND_SECTION_MISSING
    }

    public ContainerDecodeResult {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(payloadStatus, "payloadStatus");
        players = List.copyOf(players);
        if (players.isEmpty()) {
            throw new IllegalArgumentException("players must not be empty");
        }
        body = body.clone();
        degradations = degradations.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(degradations));
        issues = List.copyOf(issues);
    }

    @Override
    public byte[] body()
    {
        return body.clone();
    }

    public int bodyLength()
    {
        return body.length;
    }

    public boolean isCompressed()
    {
        return payloadStatus == ExpandedPayload.Status.EXPANDED;
    }

    public boolean has(Degradation degradation)
    {
        return degradations.contains(degradation);
    }

    /**
     * Returns a fresh cursor over the body, positioned at the command section
     * (or at the end of the body if the body is shorter).
     */
    public ByteCursor commandCursor()
    {
        return new ByteCursor(body).seek(commandOffset);
    }
}
