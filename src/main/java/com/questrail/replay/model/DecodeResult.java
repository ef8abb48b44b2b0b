package com.questrail.replay.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The sole output of a decode: header, roster, commands, analytics and
 * statistics.
 *
 * <p>All collections are immutable. {@code analytics} is keyed by player slot
 * and iterates in slot order.</p>
 */
public record DecodeResult(
        ReplayHeader header,
        List<PlayerRecord> players,
        List<Command> commands,
        Map<Integer, AnalyticsSummary> analytics,
        ParseStatistics statistics
) {
    public DecodeResult {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(statistics, "statistics");
        players = List.copyOf(players);
        commands = List.copyOf(commands);
        analytics = Collections.unmodifiableMap(new TreeMap<>(analytics));
    }

    public Optional<PlayerRecord> player(int slot)
    {
        return players.stream().filter(p -> p.slot() == slot).findFirst();
    }

    public Optional<AnalyticsSummary> analyticsFor(int slot)
    {
        return Optional.ofNullable(analytics.get(slot));
    }
}
