package com.questrail.replay.model;

import java.util.List;
import java.util.Objects;

/**
 * Per-player analytics.
 *
 * @param player               slot index
 * @param apm                  actions per minute, rounded
 * @param eapm                 effective actions per minute, rounded
 * @param actionCount          commands issued by the player
 * @param effectiveActionCount effective commands issued by the player
 * @param buildOrder           build order steps in frame order
 * @param supplyHistory        supply snapshots, starting with the frame-0 seed
 * @param strategy             heuristic strategic summary
 */
public record AnalyticsSummary(
        int player,
        int apm,
        int eapm,
        int actionCount,
        int effectiveActionCount,
        List<BuildOrderEntry> buildOrder,
        List<SupplySnapshot> supplyHistory,
        StrategicSummary strategy
) {
    public AnalyticsSummary {
        buildOrder = List.copyOf(buildOrder);
        supplyHistory = List.copyOf(supplyHistory);
        Objects.requireNonNull(strategy, "strategy");
    }
}
