package com.questrail.replay.model;

import java.util.List;
import java.util.Objects;

/**
 * Heuristic classification of a build order.
 *
 * <p>Derived by simple thresholds over the first build order entries. These
 * labels are indicative only.</p>
 */
public record StrategicSummary(
        Opening opening,
        List<String> techPath,
        EconomicPattern economicPattern,
        SupplyManagement supplyManagement
) {
    public enum Opening { ECONOMIC, AGGRESSIVE, SAFE, STANDARD }

    public enum EconomicPattern { ECO_HEAVY, FAST_EXPAND, STANDARD, ALL_IN }

    public enum SupplyManagement { EXCELLENT, GOOD, AVERAGE, POOR }

    public static final StrategicSummary EMPTY = new StrategicSummary(
            Opening.STANDARD, List.of(), EconomicPattern.STANDARD, SupplyManagement.AVERAGE);

    public StrategicSummary {
        Objects.requireNonNull(opening, "opening");
        Objects.requireNonNull(economicPattern, "economicPattern");
        Objects.requireNonNull(supplyManagement, "supplyManagement");
        techPath = List.copyOf(techPath);
    }
}
