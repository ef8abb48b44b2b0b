package com.questrail.replay.model;

import java.util.Objects;

/**
 * One step of a player's build order.
 *
 * <p>{@code confidence} says how directly the entity was recovered from the
 * command: a value read straight from the command's parameters scores
 * {@value #DIRECT_CONFIDENCE}; an entity inferred from game phase and race
 * scores {@value #INFERRED_CONFIDENCE}. Consumers must branch on
 * {@link #isReliable()} (or their own threshold) rather than treat every entry
 * as certain.</p>
 *
 * @param frame            frame of the command
 * @param gameTime         game time as {@code m:ss}
 * @param action           kind of step
 * @param entityId         resolved unit, tech or upgrade id
 * @param entityName       resolved name
 * @param supply           supply state after the step
 * @param confidence       0..100
 * @param resolution       which resolution tier produced the entity
 */
public record BuildOrderEntry(
        long frame,
        String gameTime,
        BuildAction action,
        int entityId,
        String entityName,
        SupplySnapshot supply,
        int confidence,
        String resolution
) {
    public static final int DIRECT_CONFIDENCE = 95;
    public static final int INFERRED_CONFIDENCE = 15;
    public static final int RELIABLE_THRESHOLD = 50;

    public BuildOrderEntry {
        Objects.requireNonNull(gameTime, "gameTime");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(entityName, "entityName");
        Objects.requireNonNull(supply, "supply");
        Objects.requireNonNull(resolution, "resolution");
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence must be in 0..100 (was " + confidence + ")");
        }
    }

    public boolean isReliable()
    {
        return confidence >= RELIABLE_THRESHOLD;
    }
}
