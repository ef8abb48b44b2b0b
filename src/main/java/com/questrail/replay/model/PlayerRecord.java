package com.questrail.replay.model;

import java.util.Objects;

/**
 * One occupied slot of the player roster.
 *
 * @param slot      index of this player in the returned roster, {@code 0..N-1};
 *                  commands and analytics refer to players by this value
 * @param tableSlot position of the player in the replay's slot table,
 *                  {@code 0..7}, as it appears in the raw command stream
 * @param name      display name
 * @param race      race
 * @param team      team number
 * @param color     colour index
 * @param kind      human or computer; placeholders are reported as human
 */
public record PlayerRecord(
        int slot,
        int tableSlot,
        String name,
        Race race,
        int team,
        int color,
        ParticipantKind kind
) {
    public PlayerRecord {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(race, "race");
        Objects.requireNonNull(kind, "kind");
        if (slot < 0) {
            throw new IllegalArgumentException("slot must be non-negative (was " + slot + ")");
        }
        if (tableSlot < 0) {
            throw new IllegalArgumentException("tableSlot must be non-negative (was " + tableSlot + ")");
        }
    }

    public PlayerRecord withSlot(int index)
    {
        return new PlayerRecord(index, tableSlot, name, race, team, color, kind);
    }
}
