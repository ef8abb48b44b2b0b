package com.questrail.replay.model;

/**
 * Who occupies a player slot.
 */
public enum ParticipantKind
{
    HUMAN,
    COMPUTER,
    EMPTY;

    /**
     * Maps the slot-type byte of the player table.
     *
     * <p>{@code 2} is a human; {@code 1} and {@code 5} are computer-controlled;
     * everything else (inactive, rescue, open, neutral, closed, unknown) is
     * treated as an empty slot.</p>
     */
    public static ParticipantKind fromCode(int code)
    {
        return switch (code) {
            case 2 -> HUMAN;
            case 1, 5 -> COMPUTER;
            default -> EMPTY;
        };
    }
}
