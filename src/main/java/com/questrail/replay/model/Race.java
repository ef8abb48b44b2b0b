package com.questrail.replay.model;

/**
 * The four canonical player races.
 *
 * <p>Race codes on the wire are {@code 0} Zerg, {@code 1} Terran,
 * {@code 2} Protoss, and {@code 3} or {@code 6} Random. Any other value is not
 * a race and marks the slot as undecodable.</p>
 */
public enum Race
{
    ZERG,
    TERRAN,
    PROTOSS,
    RANDOM;

    /**
     * Returns true if {@code code} is a race code this format defines.
     */
    public static boolean isValidCode(int code)
    {
        return code == 0 || code == 1 || code == 2 || code == 3 || code == 6;
    }

    /**
     * Maps a wire race code to a race.
     *
     * @throws IllegalArgumentException if {@link #isValidCode(int)} is false
     */
    public static Race fromCode(int code)
    {
        return switch (code) {
            case 0 -> ZERG;
            case 1 -> TERRAN;
            case 2 -> PROTOSS;
            case 3, 6 -> RANDOM;
            default -> throw new IllegalArgumentException("Unknown race code: " + code);
        };
    }
}
