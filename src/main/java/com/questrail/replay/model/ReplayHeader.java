package com.questrail.replay.model;

import java.util.Objects;

/**
 * Match metadata decoded from the replay header.
 *
 * <p>{@code frames} is always a finite, non-negative value. When the header
 * does not yield a plausible frame count the value is either inferred from the
 * command stream or left at {@link #DEFAULT_FRAMES}; in both cases
 * {@code frameCountConfident} is false. The same applies to
 * {@code mapName} and {@link #UNKNOWN_MAP}.</p>
 *
 * @param signature           the four-character file tag ({@code reRS} or {@code seRS})
 * @param engine              engine name, e.g. "Brood War"
 * @param versionTag          format revision derived from the signature
 * @param frames              total frame count
 * @param frameCountConfident false if {@code frames} is a default or an inference
 * @param mapName             map name
 * @param mapNameConfident    false if the map name was scanned for or defaulted
 * @param gameTitle           lobby title, may be empty
 * @param hostName            lobby host, may be empty
 * @param gameTypeCode        raw game type code
 * @param gameType            human-readable game type
 * @param startTimeEpochSeconds recorded start time, 0 if absent
 * @param mapWidth            map width in tiles, 0 if absent
 * @param mapHeight           map height in tiles, 0 if absent
 */
public record ReplayHeader(
        String signature,
        String engine,
        String versionTag,
        long frames,
        boolean frameCountConfident,
        String mapName,
        boolean mapNameConfident,
        String gameTitle,
        String hostName,
        int gameTypeCode,
        String gameType,
        long startTimeEpochSeconds,
        int mapWidth,
        int mapHeight
) {
    public static final long DEFAULT_FRAMES = 0L;
    public static final String UNKNOWN_MAP = "Unknown Map";

    public ReplayHeader {
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(versionTag, "versionTag");
        Objects.requireNonNull(mapName, "mapName");
        Objects.requireNonNull(gameTitle, "gameTitle");
        Objects.requireNonNull(hostName, "hostName");
        Objects.requireNonNull(gameType, "gameType");
        if (frames < 0) {
            throw new IllegalArgumentException("frames must be non-negative (was " + frames + ")");
        }
    }

    /**
     * Returns a copy with a different frame count and confidence.
     */
    public ReplayHeader withFrames(long newFrames, boolean confident)
    {
        return new ReplayHeader(signature, engine, versionTag, newFrames, confident,
                mapName, mapNameConfident, gameTitle, hostName, gameTypeCode, gameType,
                startTimeEpochSeconds, mapWidth, mapHeight);
    }
}
