package com.questrail.replay.codec.impl;

import java.util.List;
import java.util.Map;

/**
 * HeaderLayout
 * -----------------------------------------------------------------------------
 * Byte offsets of the replay header.
 *
 * <p>A file opens with a twelve byte preamble (section checksum, chunk count,
 * chunk length) followed by the four byte signature at {@code 0x0C}. The
 * body starts right after the signature. All other offsets are relative to
 * the start of the body.</p>
 *
 * <p>The {@code *_OFFSETS} lists start with the primary layout and continue
 * with the positions used by other format revisions, in the order they are
 * tried.</p>
 */
final class HeaderLayout
{
    static final int SIGNATURE_OFFSET = 0x0C;
    static final int SIGNATURE_LENGTH = 4;
    static final int BODY_OFFSET = SIGNATURE_OFFSET + SIGNATURE_LENGTH;
    static final String LEGACY_SIGNATURE = "reRS";
    static final String MODERN_SIGNATURE = "seRS";

    static final int ENGINE = 0x00;
    static final int START_TIME = 0x08;
    static final int GAME_TITLE = 0x18;
    static final int GAME_TITLE_LENGTH = 28;
    static final int MAP_WIDTH = 0x34;
    static final int MAP_HEIGHT = 0x36;
    static final int GAME_TYPE = 0x3C;
    static final int HOST_NAME = 0x48;
    static final int HOST_NAME_LENGTH = 24;
    static final int MAP_NAME_LENGTH = 26;

    /** End of the metadata area; the map name scan stays below it. */
    static final int METADATA_END = 0xA1;

    static final int SLOT_COUNT = 8;
    static final int SLOT_SIZE = 36;
    static final int SLOT_KIND = 0x08;
    static final int SLOT_RACE = 0x09;
    static final int SLOT_TEAM = 0x0A;
    static final int SLOT_NAME = 0x0B;
    static final int SLOT_COLOR = 0x05;
    static final int SLOT_NAME_LENGTH = 25;

    static final int COMMAND_SECTION = 0x279;

    static final List<Integer> FRAME_OFFSETS = List.of(0x01, 0x0C, 0x08);
    static final List<Integer> MAP_NAME_OFFSETS = List.of(0x61, 0x45, 0x68);
    static final List<Integer> PLAYER_TABLE_OFFSETS = List.of(0xA1, 0x161, 0x1A1, 0x200);
    static final List<Integer> SCAN_SLOT_SIZES = List.of(36, 32, 40);

    /** Upper bound of table base offsets visited by the roster scan. */
    static final int PLAYER_SCAN_END = 0x300;

    static final long MAX_PLAUSIBLE_FRAMES = 1_000_000L;

    private static final Map<Integer, String> GAME_TYPES = Map.ofEntries(
            Map.entry(0x02, "Melee"),
            Map.entry(0x03, "Free For All"),
            Map.entry(0x04, "One on One"),
            Map.entry(0x05, "Capture The Flag"),
            Map.entry(0x06, "Greed"),
            Map.entry(0x07, "Slaughter"),
            Map.entry(0x08, "Sudden Death"),
            Map.entry(0x09, "Ladder"),
            Map.entry(0x0A, "Use Map Settings"),
            Map.entry(0x0B, "Team Melee"),
            Map.entry(0x0C, "Team Free For All"),
            Map.entry(0x0D, "Team Capture The Flag"),
            Map.entry(0x0F, "Top vs Bottom"));

    private HeaderLayout() {}

    static String gameTypeName(int code)
    {
        return GAME_TYPES.getOrDefault(code, "Unknown");
    }

    static String engineName(int code)
    {
        return switch (code) {
            case 0 -> "StarCraft";
            case 1 -> "Brood War";
            default -> "Unknown";
        };
    }

    static String versionTag(String signature)
    {
        return MODERN_SIGNATURE.equals(signature) ? "modern" : "legacy";
    }
}
