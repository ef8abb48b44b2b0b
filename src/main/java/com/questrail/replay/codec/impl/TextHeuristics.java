package com.questrail.replay.codec.impl;

import com.questrail.replay.codec.ReplayText;

import java.util.Locale;
import java.util.Set;

/**
 * Validators that decide whether a byte field "looks like" a map or player
 * name.
 */
final class TextHeuristics
{
    static final double MIN_MAP_PRINTABLE_RATIO = 0.7;
    static final int MAX_IDENTICAL_RUN = 3;
    static final int MIN_PLAYER_NAME = 2;
    static final int MAX_PLAYER_NAME = 24;

    private static final Set<String> RESERVED_NAMES = Set.of("observer", "computer", "open", "closed");

    private TextHeuristics() {}

    /**
     * Map name check over NUL-truncated bytes: at least 70% printable, at
     * least one letter, no run of four identical bytes.
     */
    static boolean isPlausibleMapName(byte[] bytes)
    {
        if (bytes.length == 0) {
            return false;
        }
        int printable = 0;
        for (byte b : bytes) {
            if (ReplayText.isPrintableByte(b)) {
                printable++;
            }
        }
        if ((double) printable / bytes.length < MIN_MAP_PRINTABLE_RATIO) {
            return false;
        }
        return !hasIdenticalRun(bytes) && containsLetter(ReplayText.decodePermissive(bytes));
    }

    /**
     * Player name check over NUL-truncated bytes: printable, 2 to 24 code
     * points, at least one letter, not a reserved slot label. Repeated
     * characters are allowed.
     */
    static boolean isPlausiblePlayerName(byte[] bytes)
    {
        for (byte b : bytes) {
            if (!ReplayText.isPrintableByte(b)) {
                return false;
            }
        }
        final String name = ReplayText.decodePermissive(bytes);
        final int length = name.codePointCount(0, name.length());
        if (length < MIN_PLAYER_NAME || length > MAX_PLAYER_NAME) {
            return false;
        }
        if (RESERVED_NAMES.contains(name.toLowerCase(Locale.ROOT))) {
            return false;
        }
        return containsLetter(name);
    }

    static boolean containsLetter(String s)
    {
        return s.codePoints().anyMatch(Character::isLetter);
    }

    static boolean hasIdenticalRun(byte[] bytes)
    {
        int run = 1;
        for (int i = 1; i < bytes.length; i++) {
            run = (bytes[i] == bytes[i - 1]) ? run + 1 : 1;
            if (run > MAX_IDENTICAL_RUN) {
                return true;
            }
        }
        return false;
    }
}
