package com.questrail.replay.codec;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * ReplayText
 * -----------------------------------------------------------------------------
 * Text decoding rules for the fixed-width string fields of a replay.
 *
 * <p>String fields are NUL padded and may carry non-ASCII player or map names.
 * Decoding is permissive: a strict UTF-8 decode is tried first and, if the
 * bytes are not valid UTF-8, the bytes are filtered down to printable ASCII.
 * Control characters never survive either path.</p>
 */
public final class ReplayText
{
    private ReplayText() {}

    /**
     * Returns the prefix of {@code raw} up to (excluding) the first zero byte.
     */
    public static byte[] truncateAtNul(byte[] raw)
    {
        for (int i = 0; i < raw.length; i++) {
            if (raw[i] == 0) {
                return Arrays.copyOf(raw, i);
            }
        }
        return raw.clone();
    }

    /**
     * Decodes a NUL-truncated byte field into a trimmed string with all
     * non-printable characters removed.
     */
    public static String decodePermissive(byte[] raw)
    {
        final byte[] bytes = truncateAtNul(raw);
        if (bytes.length == 0) {
            return "";
        }

        String decoded;
        try {
            decoded = strictUtf8().decode(ByteBuffer.wrap(bytes)).toString();
        }
        catch (CharacterCodingException e) {
            decoded = filteredAscii(bytes);
        }
        return stripNonPrintable(decoded).trim();
    }

    /**
     * Returns true for bytes that can appear in a text field: printable ASCII
     * or any byte of a multi-byte / high code page character.
     */
    public static boolean isPrintableByte(int b)
    {
        final int v = b & 0xFF;
        return (v >= 0x20 && v <= 0x7E) || v >= 0x80;
    }

    /**
     * Returns true for printable 7-bit ASCII only.
     */
    public static boolean isPrintableAscii(int b)
    {
        final int v = b & 0xFF;
        return v >= 0x20 && v <= 0x7E;
    }

    private static CharsetDecoder strictUtf8()
    {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    private static String filteredAscii(byte[] bytes)
    {
        final StringBuilder sb = new StringBuilder(bytes.length);
        for (byte b : bytes) {
            if (isPrintableAscii(b)) {
                sb.append((char) (b & 0xFF));
            }
        }
        return sb.toString();
    }

    private static String stripNonPrintable(String s)
    {
        final StringBuilder sb = new StringBuilder(s.length());
        s.codePoints()
                .filter(cp -> !Character.isISOControl(cp) && cp != 0xFFFD)
                .forEach(sb::appendCodePoint);
        return sb.toString();
    }
}
