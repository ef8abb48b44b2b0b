package com.questrail.replay.codec.impl;

import com.questrail.replay.codec.ExpandedPayload;
import com.questrail.replay.codec.PayloadExpander;
import com.questrail.replay.codec.ReplayText;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * DeflatePayloadExpander
 * -----------------------------------------------------------------------------
 * {@link PayloadExpander} for deflate-family payloads.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>Scan the first {@value #HEADER_SCAN_WINDOW} bytes for a zlib stream
 *       header ({@code CM = 8}, window of at most 32 KiB, no preset dictionary,
 *       header check divisible by 31)</li>
 *   <li>Try, in order: zlib at the header; raw deflate after the two header
 *       bytes; raw deflate at the header; zlib at the start of the prolog</li>
 *   <li>Accept the first output that passes {@link #looksLikeReplayBody(byte[])}</li>
 * </ol>
 *
 * <p>Inflated output is capped at {@code maxExpandedBytes}; a stream that would
 * exceed it is cut at the cap and left to validation.</p>
 */
public final class DeflatePayloadExpander implements PayloadExpander
{
    public static final int HEADER_SCAN_WINDOW = 64;
    public static final int MIN_BODY_BYTES = HeaderLayout.COMMAND_SECTION;
    public static final int SAMPLE_BYTES = 4096;

    static final double MIN_PRINTABLE_RATIO = 0.02;
    static final double MAX_PRINTABLE_RATIO = 0.90;
    static final double MIN_ZERO_RATIO = 0.05;
    static final double MAX_ZERO_RATIO = 0.95;

    private final int maxExpandedBytes;

    public DeflatePayloadExpander(int maxExpandedBytes)
    {
        if (maxExpandedBytes <= 0) {
            throw new IllegalArgumentException("maxExpandedBytes must be positive");
        }
        this.maxExpandedBytes = maxExpandedBytes;
    }

    @Override
    public ExpandedPayload expand(byte[] prolog)
    {
        final int header = findZlibHeader(prolog);
        if (header < 0) {
            return ExpandedPayload.notCompressed(prolog.clone());
        }

        final List<Attempt> attempts = List.of(
                new Attempt("zlib@" + header, header, false),
                new Attempt("raw@" + (header + 2), header + 2, true),
                new Attempt("raw@" + header, header, true),
                new Attempt("zlib@0", 0, false));

        final List<String> failed = new ArrayList<>();
        for (Attempt attempt : attempts) {
            final Optional<byte[]> out = inflate(prolog, attempt.offset(), attempt.nowrap());
            if (out.isPresent() && looksLikeReplayBody(out.get())) {
                return new ExpandedPayload(out.get(), ExpandedPayload.Status.EXPANDED,
                        header, attempt.name(), failed);
            }
            failed.add(attempt.name());
        }
        return new ExpandedPayload(prolog.clone(), ExpandedPayload.Status.FALLBACK_RAW,
                header, "", failed);
    }

    /**
     * Returns the offset of the first zlib stream header within the scan
     * window, or {@code -1}.
     */
    public static int findZlibHeader(byte[] data)
    {
        final int limit = Math.min(HEADER_SCAN_WINDOW, data.length - 1);
        for (int i = 0; i < limit; i++) {
            final int cmf = data[i] & 0xFF;
            final int flg = data[i + 1] & 0xFF;
            if ((cmf & 0x0F) == 8
                    && (cmf >>> 4) <= 7
                    && (flg & 0x20) == 0
                    && ((cmf << 8) | flg) % 31 == 0) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Cheap plausibility check on inflated output: large enough to hold the
     * header, with printable and zero byte ratios typical of replay records.
     */
    public static boolean looksLikeReplayBody(byte[] body)
    {
        if (body.length < MIN_BODY_BYTES) {
            return false;
        }
        final int sample = Math.min(body.length, SAMPLE_BYTES);
        int printable = 0;
        int zeros = 0;
        for (int i = 0; i < sample; i++) {
            final int b = body[i] & 0xFF;
            if (b == 0) {
                zeros++;
            }
            else if (ReplayText.isPrintableAscii(b)) {
                printable++;
            }
        }
        final double printableRatio = (double) printable / sample;
        final double zeroRatio = (double) zeros / sample;
        return printableRatio >= MIN_PRINTABLE_RATIO && printableRatio <= MAX_PRINTABLE_RATIO
                && zeroRatio >= MIN_ZERO_RATIO && zeroRatio <= MAX_ZERO_RATIO;
    }

    private Optional<byte[]> inflate(byte[] data, int offset, boolean nowrap)
    {
        if (offset < 0 || offset >= data.length) {
            return Optional.empty();
        }

        final Inflater inflater = new Inflater(nowrap);
        try {
            inflater.setInput(data, offset, data.length - offset);
            final ByteArrayOutputStream out = new ByteArrayOutputStream();
            final byte[] chunk = new byte[8192];

            while (!inflater.finished() && out.size() < maxExpandedBytes) {
                final int count = inflater.inflate(chunk, 0, Math.min(chunk.length, maxExpandedBytes - out.size()));
                if (count == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    break;
                }
                out.write(chunk, 0, count);
            }

            if (out.size() == 0) {
                return Optional.empty();
            }
            return Optional.of(out.toByteArray());
        }
        catch (DataFormatException e) {
            // Corrupt stream for this parameterisation
            return Optional.empty();
        }
        finally {
            inflater.end();
        }
    }

    private record Attempt(String name, int offset, boolean nowrap) {}

    @Override
    public String toString()
    {
        return "DeflatePayloadExpander[maxExpandedBytes=" + maxExpandedBytes
                + ", window=" + HEADER_SCAN_WINDOW + ']';
    }
}
