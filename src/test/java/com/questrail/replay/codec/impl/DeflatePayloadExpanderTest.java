package com.questrail.replay.codec.impl;

import com.questrail.replay.codec.ExpandedPayload;
import com.questrail.replay.test.ReplayFixtures;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DeflatePayloadExpanderTest
{
    private static final int CAP = 16 * 1024 * 1024;

    private static byte[] body()
    {
        return ReplayFixtures.twoPlayerGame(ReplayFixtures.legacy())
                .commands(ReplayFixtures.CommandBytes.stream().train(0, 7).frameStep(24).train(1, 64))
                .body();
    }

    private static byte[] concat(byte[] a, byte[] b)
    {
        byte[] out = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    @Test
    void findsZlibHeader()
    {
        assertEquals(0, DeflatePayloadExpander.findZlibHeader(new byte[] { 0x78, (byte) 0x9C, 0 }));
        assertEquals(2, DeflatePayloadExpander.findZlibHeader(new byte[] { 0, 0, 0x78, 0x01, 0 }));
        assertEquals(-1, DeflatePayloadExpander.findZlibHeader(new byte[] { 1, 2, 3, 4 }));
        assertEquals(-1, DeflatePayloadExpander.findZlibHeader(new byte[0]));
    }

    @Test
    void presetDictionaryHeaderIsRejected()
    {
        // 0x78BB is divisible by 31 but has FDICT set
        assertEquals(-1, DeflatePayloadExpander.findZlibHeader(new byte[] { 0x78, (byte) 0xBB, 0 }));
    }

    @Test
    void headerBeyondTheScanWindowIsIgnored()
    {
        byte[] data = new byte[100];
        data[70] = 0x78;
        data[71] = (byte) 0x9C;
        assertEquals(-1, DeflatePayloadExpander.findZlibHeader(data));
    }

    @Test
    void uncompressedPrologIsPassedThrough()
    {
        byte[] prolog = body();
        ExpandedPayload payload = new DeflatePayloadExpander(CAP).expand(prolog);

        assertEquals(ExpandedPayload.Status.NOT_COMPRESSED, payload.status());
        assertArrayEquals(prolog, payload.body());
        assertFalse(payload.isCompressed());
    }

    @Test
    void expandsZlibStream()
    {
        byte[] body = body();
        ExpandedPayload payload = new DeflatePayloadExpander(CAP).expand(ReplayFixtures.zlib(body));

        assertEquals(ExpandedPayload.Status.EXPANDED, payload.status());
        assertEquals("zlib@0", payload.attempt());
        assertTrue(payload.failedAttempts().isEmpty());
        assertArrayEquals(body, payload.body());
    }

    @Test
    void expandsZlibStreamAfterAPrefix()
    {
        byte[] body = body();
        byte[] prolog = concat(new byte[] { 0x11, 0x22, 0x33, 0x44, 0x55, 0x66 }, ReplayFixtures.zlib(body));

        ExpandedPayload payload = new DeflatePayloadExpander(CAP).expand(prolog);

        assertEquals(ExpandedPayload.Status.EXPANDED, payload.status());
        assertEquals(6, payload.headerOffset());
        assertEquals("zlib@6", payload.attempt());
        assertArrayEquals(body, payload.body());
    }

    @Test
    void corruptChecksumFallsThroughToRawDeflate()
    {
        byte[] body = body();
        byte[] stream = ReplayFixtures.zlib(body);
        for (int i = stream.length - 4; i < stream.length; i++) {
            stream[i] = (byte) ~stream[i];
        }

        ExpandedPayload payload = new DeflatePayloadExpander(CAP).expand(stream);

        assertEquals(ExpandedPayload.Status.EXPANDED, payload.status());
        assertEquals("raw@2", payload.attempt());
        assertEquals(List.of("zlib@0"), payload.failedAttempts());
        assertArrayEquals(body, payload.body());
    }

    @Test
    void garbageAfterAZlibHeaderFallsBackToRawBytes()
    {
        byte[] prolog = new byte[702];
        Arrays.fill(prolog, (byte) 0xFF);
        prolog[0] = 0x78;
        prolog[1] = (byte) 0x9C;

        ExpandedPayload payload = new DeflatePayloadExpander(CAP).expand(prolog);

        assertEquals(ExpandedPayload.Status.FALLBACK_RAW, payload.status());
        assertEquals(List.of("zlib@0", "raw@2", "raw@0", "zlib@0"), payload.failedAttempts());
        assertArrayEquals(prolog, payload.body());
        assertEquals("", payload.attempt());
    }

    @Test
    void outputThatDoesNotLookLikeAReplayIsRejected()
    {
        byte[] tiny = ReplayFixtures.zlib("not a replay".getBytes(StandardCharsets.US_ASCII));

        ExpandedPayload payload = new DeflatePayloadExpander(CAP).expand(tiny);

        assertEquals(ExpandedPayload.Status.FALLBACK_RAW, payload.status());
    }

    @Test
    void outputIsCappedAtTheConfiguredLimit()
    {
        byte[] body = ReplayFixtures.twoPlayerGame(ReplayFixtures.legacy())
                .commands(ReplayFixtures.CommandBytes.stream().frameStep(3000).train(0, 7))
                .body();

        ExpandedPayload payload = new DeflatePayloadExpander(800).expand(ReplayFixtures.zlib(body));

        assertEquals(ExpandedPayload.Status.EXPANDED, payload.status());
        assertEquals(800, payload.body().length);
        assertArrayEquals(Arrays.copyOf(body, 800), payload.body());
    }

    @Test
    void plausibilityRatios()
    {
        assertTrue(DeflatePayloadExpander.looksLikeReplayBody(body()));
        assertFalse(DeflatePayloadExpander.looksLikeReplayBody(new byte[1000]));

        byte[] text = new byte[1000];
        Arrays.fill(text, (byte) 'a');
        assertFalse(DeflatePayloadExpander.looksLikeReplayBody(text));
        assertFalse(DeflatePayloadExpander.looksLikeReplayBody(new byte[10]));
    }

    @Test
    void rejectsNonPositiveCap()
    {
        assertThrows(IllegalArgumentException.class, () -> new DeflatePayloadExpander(0));
    }
}
