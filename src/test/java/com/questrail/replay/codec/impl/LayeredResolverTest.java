package com.questrail.replay.codec.impl;

import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

final class LayeredResolverTest
{
    @Test
    void firstValidTierWins()
    {
        LayeredResolver<Integer> resolver = LayeredResolver.<Integer>forField("value")
                .tier("a", () -> Optional.of(-1))
                .tier("b", () -> Optional.of(7))
                .tier("c", () -> Optional.of(9))
                .validator(v -> v > 0)
                .build();

        LayeredResolver.Resolution<Integer> resolution = resolver.resolve(0);

        assertEquals(7, resolution.value());
        assertEquals("b", resolution.tier());
        assertEquals(1, resolution.tierIndex());
        assertFalse(resolution.isPrimary());
        assertFalse(resolution.isDefault());
    }

    @Test
    void laterTiersAreNotEvaluated()
    {
        AtomicInteger calls = new AtomicInteger();
        LayeredResolver<Integer> resolver = LayeredResolver.<Integer>forField("value")
                .tier("a", () -> Optional.of(1))
                .tier("b", () -> {
                    calls.incrementAndGet();
                    return Optional.of(2);
                })
                .build();

        assertTrue(resolver.resolve(0).isPrimary());
        assertEquals(0, calls.get());
    }

    @Test
    void scanTierReturnsFirstAcceptedCandidate()
    {
        LayeredResolver<String> resolver = LayeredResolver.<String>forField("name")
                .tier("fixed", Optional::empty)
                .scanTier("scan", () -> Stream.of("", "x", "map", "other"))
                .validator(s -> s.length() >= 3)
                .build();

        LayeredResolver.Resolution<String> resolution = resolver.resolve("default");

        assertEquals("map", resolution.value());
        assertEquals("scan", resolution.tier());
    }

    @Test
    void defaultWhenNothingValidates()
    {
        LayeredResolver<String> resolver = LayeredResolver.<String>forField("name")
                .tier("fixed", () -> Optional.of("no"))
                .validator(s -> false)
                .build();

        LayeredResolver.Resolution<String> resolution = resolver.resolve("fallback");

        assertEquals("fallback", resolution.value());
        assertTrue(resolution.isDefault());
        assertEquals(LayeredResolver.Resolution.DEFAULT_TIER, resolution.tierIndex());
        assertEquals("name", resolver.field());
    }
}
