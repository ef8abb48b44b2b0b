package com.questrail.replay.observability;

import java.util.Objects;

/**
 * A field was resolved by a fallback tier.
 *
 * @param field     field name, e.g. {@code frames} or {@code players}
 * @param tier      name of the tier that produced the value
 * @param tierIndex zero-based index of that tier; {@code -1} if the default was used
 */
public record FallbackTierEvent(String field, String tier, int tierIndex)
{
    public FallbackTierEvent {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(tier, "tier");
    }

    public boolean isDefault()
    {
        return tierIndex < 0;
    }
}
