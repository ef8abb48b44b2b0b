package com.questrail.replay.codec.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * LayeredResolver
 * -----------------------------------------------------------------------------
 * Ordered list of candidate extraction tiers plus one validator.
 *
 * <p>Tiers are evaluated in order. Each tier lazily produces zero or more
 * candidates; the first candidate that passes the validator wins and the
 * remaining tiers are never evaluated. When no tier yields an accepted
 * candidate the caller-supplied default is returned with tier index
 * {@link Resolution#DEFAULT_TIER}.</p>
 *
 * <p>The same resolver shape serves the frame count, the map name and the
 * player table.</p>
 *
 * @param <T> candidate type
 */
public final class LayeredResolver<T>
{
    private final String field;
    private final List<Tier<T>> tiers;
    private final Predicate<? super T> validator;

    private LayeredResolver(String field, List<Tier<T>> tiers, Predicate<? super T> validator)
    {
        this.field = field;
        this.tiers = List.copyOf(tiers);
        this.validator = validator;
    }

    public static <T> Builder<T> forField(String field)
    {
        return new Builder<>(field);
    }

    public String field()
    {
        return field;
    }

    /**
     * Resolve the field, falling back to {@code defaultValue}.
     */
    public Resolution<T> resolve(T defaultValue)
    {
        for (int i = 0; i < tiers.size(); i++) {
            final Tier<T> tier = tiers.get(i);
            final Optional<T> accepted;
            try (Stream<T> candidates = tier.candidates().get()) {
                accepted = candidates.filter(Objects::nonNull).filter(validator).findFirst();
            }
            if (accepted.isPresent()) {
                return new Resolution<>(accepted.get(), tier.name(), i);
            }
        }
        return new Resolution<>(defaultValue, "default", Resolution.DEFAULT_TIER);
    }

    /**
     * One named extraction attempt.
     */
    public record Tier<T>(String name, Supplier<Stream<T>> candidates)
    {
        public Tier {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(candidates, "candidates");
        }
    }

    /**
     * Outcome of {@link #resolve(Object)}.
     *
     * @param value     accepted candidate or the default
     * @param tier      name of the tier that produced {@code value}
     * @param tierIndex index of that tier, or {@link #DEFAULT_TIER}
     */
    public record Resolution<T>(T value, String tier, int tierIndex)
    {
        public static final int DEFAULT_TIER = -1;

        public boolean isPrimary()
        {
            return tierIndex == 0;
        }

        public boolean isDefault()
        {
            return tierIndex == DEFAULT_TIER;
        }
    }

    public static final class Builder<T>
    {
        private final String field;
        private final List<Tier<T>> tiers = new ArrayList<>();
        private Predicate<? super T> validator = v -> true;

        private Builder(String field)
        {
            this.field = Objects.requireNonNull(field, "field");
        }

        /**
         * Adds a tier producing at most one candidate.
         */
        public Builder<T> tier(String name, Supplier<Optional<T>> candidate)
        {
            tiers.add(new Tier<>(name, () -> candidate.get().stream()));
            return this;
        }

        /**
         * Adds a tier producing any number of candidates, tried in stream order.
         */
        public Builder<T> scanTier(String name, Supplier<Stream<T>> candidates)
        {
            tiers.add(new Tier<>(name, candidates));
            return this;
        }

        public Builder<T> validator(Predicate<? super T> validator)
        {
            this.validator = Objects.requireNonNull(validator, "validator");
            return this;
        }

        public LayeredResolver<T> build()
        {
            return new LayeredResolver<>(field, tiers, validator);
        }
    }
}
