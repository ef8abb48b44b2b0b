package com.questrail.replay.catalog;

import com.questrail.replay.model.Race;

import java.util.Objects;

/**
 * Static description of a unit, building, tech or upgrade.
 *
 * @param id             id within its {@link EntityKind} space
 * @param name           display name
 * @param race           owning race (never {@link Race#RANDOM})
 * @param kind           id space
 * @param category       strategic role
 * @param cost           production cost
 * @param supplyProvided maximum supply added once the entity exists
 */
public record EntityDescriptor(
        int id,
        String name,
        Race race,
        EntityKind kind,
        EntityCategory category,
        Cost cost,
        int supplyProvided
) {
    public EntityDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(race, "race");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(cost, "cost");
    }

    public boolean isSupplyProvider()
    {
        return supplyProvided > 0;
    }

    public boolean isWorker()
    {
        return kind == EntityKind.UNIT && category == EntityCategory.ECONOMY;
    }
}
