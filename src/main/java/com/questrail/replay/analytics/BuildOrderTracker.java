package com.questrail.replay.analytics;

import com.questrail.replay.catalog.EntityDescriptor;
import com.questrail.replay.catalog.EntityKind;
import com.questrail.replay.catalog.OpcodeCatalog;
import com.questrail.replay.catalog.OpcodeDescriptor;
import com.questrail.replay.model.BuildAction;
import com.questrail.replay.model.BuildOrderEntry;
import com.questrail.replay.model.Command;
import com.questrail.replay.model.Race;
import com.questrail.replay.model.SupplySnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * BuildOrderTracker
 * -----------------------------------------------------------------------------
 * Accumulates one player's build order and supply timeline.
 *
 * <p>Supply starts at the race's opening values. Training or morphing a unit
 * adds its supply cost to the current supply; any step producing a supply
 * provider raises maximum supply by the provider's increment, up to
 * {@value #SUPPLY_CAP}. Each supply-affecting step appends a snapshot.</p>
 *
 * <p>Not thread-safe; one instance per player per decode.</p>
 */
final class BuildOrderTracker
{
    static final int SUPPLY_CAP = 200;
    static final int STARTING_SUPPLY = 4;

    private final Race race;
    private final List<BuildOrderEntry> entries = new ArrayList<>();
    private final List<SupplySnapshot> history = new ArrayList<>();

    private int currentSupply;
    private int maxSupply;

    BuildOrderTracker(Race race)
    {
        this.race = race;
        this.currentSupply = STARTING_SUPPLY;
        this.maxSupply = startingMaxSupply(race);
        history.add(SupplySnapshot.of(0, currentSupply, maxSupply));
    }

    /**
     * Opening maximum supply; no snapshot of the race's timeline falls below it.
     */
    static int startingMaxSupply(Race race)
    {
        return race == Race.TERRAN ? 10 : 9;
    }

    /**
     * Feeds one command; commands that are not build-order steps, or whose
     * entity cannot be resolved, are ignored.
     */
    void accept(Command command)
    {
        final Optional<BuildAction> action = OpcodeCatalog.lookup(command.opcode())
                .map(OpcodeDescriptor::category)
                .flatMap(category -> category.buildAction());
        if (action.isEmpty()) {
            return;
        }

        final Optional<EntityResolver.Resolved> resolved = EntityResolver.resolve(command, action.get(), race);
        if (resolved.isEmpty()) {
            return;
        }

        final EntityDescriptor entity = resolved.get().entity();
        final boolean affected = applySupply(action.get(), entity);
        final SupplySnapshot snapshot = SupplySnapshot.of(command.frame(), currentSupply, maxSupply);
        if (affected) {
            history.add(snapshot);
        }

        entries.add(new BuildOrderEntry(
                command.frame(),
                GameClock.format(command.frame()),
                action.get(),
                entity.id(),
                entity.name(),
                snapshot,
                resolved.get().confidence(),
                resolved.get().method()));
    }

    private boolean applySupply(BuildAction action, EntityDescriptor entity)
    {
        if (action == BuildAction.RESEARCH || action == BuildAction.UPGRADE) {
            return false;
        }

        boolean affected = false;
        if (entity.kind() == EntityKind.UNIT && action != BuildAction.BUILD && entity.cost().supply() > 0) {
            currentSupply += entity.cost().supply();
            affected = true;
        }
        if (entity.isSupplyProvider()) {
            maxSupply = Math.min(SUPPLY_CAP, maxSupply + entity.supplyProvided());
            affected = true;
        }
        return affected;
    }

    List<BuildOrderEntry> buildOrder()
    {
        return List.copyOf(entries);
    }

    List<SupplySnapshot> supplyHistory()
    {
        return List.copyOf(history);
    }
}
