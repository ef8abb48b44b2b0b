package com.questrail.replay.analytics;

import com.questrail.replay.catalog.EntityCatalog;
import com.questrail.replay.catalog.EntityCategory;
import com.questrail.replay.catalog.EntityDescriptor;
import com.questrail.replay.catalog.EntityKind;
import com.questrail.replay.model.BuildAction;
import com.questrail.replay.model.BuildOrderEntry;
import com.questrail.replay.model.StrategicSummary;
import com.questrail.replay.model.StrategicSummary.EconomicPattern;
import com.questrail.replay.model.StrategicSummary.Opening;
import com.questrail.replay.model.StrategicSummary.SupplyManagement;
import com.questrail.replay.model.SupplySnapshot;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Threshold heuristics over a build order. The labels are indicative only.
 *
 * <ul>
 *   <li>Opening, over the first {@value #OPENING_WINDOW} entries: six workers
 *       is economic, three military entries aggressive, two supply entries
 *       safe.</li>
 *   <li>Tech path: research, upgrades and tech buildings, in order.</li>
 *   <li>Economic pattern: ratio of economy to military entries.</li>
 *   <li>Supply management: share of supply-blocked snapshots.</li>
 * </ul>
 */
final class StrategicClassifier
{
    static final int OPENING_WINDOW = 10;

    private StrategicClassifier() {}

    static StrategicSummary classify(List<BuildOrderEntry> buildOrder, List<SupplySnapshot> supplyHistory)
    {
        if (buildOrder.isEmpty()) {
            return StrategicSummary.EMPTY;
        }
        return new StrategicSummary(
                opening(buildOrder),
                techPath(buildOrder),
                economicPattern(buildOrder),
                supplyManagement(supplyHistory));
    }

    static Opening opening(List<BuildOrderEntry> buildOrder)
    {
        final List<BuildOrderEntry> window = buildOrder.subList(0, Math.min(OPENING_WINDOW, buildOrder.size()));
        int workers = 0;
        int military = 0;
        int supply = 0;
        for (BuildOrderEntry entry : window) {
            final Optional<EntityDescriptor> entity = entityOf(entry);
            if (entity.isEmpty()) {
                continue;
            }
            if (entity.get().isWorker()) {
                workers++;
            }
            if (entity.get().category() == EntityCategory.MILITARY) {
                military++;
            }
            if (entity.get().category() == EntityCategory.SUPPLY) {
                supply++;
            }
        }

        if (workers >= 6) {
            return Opening.ECONOMIC;
        }
        if (military >= 3) {
            return Opening.AGGRESSIVE;
        }
        if (supply >= 2) {
            return Opening.SAFE;
        }
        return Opening.STANDARD;
    }

    static List<String> techPath(List<BuildOrderEntry> buildOrder)
    {
        final Set<String> path = new LinkedHashSet<>();
        for (BuildOrderEntry entry : buildOrder) {
            if (entry.action() == BuildAction.RESEARCH || entry.action() == BuildAction.UPGRADE) {
                path.add(entry.entityName());
                continue;
            }
            entityOf(entry)
                    .filter(e -> e.kind() == EntityKind.BUILDING && e.category() == EntityCategory.TECH)
                    .ifPresent(e -> path.add(e.name()));
        }
        return List.copyOf(path);
    }

    static EconomicPattern economicPattern(List<BuildOrderEntry> buildOrder)
    {
        int economy = 0;
        int military = 0;
        for (BuildOrderEntry entry : buildOrder) {
            final Optional<EntityDescriptor> entity = entityOf(entry);
            if (entity.isEmpty()) {
                continue;
            }
            if (entity.get().category() == EntityCategory.ECONOMY) {
                economy++;
            }
            else if (entity.get().category() == EntityCategory.MILITARY) {
                military++;
            }
        }

        final double ratio;
        if (military == 0) {
            ratio = economy == 0 ? 1.0 : Double.POSITIVE_INFINITY;
        }
        else {
            ratio = (double) economy / military;
        }

        if (ratio > 2.0) {
            return EconomicPattern.ECO_HEAVY;
        }
        if (ratio > 1.5) {
            return EconomicPattern.FAST_EXPAND;
        }
        if (ratio < 0.5) {
            return EconomicPattern.ALL_IN;
        }
        return EconomicPattern.STANDARD;
    }

    static SupplyManagement supplyManagement(List<SupplySnapshot> supplyHistory)
    {
        if (supplyHistory.isEmpty()) {
            return SupplyManagement.AVERAGE;
        }
        final long blocked = supplyHistory.stream().filter(SupplySnapshot::supplyBlocked).count();
        final double ratio = (double) blocked / supplyHistory.size();
        if (ratio < 0.1) {
            return SupplyManagement.EXCELLENT;
        }
        if (ratio < 0.2) {
            return SupplyManagement.GOOD;
        }
        if (ratio < 0.4) {
            return SupplyManagement.AVERAGE;
        }
        return SupplyManagement.POOR;
    }

    private static Optional<EntityDescriptor> entityOf(BuildOrderEntry entry)
    {
        return switch (entry.action()) {
            case BUILD, TRAIN, MORPH -> EntityCatalog.lookup(entry.entityId());
            case RESEARCH -> EntityCatalog.lookupTech(entry.entityId());
            case UPGRADE -> EntityCatalog.lookupUpgrade(entry.entityId());
        };
    }
}
