package com.questrail.replay.catalog;

import com.questrail.replay.model.Race;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static com.questrail.replay.catalog.EntityCategory.*;
import static com.questrail.replay.model.Race.PROTOSS;
import static com.questrail.replay.model.Race.TERRAN;
import static com.questrail.replay.model.Race.ZERG;

/**
 * EntityCatalog
 * -----------------------------------------------------------------------------
 * Immutable tables of game objects, keyed by id within each id space.
 *
 * <p>Unit and building ids follow the engine's unit type numbering. Supply is
 * expressed in whole display units (a Zergling pair costs 1).</p>
 */
public final class EntityCatalog
{
    private static final Map<Integer, EntityDescriptor> UNITS;
    private static final Map<Integer, EntityDescriptor> TECHS;
    private static final Map<Integer, EntityDescriptor> UPGRADES;

    static {
        final Map<Integer, EntityDescriptor> u = new TreeMap<>();

        // Terran units
        unit(u, 0, "Marine", TERRAN, MILITARY, 50, 0, 1);
        unit(u, 1, "Ghost", TERRAN, MILITARY, 25, 75, 1);
        unit(u, 2, "Vulture", TERRAN, MILITARY, 75, 0, 2);
        unit(u, 3, "Goliath", TERRAN, MILITARY, 100, 50, 2);
        unit(u, 5, "Siege Tank", TERRAN, MILITARY, 150, 100, 2);
        unit(u, 7, "SCV", TERRAN, ECONOMY, 50, 0, 1);
        unit(u, 8, "Wraith", TERRAN, MILITARY, 150, 100, 2);
        unit(u, 9, "Science Vessel", TERRAN, TECH, 100, 225, 2);
        unit(u, 11, "Dropship", TERRAN, MILITARY, 100, 100, 2);
        unit(u, 12, "Battlecruiser", TERRAN, MILITARY, 400, 300, 6);
        unit(u, 14, "Nuclear Missile", TERRAN, MILITARY, 200, 200, 8);
        unit(u, 32, "Firebat", TERRAN, MILITARY, 50, 25, 1);
        unit(u, 34, "Medic", TERRAN, MILITARY, 50, 25, 1);
        unit(u, 58, "Valkyrie", TERRAN, MILITARY, 250, 125, 3);

        // Zerg units
        unit(u, 37, "Zergling", ZERG, MILITARY, 50, 0, 1);
        unit(u, 38, "Hydralisk", ZERG, MILITARY, 75, 25, 1);
        unit(u, 39, "Ultralisk", ZERG, MILITARY, 200, 200, 4);
        unit(u, 41, "Drone", ZERG, ECONOMY, 50, 0, 1);
        supplyUnit(u, 42, "Overlord", ZERG, 100, 8);
        unit(u, 43, "Mutalisk", ZERG, MILITARY, 100, 100, 2);
        unit(u, 44, "Guardian", ZERG, MILITARY, 50, 100, 0);
        unit(u, 45, "Queen", ZERG, TECH, 100, 100, 2);
        unit(u, 46, "Defiler", ZERG, TECH, 50, 150, 2);
        unit(u, 47, "Scourge", ZERG, MILITARY, 25, 75, 1);
        unit(u, 62, "Devourer", ZERG, MILITARY, 150, 50, 0);
        unit(u, 103, "Lurker", ZERG, MILITARY, 50, 100, 1);

        // Protoss units
        unit(u, 60, "Corsair", PROTOSS, MILITARY, 150, 100, 2);
        unit(u, 61, "Dark Templar", PROTOSS, MILITARY, 125, 100, 2);
        unit(u, 63, "Dark Archon", PROTOSS, TECH, 0, 0, 0);
        unit(u, 64, "Probe", PROTOSS, ECONOMY, 50, 0, 1);
        unit(u, 65, "Zealot", PROTOSS, MILITARY, 100, 0, 2);
        unit(u, 66, "Dragoon", PROTOSS, MILITARY, 125, 50, 2);
        unit(u, 67, "High Templar", PROTOSS, TECH, 50, 150, 2);
        unit(u, 68, "Archon", PROTOSS, MILITARY, 0, 0, 0);
        unit(u, 69, "Shuttle", PROTOSS, MILITARY, 200, 0, 2);
        unit(u, 70, "Scout", PROTOSS, MILITARY, 275, 125, 3);
        unit(u, 71, "Arbiter", PROTOSS, TECH, 100, 350, 4);
        unit(u, 72, "Carrier", PROTOSS, MILITARY, 350, 250, 6);
        unit(u, 83, "Reaver", PROTOSS, MILITARY, 200, 100, 4);
        unit(u, 84, "Observer", PROTOSS, TECH, 25, 75, 1);

        // Terran buildings
        supplyBuilding(u, 106, "Command Center", TERRAN, ECONOMY, 400, 0, 10);
        building(u, 107, "Comsat Station", TERRAN, TECH, 50, 50);
        building(u, 108, "Nuclear Silo", TERRAN, TECH, 100, 100);
        supplyBuilding(u, 109, "Supply Depot", TERRAN, SUPPLY, 100, 0, 8);
        building(u, 110, "Refinery", TERRAN, ECONOMY, 100, 0);
        building(u, 111, "Barracks", TERRAN, MILITARY, 150, 0);
        building(u, 112, "Academy", TERRAN, TECH, 150, 0);
        building(u, 113, "Factory", TERRAN, MILITARY, 200, 100);
        building(u, 114, "Starport", TERRAN, MILITARY, 150, 100);
        building(u, 115, "Control Tower", TERRAN, TECH, 50, 50);
        building(u, 116, "Science Facility", TERRAN, TECH, 100, 150);
        building(u, 117, "Covert Ops", TERRAN, TECH, 50, 50);
        building(u, 118, "Physics Lab", TERRAN, TECH, 50, 50);
        building(u, 120, "Machine Shop", TERRAN, TECH, 50, 50);
        building(u, 122, "Engineering Bay", TERRAN, TECH, 125, 0);
        building(u, 123, "Armory", TERRAN, TECH, 100, 50);
        building(u, 124, "Missile Turret", TERRAN, DEFENSE, 75, 0);
        building(u, 125, "Bunker", TERRAN, DEFENSE, 100, 0);

        // Zerg buildings
        supplyBuilding(u, 131, "Hatchery", ZERG, ECONOMY, 300, 0, 1);
        building(u, 132, "Lair", ZERG, TECH, 150, 100);
        building(u, 133, "Hive", ZERG, TECH, 200, 150);
        building(u, 134, "Nydus Canal", ZERG, TECH, 150, 0);
        building(u, 135, "Hydralisk Den", ZERG, MILITARY, 100, 50);
        building(u, 136, "Defiler Mound", ZERG, TECH, 100, 100);
        building(u, 137, "Greater Spire", ZERG, TECH, 100, 150);
        building(u, 138, "Queen's Nest", ZERG, TECH, 150, 100);
        building(u, 139, "Evolution Chamber", ZERG, TECH, 75, 0);
        building(u, 140, "Ultralisk Cavern", ZERG, TECH, 150, 200);
        building(u, 141, "Spire", ZERG, MILITARY, 200, 150);
        building(u, 142, "Spawning Pool", ZERG, MILITARY, 200, 0);
        building(u, 143, "Creep Colony", ZERG, DEFENSE, 75, 0);
        building(u, 144, "Spore Colony", ZERG, DEFENSE, 50, 0);
        building(u, 146, "Sunken Colony", ZERG, DEFENSE, 50, 0);
        building(u, 149, "Extractor", ZERG, ECONOMY, 50, 0);

        // Protoss buildings
        supplyBuilding(u, 154, "Nexus", PROTOSS, ECONOMY, 400, 0, 10);
        building(u, 155, "Robotics Facility", PROTOSS, MILITARY, 200, 200);
        supplyBuilding(u, 156, "Pylon", PROTOSS, SUPPLY, 100, 0, 8);
        building(u, 157, "Assimilator", PROTOSS, ECONOMY, 100, 0);
        building(u, 159, "Observatory", PROTOSS, TECH, 50, 100);
        building(u, 160, "Gateway", PROTOSS, MILITARY, 150, 0);
        building(u, 162, "Photon Cannon", PROTOSS, DEFENSE, 150, 0);
        building(u, 163, "Citadel of Adun", PROTOSS, TECH, 150, 100);
        building(u, 164, "Cybernetics Core", PROTOSS, TECH, 200, 0);
        building(u, 165, "Templar Archives", PROTOSS, TECH, 150, 200);
        building(u, 166, "Forge", PROTOSS, TECH, 150, 0);
        building(u, 167, "Stargate", PROTOSS, MILITARY, 150, 150);
        building(u, 169, "Fleet Beacon", PROTOSS, TECH, 300, 200);
        building(u, 170, "Arbiter Tribunal", PROTOSS, TECH, 200, 150);
        building(u, 171, "Robotics Support Bay", PROTOSS, TECH, 150, 100);
        building(u, 172, "Shield Battery", PROTOSS, DEFENSE, 100, 0);

        UNITS = Collections.unmodifiableMap(u);

        final Map<Integer, EntityDescriptor> t = new TreeMap<>();
        tech(t, 0, "Stim Packs", TERRAN, 100, 100);
        tech(t, 1, "Lockdown", TERRAN, 200, 200);
        tech(t, 2, "EMP Shockwave", TERRAN, 200, 200);
        tech(t, 3, "Spider Mines", TERRAN, 100, 100);
        tech(t, 5, "Tank Siege Mode", TERRAN, 150, 150);
        tech(t, 7, "Irradiate", TERRAN, 200, 200);
        tech(t, 8, "Yamato Gun", TERRAN, 100, 100);
        tech(t, 9, "Cloaking Field", TERRAN, 150, 150);
        tech(t, 10, "Personnel Cloaking", TERRAN, 100, 100);
        tech(t, 11, "Burrowing", ZERG, 100, 100);
        tech(t, 13, "Spawn Broodlings", ZERG, 100, 100);
        tech(t, 15, "Plague", ZERG, 200, 200);
        tech(t, 16, "Consume", ZERG, 100, 100);
        tech(t, 17, "Ensnare", ZERG, 100, 100);
        tech(t, 19, "Psionic Storm", PROTOSS, 200, 200);
        tech(t, 20, "Hallucination", PROTOSS, 150, 150);
        tech(t, 21, "Recall", PROTOSS, 150, 150);
        tech(t, 22, "Stasis Field", PROTOSS, 150, 150);
        tech(t, 24, "Restoration", TERRAN, 100, 100);
        tech(t, 25, "Disruption Web", PROTOSS, 200, 200);
        tech(t, 27, "Mind Control", PROTOSS, 200, 200);
        tech(t, 30, "Optical Flare", TERRAN, 100, 100);
        tech(t, 31, "Maelstrom", PROTOSS, 100, 100);
        tech(t, 32, "Lurker Aspect", ZERG, 200, 200);
        TECHS = Collections.unmodifiableMap(t);

        final Map<Integer, EntityDescriptor> g = new TreeMap<>();
        upgrade(g, 0, "Terran Infantry Armor", TERRAN, 100, 100);
        upgrade(g, 1, "Terran Vehicle Plating", TERRAN, 100, 100);
        upgrade(g, 2, "Terran Ship Plating", TERRAN, 150, 150);
        upgrade(g, 3, "Zerg Carapace", ZERG, 150, 150);
        upgrade(g, 4, "Zerg Flyer Carapace", ZERG, 150, 150);
        upgrade(g, 5, "Protoss Ground Armor", PROTOSS, 100, 100);
        upgrade(g, 6, "Protoss Air Armor", PROTOSS, 150, 150);
        upgrade(g, 7, "Terran Infantry Weapons", TERRAN, 100, 100);
        upgrade(g, 8, "Terran Vehicle Weapons", TERRAN, 100, 100);
        upgrade(g, 9, "Terran Ship Weapons", TERRAN, 100, 100);
        upgrade(g, 10, "Zerg Melee Attacks", ZERG, 100, 100);
        upgrade(g, 11, "Zerg Missile Attacks", ZERG, 100, 100);
        upgrade(g, 12, "Zerg Flyer Attacks", ZERG, 100, 100);
        upgrade(g, 13, "Protoss Ground Weapons", PROTOSS, 100, 100);
        upgrade(g, 14, "Protoss Air Weapons", PROTOSS, 100, 100);
        upgrade(g, 15, "Protoss Plasma Shields", PROTOSS, 200, 200);
        upgrade(g, 16, "U-238 Shells", TERRAN, 150, 150);
        upgrade(g, 17, "Ion Thrusters", TERRAN, 100, 100);
        upgrade(g, 19, "Titan Reactor", TERRAN, 150, 150);
        upgrade(g, 22, "Ocular Implants", TERRAN, 100, 100);
        upgrade(g, 24, "Apollo Reactor", TERRAN, 200, 200);
        upgrade(g, 25, "Colossus Reactor", TERRAN, 150, 150);
        upgrade(g, 27, "Ventral Sacs", ZERG, 200, 200);
        upgrade(g, 28, "Antennae", ZERG, 150, 150);
        upgrade(g, 29, "Pneumatized Carapace", ZERG, 150, 150);
        upgrade(g, 30, "Metabolic Boost", ZERG, 100, 100);
        upgrade(g, 31, "Adrenal Glands", ZERG, 200, 200);
        upgrade(g, 32, "Muscular Augments", ZERG, 150, 150);
        upgrade(g, 33, "Grooved Spines", ZERG, 150, 150);
        upgrade(g, 34, "Gamete Meiosis", ZERG, 150, 150);
        upgrade(g, 35, "Metasynaptic Node", ZERG, 150, 150);
        upgrade(g, 36, "Singularity Charge", PROTOSS, 150, 150);
        upgrade(g, 37, "Leg Enhancements", PROTOSS, 150, 150);
        upgrade(g, 38, "Scarab Damage", PROTOSS, 200, 200);
        upgrade(g, 39, "Reaver Capacity", PROTOSS, 200, 200);
        upgrade(g, 40, "Gravitic Drive", PROTOSS, 200, 200);
        upgrade(g, 41, "Sensor Array", PROTOSS, 150, 150);
        upgrade(g, 42, "Gravitic Boosters", PROTOSS, 150, 150);
        upgrade(g, 43, "Khaydarin Amulet", PROTOSS, 150, 150);
        upgrade(g, 44, "Apial Sensors", PROTOSS, 100, 100);
        upgrade(g, 45, "Gravitic Thrusters", PROTOSS, 200, 200);
        upgrade(g, 46, "Carrier Capacity", PROTOSS, 100, 100);
        upgrade(g, 47, "Khaydarin Core", PROTOSS, 150, 150);
        upgrade(g, 51, "Argus Jewel", PROTOSS, 100, 100);
        upgrade(g, 52, "Argus Talisman", PROTOSS, 150, 150);
        upgrade(g, 54, "Caduceus Reactor", TERRAN, 150, 150);
        UPGRADES = Collections.unmodifiableMap(g);
    }

    private EntityCatalog() {}

    /**
     * Looks up a unit or building by unit type id.
     */
    public static Optional<EntityDescriptor> lookup(int id)
    {
        return Optional.ofNullable(UNITS.get(id));
    }

    public static Optional<EntityDescriptor> lookupTech(int id)
    {
        return Optional.ofNullable(TECHS.get(id));
    }

    public static Optional<EntityDescriptor> lookupUpgrade(int id)
    {
        return Optional.ofNullable(UPGRADES.get(id));
    }

    /**
     * Looks up an id in the id space of {@code kind}; units and buildings share one.
     */
    public static Optional<EntityDescriptor> lookup(EntityKind kind, int id)
    {
        return switch (kind) {
            case UNIT, BUILDING -> lookup(id).filter(e -> e.kind() == kind);
            case TECH -> lookupTech(id);
            case UPGRADE -> lookupUpgrade(id);
        };
    }

    /**
     * Looks up an entity by exact name within an id space.
     */
    public static Optional<EntityDescriptor> byName(EntityKind kind, String name)
    {
        final Map<Integer, EntityDescriptor> table = switch (kind) {
            case UNIT, BUILDING -> UNITS;
            case TECH -> TECHS;
            case UPGRADE -> UPGRADES;
        };
        return table.values().stream()
                .filter(e -> e.kind() == kind && e.name().equals(name))
                .findFirst();
    }

    private static void unit(Map<Integer, EntityDescriptor> m, int id, String name, Race race,
                             EntityCategory category, int minerals, int gas, int supply)
    {
        m.put(id, new EntityDescriptor(id, name, race, EntityKind.UNIT, category,
                new Cost(minerals, gas, supply), 0));
    }

    private static void supplyUnit(Map<Integer, EntityDescriptor> m, int id, String name, Race race,
                                   int minerals, int provides)
    {
        m.put(id, new EntityDescriptor(id, name, race, EntityKind.UNIT, SUPPLY,
                new Cost(minerals, 0, 0), provides));
    }

    private static void building(Map<Integer, EntityDescriptor> m, int id, String name, Race race,
                                 EntityCategory category, int minerals, int gas)
    {
        m.put(id, new EntityDescriptor(id, name, race, EntityKind.BUILDING, category,
                new Cost(minerals, gas, 0), 0));
    }

    private static void supplyBuilding(Map<Integer, EntityDescriptor> m, int id, String name, Race race,
                                       EntityCategory category, int minerals, int gas, int provides)
    {
        m.put(id, new EntityDescriptor(id, name, race, EntityKind.BUILDING, category,
                new Cost(minerals, gas, 0), provides));
    }

    private static void tech(Map<Integer, EntityDescriptor> m, int id, String name, Race race,
                             int minerals, int gas)
    {
        m.put(id, new EntityDescriptor(id, name, race, EntityKind.TECH, EntityCategory.TECH,
                new Cost(minerals, gas, 0), 0));
    }

    private static void upgrade(Map<Integer, EntityDescriptor> m, int id, String name, Race race,
                                int minerals, int gas)
    {
        m.put(id, new EntityDescriptor(id, name, race, EntityKind.UPGRADE, EntityCategory.TECH,
                new Cost(minerals, gas, 0), 0));
    }
}
