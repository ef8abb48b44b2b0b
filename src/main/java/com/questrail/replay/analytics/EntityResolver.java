package com.questrail.replay.analytics;

import com.questrail.replay.catalog.EntityCatalog;
import com.questrail.replay.catalog.EntityDescriptor;
import com.questrail.replay.catalog.EntityKind;
import com.questrail.replay.model.BuildAction;
import com.questrail.replay.model.BuildOrderEntry;
import com.questrail.replay.model.Command;
import com.questrail.replay.model.CommandParameters;
import com.questrail.replay.model.Race;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * EntityResolver
 * -----------------------------------------------------------------------------
 * Finds the entity a build-order command acts on.
 *
 * <p>Resolution tiers, tried in order:</p>
 * <ol>
 *   <li><b>direct</b> ({@value BuildOrderEntry#DIRECT_CONFIDENCE}): the
 *       entity field of the decoded parameters</li>
 *   <li><b>opcode-name</b> ({@value #OPCODE_NAME_CONFIDENCE}): a numeric id
 *       embedded in the opcode name</li>
 *   <li><b>sibling-parameter</b> ({@value #SIBLING_CONFIDENCE}): another
 *       numeric parameter that is a known id of the expected kind</li>
 *   <li><b>inferred</b> ({@value BuildOrderEntry#INFERRED_CONFIDENCE}): a
 *       probable entity for the player's race and the game phase; never used
 *       for a random-race player</li>
 * </ol>
 */
final class EntityResolver
{
    static final int OPCODE_NAME_CONFIDENCE = 75;
    static final int SIBLING_CONFIDENCE = 45;

    static final String DIRECT = "direct";
    static final String OPCODE_NAME = "opcode-name";
    static final String SIBLING = "sibling-parameter";
    static final String INFERRED = "inferred";

    /** End of the opening phase, 3:00 game time. */
    static final long EARLY_GAME_END = 3L * 60 * GameClock.FRAMES_PER_SECOND;
    /** End of the mid game, 10:00 game time. */
    static final long MID_GAME_END = 10L * 60 * GameClock.FRAMES_PER_SECOND;

    private static final Pattern EMBEDDED_ID = Pattern.compile("0x([0-9A-Fa-f]+)|(\\d+)");

    // Probable entity per race, action and phase (early, mid, late)
    private static final Map<Race, Map<BuildAction, List<Integer>>> PROBABLE = Map.of(
            Race.TERRAN, Map.of(
                    BuildAction.BUILD, List.of(109, 111, 113),
                    BuildAction.TRAIN, List.of(7, 0, 5)),
            Race.PROTOSS, Map.of(
                    BuildAction.BUILD, List.of(156, 160, 164),
                    BuildAction.TRAIN, List.of(64, 65, 66)),
            Race.ZERG, Map.of(
                    BuildAction.BUILD, List.of(142, 149, 135),
                    BuildAction.TRAIN, List.of(41, 37, 38),
                    BuildAction.MORPH, List.of(41, 37, 38)));

    record Resolved(EntityDescriptor entity, int confidence, String method) {}

    private EntityResolver() {}

    static Optional<Resolved> resolve(Command command, BuildAction action, Race race)
    {
        final Set<EntityKind> kinds = expectedKinds(action, command.opcode());

        final Optional<EntityDescriptor> direct = directId(command.parameters())
                .flatMap(id -> lookup(kinds, id));
        if (direct.isPresent()) {
            return Optional.of(new Resolved(direct.get(), BuildOrderEntry.DIRECT_CONFIDENCE, DIRECT));
        }

        final Optional<EntityDescriptor> named = embeddedId(command.name()).flatMap(id -> lookup(kinds, id));
        if (named.isPresent()) {
            return Optional.of(new Resolved(named.get(), OPCODE_NAME_CONFIDENCE, OPCODE_NAME));
        }

        for (int id : siblingIds(command.parameters())) {
            final Optional<EntityDescriptor> sibling = lookup(kinds, id);
            if (sibling.isPresent()) {
                return Optional.of(new Resolved(sibling.get(), SIBLING_CONFIDENCE, SIBLING));
            }
        }

        return infer(action, race, command.frame())
                .filter(e -> kinds.contains(e.kind()))
                .map(e -> new Resolved(e, BuildOrderEntry.INFERRED_CONFIDENCE, INFERRED));
    }

    /**
     * Id spaces an action may refer to. Unit morphs ({@code 0x21}) produce
     * units; building morphs produce buildings.
     */
    static Set<EntityKind> expectedKinds(BuildAction action, int opcode)
    {
        return switch (action) {
            case BUILD -> Set.of(EntityKind.BUILDING);
            case TRAIN -> Set.of(EntityKind.UNIT);
            case MORPH -> opcode == 0x21 ? Set.of(EntityKind.UNIT) : Set.of(EntityKind.BUILDING);
            case RESEARCH -> Set.of(EntityKind.TECH);
            case UPGRADE -> Set.of(EntityKind.UPGRADE);
        };
    }

    private static Optional<EntityDescriptor> lookup(Set<EntityKind> kinds, int id)
    {
        for (EntityKind kind : kinds) {
            final Optional<EntityDescriptor> entity = EntityCatalog.lookup(kind, id);
            if (entity.isPresent()) {
                return entity;
            }
        }
        return Optional.empty();
    }

    private static Optional<Integer> directId(CommandParameters parameters)
    {
        if (parameters instanceof CommandParameters.Placement placement) {
            return Optional.of(placement.entityId());
        }
        if (parameters instanceof CommandParameters.EntityOrder order) {
            return Optional.of(order.entityId());
        }
        if (parameters instanceof CommandParameters.TechOrder tech) {
            return Optional.of(tech.techId());
        }
        if (parameters instanceof CommandParameters.UpgradeOrder upgrade) {
            return Optional.of(upgrade.upgradeId());
        }
        return Optional.empty();
    }

    static Optional<Integer> embeddedId(String opcodeName)
    {
        final Matcher m = EMBEDDED_ID.matcher(opcodeName);
        if (!m.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(m.group(1) != null
                    ? Integer.parseInt(m.group(1), 16)
                    : Integer.parseInt(m.group(2)));
        }
        catch (NumberFormatException e) {
            // Digits too long for an id
            return Optional.empty();
        }
    }

    /**
     * Numeric values other than the direct field, in parameter order. Raw
     * parameters contribute every u16 and then every u8.
     */
    static List<Integer> siblingIds(CommandParameters parameters)
    {
        final List<Integer> ids = new ArrayList<>();
        if (parameters instanceof CommandParameters.Placement placement) {
            ids.add(placement.x());
            ids.add(placement.y());
        }
        else if (parameters instanceof CommandParameters.TargetOrder target) {
            ids.add(target.targetId());
        }
        else if (parameters instanceof CommandParameters.Selection selection) {
            ids.add(selection.entityType());
        }
        else if (parameters instanceof CommandParameters.Raw raw) {
            final byte[] b = raw.bytes();
            for (int i = 0; i + 1 < b.length; i++) {
                ids.add((b[i] & 0xFF) | ((b[i + 1] & 0xFF) << 8));
            }
            for (byte value : b) {
                ids.add(value & 0xFF);
            }
        }
        return ids;
    }

    static Optional<EntityDescriptor> infer(BuildAction action, Race race, long frame)
    {
        if (race == Race.RANDOM) {
            return Optional.empty();
        }
        final List<Integer> byPhase = PROBABLE.getOrDefault(race, Map.of()).get(action);
        if (byPhase == null) {
            return Optional.empty();
        }
        final int phase = frame < EARLY_GAME_END ? 0 : frame < MID_GAME_END ? 1 : 2;
        return EntityCatalog.lookup(byPhase.get(phase));
    }
}
