package com.questrail.replay.catalog;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static com.questrail.replay.catalog.CommandCategory.*;
import static com.questrail.replay.catalog.ParameterShape.*;

/**
 * OpcodeCatalog
 * -----------------------------------------------------------------------------
 * Immutable table of command stream opcodes.
 *
 * <p>Bytes {@code 0x00} to {@code 0x03} are frame-advance markers and are not
 * opcodes; they never appear in this table.</p>
 */
public final class OpcodeCatalog
{
    public static final int CHAT = 0x5C;

    private static final Map<Integer, OpcodeDescriptor> OPCODES;

    static {
        final Map<Integer, OpcodeDescriptor> m = new TreeMap<>();

        put(m, 0x05, "Keep Alive", 0, false, NETWORK, RAW);
        put(m, 0x08, "Restart Game", 0, false, OTHER, RAW);
        put(m, 0x09, "Select", 3, false, CommandCategory.SELECTION, ParameterShape.SELECTION);
        put(m, 0x0A, "Shift Select", 3, false, CommandCategory.SELECTION, ParameterShape.SELECTION);
        put(m, 0x0B, "Shift Deselect", 3, false, CommandCategory.SELECTION, ParameterShape.SELECTION);
        put(m, 0x0C, "Build", 6, true, BUILD, PLACEMENT);
        put(m, 0x0D, "Vision", 2, false, OTHER, RAW);
        put(m, 0x0E, "Alliance", 4, false, OTHER, RAW);
        put(m, 0x0F, "Game Speed", 1, false, OTHER, RAW);
        put(m, 0x10, "Pause", 0, false, OTHER, RAW);
        put(m, 0x11, "Resume", 0, false, OTHER, RAW);
        put(m, 0x12, "Cheat", 4, false, OTHER, RAW);
        put(m, 0x13, "Hotkey", 2, false, CommandCategory.HOTKEY, ParameterShape.HOTKEY);
        put(m, 0x14, "Move", 6, true, MICRO, TARGET);
        put(m, 0x15, "Attack", 6, true, MICRO, TARGET);
        put(m, 0x16, "Cancel", 0, true, MACRO, RAW);
        put(m, 0x17, "Cancel Hatch", 0, true, MACRO, RAW);
        put(m, 0x18, "Stop", 1, true, MICRO, RAW);
        put(m, 0x19, "Carrier Stop", 0, true, MICRO, RAW);
        put(m, 0x1A, "Reaver Stop", 0, true, MICRO, RAW);
        put(m, 0x1B, "Order Nothing", 0, false, OTHER, RAW);
        put(m, 0x1C, "Return Cargo", 1, true, MICRO, RAW);
        put(m, 0x1D, "Train", 2, true, TRAIN, ENTITY);
        put(m, 0x1E, "Cancel Train", 2, true, MACRO, RAW);
        put(m, 0x1F, "Cloak", 1, true, MICRO, RAW);
        put(m, 0x20, "Decloak", 1, true, MICRO, RAW);
        put(m, 0x21, "Unit Morph", 2, true, MORPH, ENTITY);
        put(m, 0x23, "Unsiege", 1, true, MICRO, RAW);
        put(m, 0x24, "Siege", 1, true, MICRO, RAW);
        put(m, 0x25, "Train Fighter", 0, true, MACRO, RAW);
        put(m, 0x27, "Unload All", 1, true, MICRO, RAW);
        put(m, 0x28, "Unload", 2, true, MICRO, RAW);
        put(m, 0x29, "Merge Archon", 0, true, MICRO, RAW);
        put(m, 0x2A, "Hold Position", 1, true, MICRO, RAW);
        put(m, 0x2B, "Burrow", 1, true, MICRO, RAW);
        put(m, 0x2C, "Unburrow", 1, true, MICRO, RAW);
        put(m, 0x2D, "Cancel Nuke", 0, true, MACRO, RAW);
        put(m, 0x2E, "Lift", 4, true, MICRO, RAW);
        put(m, 0x2F, "Research", 1, true, RESEARCH, TECH);
        put(m, 0x30, "Cancel Research", 0, true, MACRO, RAW);
        put(m, 0x31, "Upgrade", 1, true, CommandCategory.UPGRADE, ParameterShape.UPGRADE);
        put(m, 0x32, "Cancel Upgrade", 0, true, MACRO, RAW);
        put(m, 0x33, "Cancel Addon", 0, true, MACRO, RAW);
        put(m, 0x34, "Building Morph", 2, true, MORPH, ENTITY);
        put(m, 0x35, "Stim", 0, true, MICRO, RAW);
        put(m, 0x36, "Sync", 6, false, NETWORK, RAW);
        put(m, 0x37, "Voice Enable 1", 1, false, NETWORK, RAW);
        put(m, 0x38, "Voice Enable 2", 1, false, NETWORK, RAW);
        put(m, 0x39, "Voice Squelch 1", 1, false, NETWORK, RAW);
        put(m, 0x3A, "Voice Squelch 2", 1, false, NETWORK, RAW);
        put(m, 0x3B, "Start Game", 0, false, NETWORK, RAW);
        put(m, 0x3C, "Download Percentage", 1, false, NETWORK, RAW);
        put(m, 0x3D, "Change Game Slot", 5, false, NETWORK, RAW);
        put(m, 0x3E, "New Net Player", 7, false, NETWORK, RAW);
        put(m, 0x3F, "Joined Game", 17, false, NETWORK, RAW);
        put(m, 0x40, "Change Race", 1, false, NETWORK, RAW);
        put(m, 0x41, "Team Game Team", 1, false, NETWORK, RAW);
        put(m, 0x42, "UMS Team", 1, false, NETWORK, RAW);
        put(m, 0x43, "Melee Team", 1, false, NETWORK, RAW);
        put(m, 0x44, "Swap Players", 2, false, NETWORK, RAW);
        put(m, 0x45, "Saved Data", 12, false, NETWORK, RAW);
        put(m, 0x48, "Load Game", 10, false, NETWORK, RAW);
        put(m, 0x57, "Leave Game", 1, false, NETWORK, RAW);
        put(m, 0x58, "Minimap Ping", 4, false, OTHER, RAW);
        put(m, 0x5A, "Merge Dark Archon", 0, true, MICRO, RAW);
        put(m, 0x5B, "Make Game Public", 0, false, NETWORK, RAW);
        put(m, CHAT, "Chat", OpcodeDescriptor.VARIABLE_LENGTH, false, CommandCategory.CHAT, ParameterShape.CHAT);

        OPCODES = Collections.unmodifiableMap(m);
    }

    private OpcodeCatalog() {}

    public static Optional<OpcodeDescriptor> lookup(int opcode)
    {
        return Optional.ofNullable(OPCODES.get(opcode & 0xFF));
    }

    public static boolean isKnown(int opcode)
    {
        return OPCODES.containsKey(opcode & 0xFF);
    }

    public static Map<Integer, OpcodeDescriptor> all()
    {
        return OPCODES;
    }

    private static void put(Map<Integer, OpcodeDescriptor> m,
                            int opcode,
                            String name,
                            int parameterLength,
                            boolean effective,
                            CommandCategory category,
                            ParameterShape shape)
    {
        m.put(opcode, new OpcodeDescriptor(opcode, name, parameterLength, effective, category, shape));
    }
}
