package com.questrail.replay.model;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Decoded, opcode-specific parameters of a {@link Command}.
 *
 * <p>The variant is chosen by the opcode's parameter shape. Opcodes whose
 * parameters carry no analytic meaning keep their bytes as {@link Raw}.</p>
 */
public sealed interface CommandParameters
        permits CommandParameters.Placement,
                CommandParameters.EntityOrder,
                CommandParameters.TechOrder,
                CommandParameters.UpgradeOrder,
                CommandParameters.TargetOrder,
                CommandParameters.Selection,
                CommandParameters.Hotkey,
                CommandParameters.Chat,
                CommandParameters.Raw
{
    /** Build: structure type placed at a tile position. */
    record Placement(int entityId, int x, int y) implements CommandParameters {}

    /** Train / morph: unit type to produce. */
    record EntityOrder(int entityId) implements CommandParameters {}

    /** Research: tech id. */
    record TechOrder(int techId) implements CommandParameters {}

    /** Upgrade: upgrade id. */
    record UpgradeOrder(int upgradeId) implements CommandParameters {}

    /** Move / attack: destination and optional target unit (0 = none). */
    record TargetOrder(int x, int y, int targetId) implements CommandParameters {}

    /** Selection change: number of units and the dominant unit type. */
    record Selection(int count, int entityType) implements CommandParameters {}

    /** Hotkey: action (0 assign, 1 select, 2 add) and group number. */
    record Hotkey(int action, int group) implements CommandParameters {}

    /** Chat message. */
    record Chat(int senderSlot, String message) implements CommandParameters
    {
        public Chat {
            Objects.requireNonNull(message, "message");
        }
    }

    /** Undecoded parameter bytes. */
    record Raw(byte[] bytes) implements CommandParameters
    {
        public static final Raw EMPTY = new Raw(new byte[0]);

        public Raw {
            bytes = (bytes == null) ? new byte[0] : bytes.clone();
        }

        @Override
        public byte[] bytes()
        {
            return bytes.clone();
        }

        @Override
        public boolean equals(Object o)
        {
            if (this == o) return true;
            if (!(o instanceof Raw that)) return false;
            return Arrays.equals(bytes, that.bytes);
        }

        @Override
        public int hashCode()
        {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString()
        {
            return "Raw[" + HexFormat.of().formatHex(bytes) + ']';
        }
    }
}
