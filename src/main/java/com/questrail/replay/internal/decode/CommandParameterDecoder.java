package com.questrail.replay.internal.decode;

import com.questrail.replay.catalog.ParameterShape;
import com.questrail.replay.model.CommandParameters;

/**
 * Maps the fixed-length parameter bytes of a command onto its
 * {@link CommandParameters} variant.
 *
 * <p>Layouts (all integers little-endian):</p>
 * <ul>
 *   <li>{@code PLACEMENT}: x u16, y u16, unit type u16</li>
 *   <li>{@code ENTITY}: unit type u16</li>
 *   <li>{@code TECH}, {@code UPGRADE}: id u8</li>
 *   <li>{@code TARGET}: x u16, y u16, target unit u16</li>
 *   <li>{@code SELECTION}: count u8, unit type u16</li>
 *   <li>{@code HOTKEY}: action u8, group u8</li>
 * </ul>
 *
 * <p>Bytes that are too short for the declared shape are kept as
 * {@link CommandParameters.Raw}.</p>
 */
final class CommandParameterDecoder
{
    private CommandParameterDecoder() {}

    static CommandParameters decode(ParameterShape shape, byte[] p)
    {
        return switch (shape) {
            case PLACEMENT -> p.length >= 6
                    ? new CommandParameters.Placement(u16(p, 4), u16(p, 0), u16(p, 2))
                    : new CommandParameters.Raw(p);
            case ENTITY -> p.length >= 2
                    ? new CommandParameters.EntityOrder(u16(p, 0))
                    : new CommandParameters.Raw(p);
            case TECH -> p.length >= 1
                    ? new CommandParameters.TechOrder(u8(p, 0))
                    : new CommandParameters.Raw(p);
            case UPGRADE -> p.length >= 1
                    ? new CommandParameters.UpgradeOrder(u8(p, 0))
                    : new CommandParameters.Raw(p);
            case TARGET -> p.length >= 6
                    ? new CommandParameters.TargetOrder(u16(p, 0), u16(p, 2), u16(p, 4))
                    : new CommandParameters.Raw(p);
            case SELECTION -> p.length >= 3
                    ? new CommandParameters.Selection(u8(p, 0), u16(p, 1))
                    : new CommandParameters.Raw(p);
            case HOTKEY -> p.length >= 2
                    ? new CommandParameters.Hotkey(u8(p, 0), u8(p, 1))
                    : new CommandParameters.Raw(p);
            case CHAT, RAW -> p.length == 0 ? CommandParameters.Raw.EMPTY : new CommandParameters.Raw(p);
        };
    }

    private static int u8(byte[] p, int i)
    {
        return p[i] & 0xFF;
    }

    private static int u16(byte[] p, int i)
    {
        return (p[i] & 0xFF) | ((p[i + 1] & 0xFF) << 8);
    }
}
