package com.questrail.replay.catalog;

/**
 * Layout of an opcode's parameter bytes (after the player byte).
 *
 * <ul>
 *   <li>{@code PLACEMENT}: entity u16, x u16, y u16</li>
 *   <li>{@code ENTITY}: entity u16</li>
 *   <li>{@code TECH}, {@code UPGRADE}: id u8</li>
 *   <li>{@code TARGET}: x u16, y u16, target u16</li>
 *   <li>{@code SELECTION}: count u8, entity type u16</li>
 *   <li>{@code HOTKEY}: action u8, group u8</li>
 *   <li>{@code CHAT}: variable length text</li>
 *   <li>{@code RAW}: kept undecoded</li>
 * </ul>
 */
public enum ParameterShape
{
    PLACEMENT,
    ENTITY,
    TECH,
    UPGRADE,
    TARGET,
    SELECTION,
    HOTKEY,
    CHAT,
    RAW
}
