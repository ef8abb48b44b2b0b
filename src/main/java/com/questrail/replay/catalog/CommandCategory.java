package com.questrail.replay.catalog;

import com.questrail.replay.model.BuildAction;

import java.util.Optional;

/**
 * Coarse grouping of opcodes.
 *
 * <p>The first five categories are build order steps; the rest only matter
 * for action counting.</p>
 */
public enum CommandCategory
{
    BUILD,
    TRAIN,
    MORPH,
    RESEARCH,
    UPGRADE,
    MICRO,
    MACRO,
    SELECTION,
    HOTKEY,
    CHAT,
    NETWORK,
    OTHER;

    /**
     * Returns the build order action this category represents, if any.
     */
    public Optional<BuildAction> buildAction()
    {
        return switch (this) {
            case BUILD -> Optional.of(BuildAction.BUILD);
            case TRAIN -> Optional.of(BuildAction.TRAIN);
            case MORPH -> Optional.of(BuildAction.MORPH);
            case RESEARCH -> Optional.of(BuildAction.RESEARCH);
            case UPGRADE -> Optional.of(BuildAction.UPGRADE);
            default -> Optional.empty();
        };
    }
}
