package com.questrail.replay.catalog;

/**
 * Resource cost of producing an entity.
 *
 * @param minerals primary resource
 * @param gas      secondary resource
 * @param supply   supply consumed
 */
public record Cost(int minerals, int gas, int supply)
{
    public static final Cost FREE = new Cost(0, 0, 0);

    public Cost {
        if (minerals < 0 || gas < 0 || supply < 0) {
            throw new IllegalArgumentException("cost components must be non-negative");
        }
    }
}
