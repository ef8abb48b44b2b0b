package com.questrail.replay.model;

/**
 * Supply state of one player at a frame.
 *
 * @param frame         frame of the supply-affecting action
 * @param currentSupply supply in use
 * @param maxSupply     supply available
 * @param supplyBlocked {@code currentSupply >= maxSupply}
 */
public record SupplySnapshot(
        long frame,
        int currentSupply,
        int maxSupply,
        boolean supplyBlocked
) {
    public SupplySnapshot {
        if (currentSupply < 0) {
            throw new IllegalArgumentException("currentSupply must be non-negative");
        }
    }

    public static SupplySnapshot of(long frame, int currentSupply, int maxSupply)
    {
        return new SupplySnapshot(frame, currentSupply, maxSupply, currentSupply >= maxSupply);
    }
}
