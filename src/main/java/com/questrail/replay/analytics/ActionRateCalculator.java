package com.questrail.replay.analytics;

/**
 * Actions-per-minute arithmetic.
 */
final class ActionRateCalculator
{
    private ActionRateCalculator() {}

    /**
     * {@code round(actions / minutes)}, or {@code 0} for a zero-length game.
     */
    static int perMinute(int actions, long frames)
    {
        final double minutes = GameClock.minutes(frames);
        if (minutes <= 0.0) {
            return 0;
        }
        return (int) Math.round(actions / minutes);
    }
}
