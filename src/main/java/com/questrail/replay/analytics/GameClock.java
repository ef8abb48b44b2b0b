package com.questrail.replay.analytics;

/**
 * Frame to game-time conversion at the fixed replay frame rate.
 */
public final class GameClock
{
    public static final int FRAMES_PER_SECOND = 24;

    private GameClock() {}

    /**
     * Game length in minutes: {@code frames / 24 / 60}.
     */
    public static double minutes(long frames)
    {
        return frames / (double) FRAMES_PER_SECOND / 60.0;
    }

    public static long seconds(long frame)
    {
        return frame / FRAMES_PER_SECOND;
    }

    /**
     * Formats a frame as {@code m:ss}.
     */
    public static String format(long frame)
    {
        final long total = seconds(Math.max(0, frame));
        return String.format("%d:%02d", total / 60, total % 60);
    }
}
