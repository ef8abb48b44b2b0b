package com.questrail.replay.codec;

/**
 * Raised by {@link ByteCursor} when a read would run past the end of the
 * underlying buffer.
 *
 * <p>This is a checked exception: every call site must decide whether an
 * underrun is fatal (a header field that has to exist) or an ordinary
 * end-of-stream signal (the command loop).</p>
 */
public final class BufferUnderrunException extends Exception
{
    private final int position;
    private final int requested;
    private final int available;

    public BufferUnderrunException(int position, int requested, int available)
    {
        super("Buffer underrun at position " + position
                + ": requested " + requested + " byte(s), " + available + " available");
        this.position = position;
        this.requested = requested;
        this.available = available;
    }

    public int position()
    {
        return position;
    }

    public int requested()
    {
        return requested;
    }

    public int available()
    {
        return available;
    }
}
