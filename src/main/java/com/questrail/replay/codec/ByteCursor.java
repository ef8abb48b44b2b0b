package com.questrail.replay.codec;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * ByteCursor
 * -----------------------------------------------------------------------------
 * Bounds-checked little-endian reader over an immutable byte buffer.
 *
 * <p>The cursor owns a private copy of the input, exposed through a read-only
 * Netty {@link ByteBuf}; the only mutable state is the read position. Every
 * moving read either succeeds completely or throws
 * {@link BufferUnderrunException} and leaves the position untouched.</p>
 *
 * <p>The {@code *At} accessors read at an absolute position without moving
 * the cursor and report a short buffer as an empty optional. Header decoding
 * uses those; the command loop uses the moving reads.</p>
 *
 * <h2>Netty containment</h2>
 * {@code ByteBuf} never escapes this class. The buffer is an unpooled heap
 * buffer, so no reference counting is required.
 */
public final class ByteCursor
{
    private final ByteBuf buffer;
    private final int length;

    public ByteCursor(byte[] data)
    {
        final byte[] copy = (data == null) ? new byte[0] : data.clone();
        this.buffer = Unpooled.wrappedBuffer(copy).asReadOnly();
        this.length = copy.length;
    }

    // ========================================================================
    // Position
    // ========================================================================

    public int position()
    {
        return buffer.readerIndex();
    }

    public int length()
    {
        return length;
    }

    public int remaining()
    {
        return buffer.readableBytes();
    }

    /**
     * Pure predicate: true if {@code n} more bytes can be read.
     */
    public boolean canRead(int n)
    {
        return n >= 0 && buffer.readableBytes() >= n;
    }

    /**
     * Moves the cursor to {@code pos}, clamped to {@code [0, length]}.
     */
    public ByteCursor seek(int pos)
    {
        buffer.readerIndex(clamp(pos));
        return this;
    }

    /**
     * Advances by {@code n} bytes, clamped to the end of the buffer.
     */
    public ByteCursor skip(int n)
    {
        return seek(position() + Math.max(0, n));
    }

    // ========================================================================
    // Moving reads
    // ========================================================================

    public int readU8() throws BufferUnderrunException
    {
        require(1);
        return buffer.readUnsignedByte();
    }

    public int readU16LE() throws BufferUnderrunException
    {
        require(2);
        return buffer.readUnsignedShortLE();
    }

    public long readU32LE() throws BufferUnderrunException
    {
        require(4);
        return buffer.readUnsignedIntLE();
    }

    public byte[] readBytes(int n) throws BufferUnderrunException
    {
        require(n);
        final byte[] out = new byte[n];
        buffer.readBytes(out);
        return out;
    }

    /**
     * Reads {@code n} bytes, truncates at the first zero byte and decodes the
     * rest with {@link ReplayText#decodePermissive(byte[])}.
     */
    public String readFixedString(int n) throws BufferUnderrunException
    {
        return ReplayText.decodePermissive(readBytes(n));
    }

    /**
     * Returns the next byte without consuming it.
     */
    public OptionalInt peekU8()
    {
        return u8At(position());
    }

    // ========================================================================
    // Absolute, non-moving reads
    // ========================================================================

    public OptionalInt u8At(int pos)
    {
        if (!inBounds(pos, 1)) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(buffer.getUnsignedByte(pos));
    }

    public OptionalInt u16At(int pos)
    {
        if (!inBounds(pos, 2)) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(buffer.getUnsignedShortLE(pos));
    }

    public OptionalLong u32At(int pos)
    {
        if (!inBounds(pos, 4)) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(buffer.getUnsignedIntLE(pos));
    }

    public Optional<byte[]> bytesAt(int pos, int n)
    {
        if (!inBounds(pos, n)) {
            return Optional.empty();
        }
        final byte[] out = new byte[n];
        buffer.getBytes(pos, out);
        return Optional.of(out);
    }

    /**
     * Copies {@code [from, length)} out of the buffer; {@code from} is clamped.
     */
    public byte[] copyFrom(int from)
    {
        final int start = clamp(from);
        final byte[] out = new byte[length - start];
        buffer.getBytes(start, out);
        return out;
    }

    private boolean inBounds(int pos, int n)
    {
        return pos >= 0 && n >= 0 && (long) pos + n <= length;
    }

    private void require(int n) throws BufferUnderrunException
    {
        if (n < 0 || buffer.readableBytes() < n) {
            throw new BufferUnderrunException(position(), n, buffer.readableBytes());
        }
    }

    private int clamp(int pos)
    {
        return Math.max(0, Math.min(pos, length));
    }

    @Override
    public String toString()
    {
        return "ByteCursor[position=" + position() + ", length=" + length + ']';
    }
}
