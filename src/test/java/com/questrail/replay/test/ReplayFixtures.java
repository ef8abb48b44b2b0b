package com.questrail.replay.test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.zip.Deflater;

/**
 * ReplayFixtures
 * -----------------------------------------------------------------------------
 * Builds synthetic replay files for tests.
 *
 * <p>A file is a twelve byte preamble, the signature at {@code 0x0C} and the
 * body from {@code 0x10}. The body follows the primary header layout: frame count at {@code 0x01},
 * game title at {@code 0x18}, map name at {@code 0x61}, an eight-slot player
 * table of 36-byte slots at {@code 0xA1} and the command section at
 * {@code 0x279}. Modern files are deflated with a zlib wrapper.</p>
 */
public final class ReplayFixtures
{
    public static final int SIGNATURE_OFFSET = 0x0C;
    public static final int BODY_OFFSET = 0x10;
    public static final int COMMAND_SECTION = 0x279;
    public static final int PLAYER_TABLE = 0xA1;
    public static final int SLOT_SIZE = 36;

    public static final int KIND_COMPUTER = 1;
    public static final int KIND_HUMAN = 2;

    public static final int RACE_ZERG = 0;
    public static final int RACE_TERRAN = 1;
    public static final int RACE_PROTOSS = 2;
    public static final int RACE_RANDOM = 6;

    private ReplayFixtures() {}

    public static Builder legacy()
    {
        return new Builder("reRS", false);
    }

    public static Builder modern()
    {
        return new Builder("seRS", true);
    }

    /**
     * Two human players, "Alice" (Terran, slot 0) and "Bob" (Protoss, slot 1),
     * on "Fighting Spirit", 14400 frames (10 minutes).
     */
    public static Builder twoPlayerGame(Builder builder)
    {
        return builder
                .frames(14_400)
                .title("Friendly match")
                .host("Alice")
                .mapName("Fighting Spirit")
                .gameType(0x02)
                .player(0, "Alice", RACE_TERRAN, KIND_HUMAN)
                .player(1, "Bob", RACE_PROTOSS, KIND_HUMAN);
    }

    /**
     * Preamble and signature of a file: section checksum {@code 0}, one chunk
     * of four bytes, then {@code signature}.
     */
    public static byte[] fileStart(String signature)
    {
        final byte[] start = new byte[BODY_OFFSET];
        start[0x04] = 1;
        start[0x08] = 4;
        final byte[] sig = signature.getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(sig, 0, start, SIGNATURE_OFFSET, Math.min(sig.length, 4));
        return start;
    }

    /**
     * A file with the given signature whose body is {@code body}, unchanged.
     */
    public static byte[] file(String signature, byte[] body)
    {
        final byte[] start = fileStart(signature);
        final byte[] out = new byte[start.length + body.length];
        System.arraycopy(start, 0, out, 0, start.length);
        System.arraycopy(body, 0, out, start.length, body.length);
        return out;
    }

    public static byte[] zlib(byte[] data)
    {
        final Deflater deflater = new Deflater(Deflater.DEFAULT_COMPRESSION, false);
        try {
            deflater.setInput(data);
            deflater.finish();
            final ByteArrayOutputStream out = new ByteArrayOutputStream();
            final byte[] chunk = new byte[4096];
            while (!deflater.finished()) {
                final int n = deflater.deflate(chunk);
                out.write(chunk, 0, n);
            }
            return out.toByteArray();
        }
        finally {
            deflater.end();
        }
    }

    public static final class Builder
    {
        private final String signature;
        private final boolean compress;
        private final byte[] header = new byte[COMMAND_SECTION];
        private final ByteArrayOutputStream commands = new ByteArrayOutputStream();
        private int tableBase = PLAYER_TABLE;
        private int slotSize = SLOT_SIZE;
        private byte[] prologPrefix = new byte[0];

        private Builder(String signature, boolean compress)
        {
            this.signature = signature;
            this.compress = compress;
            header[0] = 1;
        }

        public Builder frames(long frames)
        {
            return u32(0x01, frames);
        }

        public Builder title(String title)
        {
            return text(0x18, title, 28);
        }

        public Builder host(String host)
        {
            return text(0x48, host, 24);
        }

        public Builder mapName(String name)
        {
            return text(0x61, name, 26);
        }

        public Builder gameType(int code)
        {
            header[0x3C] = (byte) code;
            header[0x3D] = (byte) (code >>> 8);
            return this;
        }

        /**
         * Moves the player table; slots written afterwards use the new layout.
         */
        public Builder playerTable(int base, int slotSize)
        {
            this.tableBase = base;
            this.slotSize = slotSize;
            return this;
        }

        public Builder player(int slot, String name, int race, int kind)
        {
            final int offset = tableBase + slot * slotSize;
            header[offset] = (byte) slot;
            header[offset + 0x04] = (byte) slot;
            header[offset + 0x05] = (byte) slot;
            header[offset + 0x08] = (byte) kind;
            header[offset + 0x09] = (byte) race;
            header[offset + 0x0A] = (byte) (slot + 1);
            return text(offset + 0x0B, name, Math.min(25, slotSize - 0x0B));
        }

        /**
         * Writes raw bytes anywhere in the header area.
         */
        public Builder headerBytes(int offset, byte... bytes)
        {
            System.arraycopy(bytes, 0, header, offset, bytes.length);
            return this;
        }

        public Builder u32(int offset, long value)
        {
            header[offset] = (byte) value;
            header[offset + 1] = (byte) (value >>> 8);
            header[offset + 2] = (byte) (value >>> 16);
            header[offset + 3] = (byte) (value >>> 24);
            return this;
        }

        public Builder text(int offset, String value, int width)
        {
            final byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
            for (int i = 0; i < width; i++) {
                header[offset + i] = i < bytes.length ? bytes[i] : 0;
            }
            return this;
        }

        public Builder commands(byte... bytes)
        {
            commands.write(bytes, 0, bytes.length);
            return this;
        }

        public Builder commands(CommandBytes bytes)
        {
            return commands(bytes.toByteArray());
        }

        /**
         * Bytes placed between the signature and the compressed stream.
         */
        public Builder prologPrefix(byte... bytes)
        {
            this.prologPrefix = bytes.clone();
            return this;
        }

        /**
         * The uncompressed body: header area followed by the command section.
         */
        public byte[] body()
        {
            final ByteArrayOutputStream out = new ByteArrayOutputStream();
            out.write(header, 0, header.length);
            final byte[] cmds = commands.toByteArray();
            out.write(cmds, 0, cmds.length);
            return out.toByteArray();
        }

        public byte[] build()
        {
            final ByteArrayOutputStream out = new ByteArrayOutputStream();
            final byte[] start = fileStart(signature);
            out.write(start, 0, start.length);
            final byte[] payload = compress ? zlib(body()) : body();
            out.write(prologPrefix, 0, prologPrefix.length);
            out.write(payload, 0, payload.length);
            return out.toByteArray();
        }
    }

    /**
     * Command section writer.
     */
    public static final class CommandBytes
    {
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();

        public static CommandBytes stream()
        {
            return new CommandBytes();
        }

        public CommandBytes raw(int... bytes)
        {
            for (int b : bytes) {
                out.write(b);
            }
            return this;
        }

        public CommandBytes frameStep(int count)
        {
            for (int i = 0; i < count; i++) {
                out.write(0x00);
            }
            return this;
        }

        public CommandBytes skip8(int frames)
        {
            return raw(0x01, frames);
        }

        public CommandBytes skip16(int frames)
        {
            return raw(0x02, frames & 0xFF, (frames >>> 8) & 0xFF);
        }

        public CommandBytes skip32(long frames)
        {
            return raw(0x03, (int) (frames & 0xFF), (int) ((frames >>> 8) & 0xFF),
                    (int) ((frames >>> 16) & 0xFF), (int) ((frames >>> 24) & 0xFF));
        }

        public CommandBytes train(int player, int unitId)
        {
            return raw(0x1D, player, unitId & 0xFF, unitId >>> 8);
        }

        public CommandBytes unitMorph(int player, int unitId)
        {
            return raw(0x21, player, unitId & 0xFF, unitId >>> 8);
        }

        public CommandBytes build(int player, int buildingId, int x, int y)
        {
            return raw(0x0C, player, x & 0xFF, x >>> 8, y & 0xFF, y >>> 8, buildingId & 0xFF, buildingId >>> 8);
        }

        public CommandBytes research(int player, int techId)
        {
            return raw(0x2F, player, techId);
        }

        public CommandBytes upgrade(int player, int upgradeId)
        {
            return raw(0x31, player, upgradeId);
        }

        public CommandBytes move(int player, int x, int y)
        {
            return raw(0x14, player, x & 0xFF, x >>> 8, y & 0xFF, y >>> 8, 0, 0);
        }

        public CommandBytes select(int player, int count, int unitType)
        {
            return raw(0x09, player, count, unitType & 0xFF, unitType >>> 8);
        }

        public CommandBytes hotkey(int player, int action, int group)
        {
            return raw(0x13, player, action, group);
        }

        public CommandBytes chat(int player, int sender, String message)
        {
            raw(0x5C, player, sender);
            final byte[] bytes = message.getBytes(StandardCharsets.UTF_8);
            out.write(bytes, 0, bytes.length);
            out.write(0);
            return this;
        }

        public byte[] toByteArray()
        {
            return out.toByteArray();
        }
    }
}
