package com.questrail.replay.internal.decode;

import com.questrail.replay.catalog.OpcodeCatalog;
import com.questrail.replay.catalog.OpcodeDescriptor;
import com.questrail.replay.codec.BufferUnderrunException;
import com.questrail.replay.codec.ByteCursor;
import com.questrail.replay.codec.ReplayText;
import com.questrail.replay.config.ChatTerminationRule;
import com.questrail.replay.config.ReplayDecoderConfig;
import com.questrail.replay.model.Command;
import com.questrail.replay.model.CommandParameters;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * CommandStreamDecoder
 * ============================================================================
 * Walks the command section of a replay body.
 *
 * <h2>Stream grammar</h2>
 * The section is a sequence of single-byte tags:
 * <ul>
 *   <li>{@code 0x00}: advance the frame counter by one</li>
 *   <li>{@code 0x01}, {@code 0x02}, {@code 0x03}: advance by the following
 *       u8, u16 or u32 skip count</li>
 *   <li>any other byte: an opcode, followed by the issuing player byte and
 *       the opcode's parameters</li>
 * </ul>
 *
 * <h2>Recovery</h2>
 * <ul>
 *   <li>A player byte outside {@code [0, maxSlots)} drops the record after it
 *       has been read in full.</li>
 *   <li>An unknown opcode is skipped together with the following byte when
 *       that byte could be a player byte ({@code <= maxSlots}); otherwise
 *       only the opcode byte is skipped.</li>
 *   <li>Running out of bytes inside a record ends the loop with
 *       {@code streamTruncated}.</li>
 *   <li>The iteration cap ends the loop with {@code iterationCapReached}.</li>
 * </ul>
 *
 * The frame counter only ever grows, so emitted commands have non-decreasing
 * frames. Instances hold configuration only and may be shared.
 */
public final class CommandStreamDecoder
{
    public static final int FRAME_STEP = 0x00;
    public static final int FRAME_SKIP_U8 = 0x01;
    public static final int FRAME_SKIP_U16 = 0x02;
    public static final int FRAME_SKIP_U32 = 0x03;

    private final ReplayDecoderConfig config;

    public CommandStreamDecoder(ReplayDecoderConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Decodes from the cursor's current position to the end of its buffer.
     *
     * @param cursor cursor positioned at the first byte of the command section
     * @return commands and loop statistics
     */
    public CommandStreamResult decode(ByteCursor cursor)
    {
        Objects.requireNonNull(cursor, "cursor");

        final List<Command> commands = new ArrayList<>();
        long frame = 0;
        int iterations = 0;
        int dropped = 0;
        int unknown = 0;
        boolean capReached = false;
        boolean truncated = false;

        while (cursor.remaining() > 0) {
            if (iterations >= config.iterationCap()) {
                capReached = true;
                break;
            }
            iterations++;

            try {
                final int tag = cursor.readU8();
                switch (tag) {
                    case FRAME_STEP -> frame += 1;
                    case FRAME_SKIP_U8 -> frame += cursor.readU8();
                    case FRAME_SKIP_U16 -> frame += cursor.readU16LE();
                    case FRAME_SKIP_U32 -> frame += cursor.readU32LE();
                    default -> {
                        final Optional<OpcodeDescriptor> descriptor = OpcodeCatalog.lookup(tag);
                        if (descriptor.isEmpty()) {
                            unknown++;
                            resynchronise(cursor);
                        }
                        else {
                            final Optional<Command> command = readRecord(cursor, descriptor.get(), frame);
                            if (command.isPresent()) {
                                commands.add(command.get());
                            }
                            else {
                                dropped++;
                            }
                        }
                    }
                }
            }
            catch (BufferUnderrunException e) {
                // End of stream inside a record
                truncated = true;
                break;
            }
        }

        return new CommandStreamResult(commands, dropped, unknown, frame, capReached, truncated);
    }

    private Optional<Command> readRecord(ByteCursor cursor, OpcodeDescriptor descriptor, long frame)
            throws BufferUnderrunException
    {
        final int player = cursor.readU8();
        final CommandParameters parameters = descriptor.isVariableLength()
                ? readChat(cursor)
                : CommandParameterDecoder.decode(descriptor.shape(), cursor.readBytes(descriptor.parameterLength()));

        if (player >= config.maxSlots()) {
            return Optional.empty();
        }
        return Optional.of(new Command(frame, player, descriptor.opcode(), descriptor.name(),
                parameters, descriptor.effective()));
    }

    private void resynchronise(ByteCursor cursor)
    {
        final OptionalInt next = cursor.peekU8();
        if (next.isPresent() && next.getAsInt() <= config.maxSlots()) {
            cursor.skip(1);
        }
    }

    /**
     * Sender byte followed by the message, delimited per the configured
     * {@link ChatTerminationRule}.
     */
    CommandParameters.Chat readChat(ByteCursor cursor) throws BufferUnderrunException
    {
        final int sender = cursor.readU8();
        final int cap = config.maxChatLength();

        final byte[] message = switch (config.chatTerminationRule()) {
            case NUL_TERMINATED -> readUntilNul(cursor, cap);
            case LENGTH_PREFIXED -> {
                final int length = cursor.readU8();
                final byte[] bytes = cursor.readBytes(length);
                yield bytes.length > cap ? Arrays.copyOf(bytes, cap) : bytes;
            }
            case FIXED -> cursor.readBytes(cap);
        };
        return new CommandParameters.Chat(sender, ReplayText.decodePermissive(message));
    }

    private static byte[] readUntilNul(ByteCursor cursor, int cap) throws BufferUnderrunException
    {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int i = 0; i < cap; i++) {
            final int b = cursor.readU8();
            if (b == 0) {
                break;
            }
            out.write(b);
        }
        return out.toByteArray();
    }
}
