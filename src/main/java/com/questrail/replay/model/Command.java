package com.questrail.replay.model;

import java.util.Objects;

/**
 * One player command from the command stream.
 *
 * @param frame      frame at which the command was issued
 * @param player     issuing player; a table slot while the stream is decoded,
 *                   an index into {@link DecodeResult#players()} once returned
 * @param opcode     raw opcode byte
 * @param name       opcode name from the catalog
 * @param parameters decoded parameters
 * @param effective  true if the opcode counts towards EAPM
 */
public record Command(
        long frame,
        int player,
        int opcode,
        String name,
        CommandParameters parameters,
        boolean effective
) {
    public Command {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(parameters, "parameters");
        if (frame < 0) {
            throw new IllegalArgumentException("frame must be non-negative (was " + frame + ")");
        }
    }

    public Command withPlayer(int index)
    {
        return new Command(frame, index, opcode, name, parameters, effective);
    }
}
