package com.questrail.replay.catalog;

import java.util.Objects;

/**
 * Static description of one command opcode.
 *
 * @param opcode          opcode byte
 * @param name            display name
 * @param parameterLength parameter bytes after the player byte, or
 *                        {@link #VARIABLE_LENGTH}
 * @param effective       true if the command counts towards EAPM
 * @param category        grouping used by analytics
 * @param shape           parameter layout
 */
public record OpcodeDescriptor(
        int opcode,
        String name,
        int parameterLength,
        boolean effective,
        CommandCategory category,
        ParameterShape shape
) {
    public static final int VARIABLE_LENGTH = -1;

    public OpcodeDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(shape, "shape");
        if (parameterLength < VARIABLE_LENGTH) {
            throw new IllegalArgumentException("parameterLength must be >= -1");
        }
    }

    public boolean isVariableLength()
    {
        return parameterLength == VARIABLE_LENGTH;
    }
}
