package com.questrail.replay.internal.decode;

import com.questrail.replay.model.Command;

import java.util.List;

/**
 * Output of one pass of the {@link CommandStreamDecoder}.
 *
 * @param commands            emitted commands, in encounter order
 * @param commandsDropped     complete records dropped for an out-of-range player
 * @param unknownOpcodes      unknown opcode bytes met during resynchronisation
 * @param finalFrame          frame counter when the loop stopped
 * @param iterationCapReached true if the loop stopped on the iteration cap
 * @param streamTruncated     true if the stream ended inside a record or marker
 */
public record CommandStreamResult(
        List<Command> commands,
        int commandsDropped,
        int unknownOpcodes,
        long finalFrame,
        boolean iterationCapReached,
        boolean streamTruncated
) {
    public CommandStreamResult {
        commands = List.copyOf(commands);
    }

    /**
     * Records met by the loop: emitted, dropped and unknown.
     */
    public int recordsSeen()
    {
        return commands.size() + commandsDropped + unknownOpcodes;
    }
}
