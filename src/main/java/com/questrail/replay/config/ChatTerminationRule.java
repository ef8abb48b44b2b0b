package com.questrail.replay.config;

/**
 * How the message of a chat command (opcode {@code 0x5C}) is delimited.
 *
 * <p>Replays in the wild disagree on this; the rule is therefore a decoder
 * parameter rather than a property of the opcode table.</p>
 */
public enum ChatTerminationRule
{
    /** Message runs to the first zero byte, at most {@code maxChatLength} bytes. */
    NUL_TERMINATED,

    /** A u8 length precedes the message; the length is capped at {@code maxChatLength}. */
    LENGTH_PREFIXED,

    /** Message is exactly {@code maxChatLength} bytes, NUL padded. */
    FIXED
}
