package com.questrail.replay.codec;

/**
 * Indicates that the input is not a replay this decoder understands.
 *
 * This is raised for:
 * <ul>
 *   <li>Input shorter than the four-byte signature</li>
 *   <li>An unrecognised signature</li>
 * </ul>
 *
 * Every other defect is recoverable and reported through the parse
 * statistics instead.
 */
public final class InvalidFormatException extends RuntimeException
{
    public InvalidFormatException(String message) {
        super(message);
    }

    public InvalidFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
