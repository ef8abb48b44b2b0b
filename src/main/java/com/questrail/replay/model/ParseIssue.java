package com.questrail.replay.model;

import java.util.Objects;

/**
 * A recoverable problem met during decoding.
 *
 * @param stage  pipeline stage that recorded the issue
 * @param code   stable machine-readable code, e.g. {@code HEADER_FRAMES_DEFAULTED}
 * @param detail human-readable detail
 */
public record ParseIssue(Stage stage, String code, String detail)
{
    public enum Stage { PAYLOAD, HEADER, PLAYERS, COMMANDS }

    public ParseIssue {
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(detail, "detail");
    }
}
