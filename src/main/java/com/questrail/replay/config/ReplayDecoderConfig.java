package com.questrail.replay.config;

import com.questrail.replay.observability.NullObservabilitySink;
import com.questrail.replay.observability.ReplayObservabilitySink;

import java.util.Objects;

/**
 * ReplayDecoderConfig
 * -----------------------------------------------------------------------------
 * Tunables of the decode pipeline.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>iterationCap</b>: Upper bound on command loop iterations. The loop
 *       stops and flags the statistics when it is reached.</li>
 *   <li><b>maxSlots</b>: Number of player slots; command player bytes outside
 *       {@code [0, maxSlots)} drop the record.</li>
 *   <li><b>chatTerminationRule</b> / <b>maxChatLength</b>: Delimiting of chat
 *       messages, see {@link ChatTerminationRule}.</li>
 *   <li><b>maxExpandedBytes</b>: Cap on the size of an inflated payload.</li>
 *   <li><b>observabilitySink</b>: Receiver of fallback and issue events.</li>
 * </ul>
 */
public record ReplayDecoderConfig(
        int iterationCap,
        int maxSlots,
        ChatTerminationRule chatTerminationRule,
        int maxChatLength,
        int maxExpandedBytes,
        ReplayObservabilitySink observabilitySink
) {
    public static final int DEFAULT_ITERATION_CAP = 1_000_000;
    public static final int DEFAULT_MAX_SLOTS = 8;
    public static final int DEFAULT_MAX_CHAT_LENGTH = 80;
    public static final int DEFAULT_MAX_EXPANDED_BYTES = 16 * 1024 * 1024;

    public ReplayDecoderConfig {
        Objects.requireNonNull(chatTerminationRule, "chatTerminationRule");
        Objects.requireNonNull(observabilitySink, "observabilitySink");

        if (iterationCap <= 0) {
            throw new IllegalArgumentException("iterationCap must be positive");
        }
        if (maxSlots <= 0 || maxSlots > 255) {
            throw new IllegalArgumentException("maxSlots must be in 1..255");
        }
        if (maxChatLength <= 0 || maxChatLength > 255) {
            throw new IllegalArgumentException("maxChatLength must be in 1..255");
        }
        if (maxExpandedBytes <= 0) {
            throw new IllegalArgumentException("maxExpandedBytes must be positive");
        }
    }

    /**
     * Default configuration with a silent observability sink.
     */
    public static ReplayDecoderConfig defaults()
    {
        return builder().build();
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private int iterationCap = DEFAULT_ITERATION_CAP;
        private int maxSlots = DEFAULT_MAX_SLOTS;
        private ChatTerminationRule chatTerminationRule = ChatTerminationRule.NUL_TERMINATED;
        private int maxChatLength = DEFAULT_MAX_CHAT_LENGTH;
        private int maxExpandedBytes = DEFAULT_MAX_EXPANDED_BYTES;
        private ReplayObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withIterationCap(int iterationCap)
        {
            this.iterationCap = iterationCap;
            return this;
        }

        public Builder withMaxSlots(int maxSlots)
        {
            this.maxSlots = maxSlots;
            return this;
        }

        public Builder withChatTerminationRule(ChatTerminationRule rule)
        {
            this.chatTerminationRule = rule;
            return this;
        }

        public Builder withMaxChatLength(int maxChatLength)
        {
            this.maxChatLength = maxChatLength;
            return this;
        }

        public Builder withMaxExpandedBytes(int maxExpandedBytes)
        {
            this.maxExpandedBytes = maxExpandedBytes;
            return this;
        }

        public Builder withObservabilitySink(ReplayObservabilitySink sink)
        {
            this.observabilitySink = sink;
            return this;
        }

        public ReplayDecoderConfig build()
        {
            return new ReplayDecoderConfig(iterationCap, maxSlots, chatTerminationRule,
                    maxChatLength, maxExpandedBytes, observabilitySink);
        }
    }
}
