package com.questrail.replay;

import com.questrail.replay.analytics.AnalyticsEngine;
import com.questrail.replay.codec.ContainerDecodeResult;
import com.questrail.replay.codec.ContainerDecodeResult.Degradation;
import com.questrail.replay.codec.ContainerDecoder;
import com.questrail.replay.codec.InvalidFormatException;
import com.questrail.replay.codec.impl.DefaultContainerDecoder;
import com.questrail.replay.config.ReplayDecoderConfig;
import com.questrail.replay.internal.decode.CommandStreamDecoder;
import com.questrail.replay.internal.decode.CommandStreamResult;
import com.questrail.replay.model.AnalyticsSummary;
import com.questrail.replay.model.Command;
import com.questrail.replay.model.DecodeResult;
import com.questrail.replay.model.ParseIssue;
import com.questrail.replay.model.ParseIssue.Stage;
import com.questrail.replay.model.ParseStatistics;
import com.questrail.replay.model.PlayerRecord;
import com.questrail.replay.model.Reliability;
import com.questrail.replay.model.ReplayHeader;
import com.questrail.replay.observability.DecodeCompletedEvent;
import com.questrail.replay.observability.ReplayErrorEvent;
import com.questrail.replay.observability.ReplayObservabilitySink;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * ReplayDecoder
 * ============================================================================
 * Entry point of the decode pipeline.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>{@link ContainerDecoder}: signature, body, header and roster</li>
 *   <li>{@link CommandStreamDecoder}: commands from the command section</li>
 *   <li>Roster filter: commands whose player is not on the roster are
 *       dropped, the rest are renumbered from table slot to roster index so
 *       that every {@code Command.player} indexes {@code players}</li>
 *   <li>Frame inference: a defaulted frame count is replaced by the final
 *       frame of the command stream, still flagged as not confident</li>
 *   <li>{@link AnalyticsEngine}: per-player analytics</li>
 *   <li>Reliability assessment</li>
 * </ol>
 *
 * <h2>Reliability</h2>
 * <ul>
 *   <li>{@code LOW}: frame count defaulted, roster synthesized, or a
 *       compressed payload fell back to raw bytes</li>
 *   <li>{@code MEDIUM}: any other fallback tier fired, unknown opcodes exceed
 *       {@value #UNKNOWN_OPCODE_RATIO_LIMIT} of the records, or the stream was
 *       truncated or capped</li>
 *   <li>{@code HIGH}: otherwise</li>
 * </ul>
 *
 * <p>A decoder holds configuration only and is safe to share between threads.
 * Decoding the same bytes twice yields equal results.</p>
 */
public final class ReplayDecoder
{
    static final double UNKNOWN_OPCODE_RATIO_LIMIT = 0.10;

    private static final Set<Degradation> LOW_RELIABILITY = Set.of(
            Degradation.FRAMES_DEFAULTED,
            Degradation.PLAYERS_SYNTHESIZED,
            Degradation.PAYLOAD_FALLBACK_RAW);

    private final ReplayDecoderConfig config;
    private final ContainerDecoder containerDecoder;
    private final CommandStreamDecoder streamDecoder;
    private final AnalyticsEngine analyticsEngine;

    public ReplayDecoder()
    {
        this(ReplayDecoderConfig.defaults());
    }

    public ReplayDecoder(ReplayDecoderConfig config)
    {
        this(config, new DefaultContainerDecoder(config));
    }

    public ReplayDecoder(ReplayDecoderConfig config, ContainerDecoder containerDecoder)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.containerDecoder = Objects.requireNonNull(containerDecoder, "containerDecoder");
        this.streamDecoder = new CommandStreamDecoder(config);
        this.analyticsEngine = new AnalyticsEngine();
    }

    public ReplayDecoderConfig config()
    {
        return config;
    }

    /**
     * Reads and decodes a replay file.
     *
     * @throws IOException            if the file cannot be read
     * @throws InvalidFormatException if the file is not a replay
     */
    public DecodeResult decode(Path file) throws IOException
    {
        return decode(Files.readAllBytes(file));
    }

    /**
     * Decodes a complete replay.
     *
     * @param raw the whole file; not modified
     * @return the decode result
     * @throws InvalidFormatException if the input is too short for a signature
     *                                or the signature is not recognised
     */
    public DecodeResult decode(byte[] raw)
    {
        final ReplayObservabilitySink sink = config.observabilitySink();

        final ContainerDecodeResult container;
        try {
            container = containerDecoder.decode(raw);
        }
        catch (InvalidFormatException e) {
            sink.onError(new ReplayErrorEvent(Instant.now(), e.getMessage(), e));
            throw e;
        }

        final List<ParseIssue> issues = new ArrayList<>(container.issues());
        final List<PlayerRecord> players = container.players();

        // 1) Command stream
        final CommandStreamResult stream = streamDecoder.decode(container.commandCursor());
        if (stream.streamTruncated()) {
            issues.add(new ParseIssue(Stage.COMMANDS, "COMMANDS_TRUNCATED",
                    "Stream ended inside a record at frame " + stream.finalFrame()));
        }
        if (stream.iterationCapReached()) {
            issues.add(new ParseIssue(Stage.COMMANDS, "COMMANDS_ITERATION_CAP",
                    "Stopped after " + config.iterationCap() + " iteration(s)"));
        }
        if (stream.unknownOpcodes() > 0) {
            issues.add(new ParseIssue(Stage.COMMANDS, "COMMANDS_UNKNOWN_OPCODES",
                    stream.unknownOpcodes() + " unknown opcode(s) skipped"));
        }
        if (stream.commandsDropped() > 0) {
            issues.add(new ParseIssue(Stage.COMMANDS, "COMMANDS_PLAYER_OUT_OF_RANGE",
                    stream.commandsDropped() + " record(s) with a player outside [0, " + config.maxSlots() + ")"));
        }

        // 2) Roster filter; table slots become roster indices
        final Map<Integer, Integer> indexByTableSlot = players.stream()
                .collect(Collectors.toMap(PlayerRecord::tableSlot, PlayerRecord::slot));
        final List<Command> commands = stream.commands().stream()
                .filter(c -> indexByTableSlot.containsKey(c.player()))
                .map(c -> c.withPlayer(indexByTableSlot.get(c.player())))
                .toList();
        final int unrostered = stream.commands().size() - commands.size();
        if (unrostered > 0) {
            issues.add(new ParseIssue(Stage.COMMANDS, "COMMANDS_PLAYER_NOT_ROSTERED",
                    unrostered + " command(s) from players not on the roster"));
        }

        // 3) Frame inference
        ReplayHeader header = container.header();
        if (container.has(Degradation.FRAMES_DEFAULTED) && stream.finalFrame() > 0) {
            header = header.withFrames(stream.finalFrame(), false);
            issues.add(new ParseIssue(Stage.HEADER, "HEADER_FRAMES_INFERRED",
                    "Frame count taken from the command stream: " + stream.finalFrame()));
        }

        // 4) Analytics
        final Map<Integer, AnalyticsSummary> analytics = analyticsEngine.analyze(header, players, commands);

        final Reliability reliability = assess(container, stream);
        final ParseStatistics statistics = new ParseStatistics(
                raw.length,
                container.bodyLength(),
                container.isCompressed(),
                commands.size(),
                stream.commandsDropped() + unrostered,
                stream.unknownOpcodes(),
                stream.finalFrame(),
                stream.iterationCapReached(),
                stream.streamTruncated(),
                reliability,
                issues);

        issues.forEach(sink::onIssue);
        sink.onDecodeCompleted(new DecodeCompletedEvent(
                raw.length, header.frames(), players.size(), commands.size(), issues.size(), reliability));

        return new DecodeResult(header, players, commands, analytics, statistics);
    }

    static Reliability assess(ContainerDecodeResult container, CommandStreamResult stream)
    {
        for (Degradation degradation : container.degradations()) {
            if (LOW_RELIABILITY.contains(degradation)) {
                return Reliability.LOW;
            }
        }

        final int records = stream.recordsSeen();
        final boolean noisy = records > 0
                && (double) stream.unknownOpcodes() / records > UNKNOWN_OPCODE_RATIO_LIMIT;

        if (!container.degradations().isEmpty()
                || noisy
                || stream.streamTruncated()
                || stream.iterationCapReached()) {
            return Reliability.MEDIUM;
        }
        return Reliability.HIGH;
    }
}
