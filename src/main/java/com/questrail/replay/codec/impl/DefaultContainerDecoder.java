package com.questrail.replay.codec.impl;

import com.questrail.replay.codec.ByteCursor;
import com.questrail.replay.codec.ContainerDecodeResult;
import com.questrail.replay.codec.ContainerDecodeResult.Degradation;
import com.questrail.replay.codec.ContainerDecoder;
import com.questrail.replay.codec.ExpandedPayload;
import com.questrail.replay.codec.InvalidFormatException;
import com.questrail.replay.codec.PayloadExpander;
import com.questrail.replay.codec.ReplayText;
import com.questrail.replay.config.ReplayDecoderConfig;
import com.questrail.replay.model.ParseIssue;
import com.questrail.replay.model.ParseIssue.Stage;
import com.questrail.replay.model.ParticipantKind;
import com.questrail.replay.model.PlayerRecord;
import com.questrail.replay.model.Race;
import com.questrail.replay.model.ReplayHeader;
import com.questrail.replay.observability.FallbackTierEvent;
import com.questrail.replay.observability.ReplayObservabilitySink;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * DefaultContainerDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link ContainerDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Signature check at {@code 0x0C} ({@code reRS} legacy, {@code seRS}
 *       modern)</li>
 *   <li>Payload expansion, modern files only</li>
 *   <li>Frame count: known offsets, then the default {@code 0}</li>
 *   <li>Map name: known offsets, then a scan of the metadata area, then
 *       {@value ReplayHeader#UNKNOWN_MAP}</li>
 *   <li>Player table: known offsets, then an anchored scan with alternate
 *       slot sizes, then two placeholder players</li>
 *   <li>Roster filtering: humans, or computers if no human was recovered</li>
 * </ol>
 *
 * <p>Every tier beyond the first is recorded as a {@link ParseIssue} and
 * reported to the observability sink.</p>
 */
public final class DefaultContainerDecoder implements ContainerDecoder
{
    static final int MIN_SCANNED_TEXT = 3;
    static final int MAX_SCANNED_TEXT = 32;

    private final PayloadExpander expander;
    private final ReplayObservabilitySink sink;

    public DefaultContainerDecoder(PayloadExpander expander, ReplayObservabilitySink sink)
    {
        this.expander = Objects.requireNonNull(expander, "expander");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public DefaultContainerDecoder(ReplayDecoderConfig config)
    {
        this(new DeflatePayloadExpander(config.maxExpandedBytes()), config.observabilitySink());
    }

    @Override
    public ContainerDecodeResult decode(byte[] raw)
    {
        if (raw == null || raw.length < HeaderLayout.BODY_OFFSET) {
            throw new InvalidFormatException("Input too short for a replay signature ("
                    + (raw == null ? 0 : raw.length) + " byte(s))");
        }

        final String signature = new String(raw, HeaderLayout.SIGNATURE_OFFSET, HeaderLayout.SIGNATURE_LENGTH,
                StandardCharsets.ISO_8859_1);
        if (!HeaderLayout.LEGACY_SIGNATURE.equals(signature) && !HeaderLayout.MODERN_SIGNATURE.equals(signature)) {
            throw new InvalidFormatException("Unrecognised replay signature: " + printable(signature));
        }

        final List<ParseIssue> issues = new ArrayList<>();
        final Set<Degradation> degradations = EnumSet.noneOf(Degradation.class);

        // 1) Body
        final byte[] prolog = Arrays.copyOfRange(raw, HeaderLayout.BODY_OFFSET, raw.length);
        final ExpandedPayload payload = HeaderLayout.MODERN_SIGNATURE.equals(signature)
                ? expander.expand(prolog)
                : ExpandedPayload.notCompressed(prolog);

        if (payload.status() == ExpandedPayload.Status.FALLBACK_RAW) {
            degradations.add(Degradation.PAYLOAD_FALLBACK_RAW);
            issues.add(new ParseIssue(Stage.PAYLOAD, "PAYLOAD_FALLBACK_RAW",
                    "Compression header at " + payload.headerOffset()
                            + " but no attempt validated " + payload.failedAttempts()));
        }

        final ByteCursor body = new ByteCursor(payload.body());

        // 2) Frame count
        final LayeredResolver<Long> frameResolver = frameResolver(body);
        final LayeredResolver.Resolution<Long> frames = frameResolver.resolve(ReplayHeader.DEFAULT_FRAMES);
        recordFallback(frameResolver.field(), frames, Stage.HEADER, "HEADER_FRAMES",
                Degradation.FRAMES_FALLBACK, Degradation.FRAMES_DEFAULTED, issues, degradations);

        // 3) Map name
        final LayeredResolver<byte[]> mapNameResolver = mapNameResolver(body);
        final LayeredResolver.Resolution<byte[]> mapName = mapNameResolver.resolve(null);
        recordFallback(mapNameResolver.field(), mapName, Stage.HEADER, "HEADER_MAP_NAME",
                Degradation.MAP_NAME_FALLBACK, Degradation.MAP_NAME_DEFAULTED, issues, degradations);

        // 4) Player table
        final LayeredResolver<List<PlayerRecord>> playerResolver = playerResolver(body);
        final LayeredResolver.Resolution<List<PlayerRecord>> table = playerResolver.resolve(placeholders());
        recordFallback(playerResolver.field(), table, Stage.PLAYERS, "PLAYERS_TABLE",
                Degradation.PLAYERS_FALLBACK, Degradation.PLAYERS_SYNTHESIZED, issues, degradations);

        // 5) Command section
        if (body.length() < HeaderLayout.COMMAND_SECTION) {
            degradations.add(Degradation.COMMAND_SECTION_MISSING);
            issues.add(new ParseIssue(Stage.COMMANDS, "COMMAND_SECTION_MISSING",
                    "Body has " + body.length() + " byte(s), command section starts at " + HeaderLayout.COMMAND_SECTION));
        }

        final ReplayHeader header = new ReplayHeader(
                signature,
                HeaderLayout.engineName(body.u8At(HeaderLayout.ENGINE).orElse(-1)),
                HeaderLayout.versionTag(signature),
                frames.value(),
                !frames.isDefault(),
                mapName.isDefault() ? ReplayHeader.UNKNOWN_MAP : ReplayText.decodePermissive(mapName.value()),
                !mapName.isDefault() && mapName.tierIndex() < HeaderLayout.MAP_NAME_OFFSETS.size(),
                text(body, HeaderLayout.GAME_TITLE, HeaderLayout.GAME_TITLE_LENGTH),
                text(body, HeaderLayout.HOST_NAME, HeaderLayout.HOST_NAME_LENGTH),
                body.u16At(HeaderLayout.GAME_TYPE).orElse(0),
                HeaderLayout.gameTypeName(body.u16At(HeaderLayout.GAME_TYPE).orElse(0)),
                body.u32At(HeaderLayout.START_TIME).orElse(0L),
                body.u16At(HeaderLayout.MAP_WIDTH).orElse(0),
                body.u16At(HeaderLayout.MAP_HEIGHT).orElse(0));

        return new ContainerDecodeResult(
                header,
                filterRoster(table.value()),
                payload.body(),
                HeaderLayout.COMMAND_SECTION,
                payload.status(),
                degradations,
                issues);
    }

    // ========================================================================
    // Resolvers
    // ========================================================================

    static LayeredResolver<Long> frameResolver(ByteCursor body)
    {
        final LayeredResolver.Builder<Long> builder = LayeredResolver.forField("frames");
        for (int offset : HeaderLayout.FRAME_OFFSETS) {
            builder.tier(offsetName(offset), () -> {
                final var value = body.u32At(offset);
                return value.isPresent() ? Optional.of(value.getAsLong()) : Optional.empty();
            });
        }
        return builder
                .validator(f -> f > 0 && f <= HeaderLayout.MAX_PLAUSIBLE_FRAMES)
                .build();
    }

    static LayeredResolver<byte[]> mapNameResolver(ByteCursor body)
    {
        final LayeredResolver.Builder<byte[]> builder = LayeredResolver.forField("mapName");
        for (int offset : HeaderLayout.MAP_NAME_OFFSETS) {
            builder.tier(offsetName(offset),
                    () -> body.bytesAt(offset, HeaderLayout.MAP_NAME_LENGTH).map(ReplayText::truncateAtNul));
        }
        return builder
                .scanTier("scan", () -> printableRuns(body, Math.min(body.length(), HeaderLayout.METADATA_END)))
                .validator(TextHeuristics::isPlausibleMapName)
                .build();
    }

    static LayeredResolver<List<PlayerRecord>> playerResolver(ByteCursor body)
    {
        final PlayerTableReader reader = new PlayerTableReader(body);
        final LayeredResolver.Builder<List<PlayerRecord>> builder = LayeredResolver.forField("players");
        for (int offset : HeaderLayout.PLAYER_TABLE_OFFSETS) {
            builder.tier(offsetName(offset), () -> Optional.of(reader.read(offset, HeaderLayout.SLOT_SIZE)));
        }
        for (int slotSize : HeaderLayout.SCAN_SLOT_SIZES) {
            final int scanEnd = Math.min(body.length(), HeaderLayout.PLAYER_SCAN_END);
            builder.scanTier("scan/" + slotSize,
                    () -> IntStream.range(0, Math.max(0, scanEnd)).mapToObj(base -> reader.readAnchored(base, slotSize)));
        }
        return builder
                .validator(players -> !players.isEmpty())
                .build();
    }

    /**
     * Candidate strings of the map name scan: every maximal run of printable
     * bytes below {@code end}, at least {@value #MIN_SCANNED_TEXT} bytes long,
     * cut to {@value #MAX_SCANNED_TEXT} bytes.
     */
    static Stream<byte[]> printableRuns(ByteCursor body, int end)
    {
        final List<byte[]> runs = new ArrayList<>();
        int start = -1;
        for (int i = 0; i <= end; i++) {
            final boolean printable = i < end && ReplayText.isPrintableByte(body.u8At(i).orElse(0));
            if (printable && start < 0) {
                start = i;
            }
            else if (!printable && start >= 0) {
                final int length = Math.min(i - start, MAX_SCANNED_TEXT);
                if (length >= MIN_SCANNED_TEXT) {
                    body.bytesAt(start, length).ifPresent(runs::add);
                }
                start = -1;
            }
        }
        return runs.stream();
    }

    /**
     * Keeps the humans, or the computers if there are none, and renumbers the
     * kept players so that {@code slot} is their index in the returned list.
     * The table slot survives as {@link PlayerRecord#tableSlot()}.
     */
    static List<PlayerRecord> filterRoster(List<PlayerRecord> players)
    {
        List<PlayerRecord> kept = players.stream()
                .filter(p -> p.kind() == ParticipantKind.HUMAN)
                .toList();
        if (kept.isEmpty()) {
            kept = players.stream()
                    .filter(p -> p.kind() == ParticipantKind.COMPUTER)
                    .toList();
        }
        final List<PlayerRecord> roster = kept;
        return IntStream.range(0, roster.size())
                .mapToObj(i -> roster.get(i).withSlot(i))
                .toList();
    }

    static List<PlayerRecord> placeholders()
    {
        return List.of(
                new PlayerRecord(0, 0, "Player 1", Race.RANDOM, 1, 0, ParticipantKind.HUMAN),
                new PlayerRecord(1, 1, "Player 2", Race.RANDOM, 2, 1, ParticipantKind.HUMAN));
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private void recordFallback(String field,
                                LayeredResolver.Resolution<?> resolution,
                                Stage stage,
                                String codePrefix,
                                Degradation fallback,
                                Degradation defaulted,
                                List<ParseIssue> issues,
                                Set<Degradation> degradations)
    {
        if (resolution.isPrimary()) {
            return;
        }

        sink.onFallbackTier(new FallbackTierEvent(field, resolution.tier(), resolution.tierIndex()));

        if (resolution.isDefault()) {
            degradations.add(defaulted);
            issues.add(new ParseIssue(stage, codePrefix + "_DEFAULTED", "No tier produced a plausible value"));
        }
        else {
            degradations.add(fallback);
            issues.add(new ParseIssue(stage, codePrefix + "_FALLBACK",
                    "Resolved by tier " + resolution.tierIndex() + " (" + resolution.tier() + ")"));
        }
    }

    private static String text(ByteCursor body, int offset, int length)
    {
        return body.bytesAt(offset, length).map(ReplayText::decodePermissive).orElse("");
    }

    private static String offsetName(int offset)
    {
        return String.format("offset 0x%02X", offset);
    }

    private static String printable(String s)
    {
        final StringBuilder sb = new StringBuilder();
        for (char c : s.toCharArray()) {
            if (ReplayText.isPrintableAscii(c)) {
                sb.append(c);
            }
            else {
                sb.append(String.format("\\x%02X", (int) c));
            }
        }
        return sb.toString();
    }
}
