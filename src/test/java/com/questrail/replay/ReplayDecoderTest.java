package com.questrail.replay;

import com.questrail.replay.codec.InvalidFormatException;
import com.questrail.replay.config.ReplayDecoderConfig;
import com.questrail.replay.model.AnalyticsSummary;
import com.questrail.replay.model.BuildAction;
import com.questrail.replay.model.BuildOrderEntry;
import com.questrail.replay.model.Command;
import com.questrail.replay.model.CommandParameters;
import com.questrail.replay.model.DecodeResult;
import com.questrail.replay.model.ParseIssue;
import com.questrail.replay.model.PlayerRecord;
import com.questrail.replay.model.Race;
import com.questrail.replay.model.Reliability;
import com.questrail.replay.model.SupplySnapshot;
import com.questrail.replay.observability.DecodeCompletedEvent;
import com.questrail.replay.observability.RecordingObservabilitySink;
import com.questrail.replay.observability.ReplayErrorEvent;
import com.questrail.replay.test.ReplayFixtures.CommandBytes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.questrail.replay.test.ReplayFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

final class ReplayDecoderTest
{
    private final ReplayDecoder decoder = new ReplayDecoder();

    private static byte[] gameWithCommands()
    {
        return twoPlayerGame(legacy())
                .commands(CommandBytes.stream()
                        .train(0, 7)
                        .select(1, 1, 154)
                        .train(1, 64)
                        .frameStep(240)
                        .build(0, 109, 40, 56)
                        .chat(1, 1, "glhf")
                        .skip16(2400)
                        .train(0, 0)
                        .move(0, 100, 100)
                        .hotkey(1, 0, 1))
                .build();
    }

    // ------------------------------------------------------------------------
    // Basic scenarios
    // ------------------------------------------------------------------------

    @Test
    void headerOnlyReplay()
    {
        DecodeResult result = decoder.decode(twoPlayerGame(legacy()).build());

        assertEquals(14_400, result.header().frames());
        assertEquals("Fighting Spirit", result.header().mapName());
        assertEquals(List.of("Alice", "Bob"), result.players().stream().map(PlayerRecord::name).toList());
        assertEquals(Race.TERRAN, result.player(0).orElseThrow().race());
        assertEquals(Race.PROTOSS, result.player(1).orElseThrow().race());
        assertTrue(result.commands().isEmpty());
        assertEquals(Set.of(0, 1), result.analytics().keySet());
        assertEquals(0, result.analyticsFor(0).orElseThrow().apm());
        assertEquals(Reliability.HIGH, result.statistics().reliability());
        assertTrue(result.statistics().errors().isEmpty());
    }

    @Test
    void singleTrainCommandBecomesABuildOrderStep()
    {
        DecodeResult result = decoder.decode(twoPlayerGame(legacy())
                .commands(CommandBytes.stream().train(0, 7))
                .build());

        assertEquals(1, result.commands().size());
        Command train = result.commands().get(0);
        assertEquals(0, train.frame());
        assertEquals(0, train.player());
        assertEquals(new CommandParameters.EntityOrder(7), train.parameters());

        AnalyticsSummary alice = result.analyticsFor(0).orElseThrow();
        assertEquals(1, alice.buildOrder().size());
        BuildOrderEntry scv = alice.buildOrder().get(0);
        assertEquals("SCV", scv.entityName());
        assertEquals(BuildAction.TRAIN, scv.action());
        assertEquals(BuildOrderEntry.DIRECT_CONFIDENCE, scv.confidence());
        assertEquals("0:00", scv.gameTime());
        assertEquals(SupplySnapshot.of(0, 5, 10), scv.supply());

        assertTrue(result.analyticsFor(1).orElseThrow().buildOrder().isEmpty());
    }

    @Test
    void unknownOpcodeIsSkippedWithoutLosingTheNextCommand()
    {
        DecodeResult result = decoder.decode(twoPlayerGame(legacy())
                .commands(CommandBytes.stream().raw(0x04).train(0, 37))
                .build());

        assertEquals(1, result.commands().size());
        assertEquals(0x1D, result.commands().get(0).opcode());
        assertEquals(new CommandParameters.EntityOrder(37), result.commands().get(0).parameters());
        assertEquals(1, result.statistics().unknownOpcodes());
        assertTrue(result.statistics().hasIssue("COMMANDS_UNKNOWN_OPCODES"));
    }

    @Test
    void corruptCompressedPayloadFallsBackToRawBytes()
    {
        byte[] body = new byte[2 + 700];
        Arrays.fill(body, (byte) 0xFF);
        body[0] = 0x78;
        body[1] = (byte) 0x9C;
        byte[] raw = file("seRS", body);

        DecodeResult result = decoder.decode(raw);

        assertNotNull(result.header());
        assertEquals("seRS", result.header().signature());
        assertFalse(result.statistics().compressed());
        assertTrue(result.statistics().hasIssue("PAYLOAD_FALLBACK_RAW"));
        assertEquals(Reliability.LOW, result.statistics().reliability());
        assertEquals(2, result.players().size());
    }

    @Test
    void compressedReplayDecodesLikeItsLegacyTwin()
    {
        CommandBytes commands = CommandBytes.stream().train(0, 7).frameStep(24).train(1, 64);
        DecodeResult legacy = decoder.decode(twoPlayerGame(legacy()).commands(commands).build());
        DecodeResult modern = decoder.decode(twoPlayerGame(modern()).commands(commands).build());

        assertTrue(modern.statistics().compressed());
        assertEquals(legacy.players(), modern.players());
        assertEquals(legacy.commands(), modern.commands());
        assertEquals(legacy.analytics(), modern.analytics());
        assertEquals(Reliability.HIGH, modern.statistics().reliability());
    }

    // ------------------------------------------------------------------------
    // Properties
    // ------------------------------------------------------------------------

    @Test
    void decodingIsDeterministic()
    {
        byte[] raw = gameWithCommands();
        assertEquals(decoder.decode(raw), decoder.decode(raw));
        assertEquals(decoder.decode(raw), new ReplayDecoder().decode(raw.clone()));
    }

    @Test
    void inputIsNotModified()
    {
        byte[] raw = gameWithCommands();
        byte[] copy = raw.clone();
        decoder.decode(raw);
        assertArrayEquals(copy, raw);
    }

    @Test
    void commandFramesAreMonotonic()
    {
        List<Command> commands = decoder.decode(gameWithCommands()).commands();

        assertEquals(8, commands.size());
        for (int i = 1; i < commands.size(); i++) {
            assertTrue(commands.get(i).frame() >= commands.get(i - 1).frame());
        }
        assertEquals(240, commands.get(3).frame());
        assertEquals(2640, commands.get(5).frame());
    }

    @Test
    void everyCommandBelongsToARosteredPlayer()
    {
        DecodeResult result = decoder.decode(twoPlayerGame(legacy())
                .commands(CommandBytes.stream()
                        .train(0, 7)
                        .train(3, 7)
                        .train(9, 7)
                        .train(1, 64))
                .build());

        assertTrue(result.commands().stream()
                .allMatch(c -> c.player() >= 0 && c.player() < result.players().size()));
        assertEquals(2, result.commands().size());
        assertEquals(2, result.statistics().commandsDropped());
        assertTrue(result.statistics().hasIssue("COMMANDS_PLAYER_OUT_OF_RANGE"));
        assertTrue(result.statistics().hasIssue("COMMANDS_PLAYER_NOT_ROSTERED"));
    }

    @Test
    void commandPlayersIndexTheRosterWhenSlotsAreSkipped()
    {
        DecodeResult result = decoder.decode(legacy()
                .frames(14_400)
                .mapName("Python")
                .player(0, "Alice", RACE_TERRAN, KIND_HUMAN)
                .player(1, "Bot", RACE_ZERG, KIND_COMPUTER)
                .player(2, "Carol", RACE_PROTOSS, KIND_HUMAN)
                .commands(CommandBytes.stream()
                        .train(0, 7)
                        .train(1, 41)
                        .train(2, 64))
                .build());

        assertEquals(List.of(0, 1), result.players().stream().map(PlayerRecord::slot).toList());
        assertEquals(List.of(0, 2), result.players().stream().map(PlayerRecord::tableSlot).toList());
        assertEquals(List.of(0, 1), result.commands().stream().map(Command::player).toList());
        for (Command command : result.commands()) {
            assertEquals(command.player(), result.players().get(command.player()).slot());
        }
        assertEquals("Carol", result.players().get(result.commands().get(1).player()).name());
        assertEquals("Probe", result.analyticsFor(1).orElseThrow().buildOrder().get(0).entityName());
        assertEquals(1, result.statistics().commandsDropped());
    }

    @Test
    void everyPrefixDecodesWithoutException()
    {
        byte[] raw = gameWithCommands();
        for (int n = 0; n <= raw.length; n++) {
            byte[] prefix = Arrays.copyOf(raw, n);
            if (n < BODY_OFFSET) {
                assertThrows(InvalidFormatException.class, () -> decoder.decode(prefix), "length " + n);
            }
            else {
                DecodeResult result = assertDoesNotThrow(() -> decoder.decode(prefix), "length " + n);
                assertFalse(result.players().isEmpty());
                assertTrue(result.header().frames() >= 0);
            }
        }
    }

    @Test
    void everyPrefixOfACompressedReplayDecodesWithoutException()
    {
        byte[] raw = twoPlayerGame(modern())
                .commands(CommandBytes.stream().train(0, 7).frameStep(100).train(1, 64))
                .build();
        for (int n = BODY_OFFSET; n <= raw.length; n++) {
            byte[] prefix = Arrays.copyOf(raw, n);
            assertDoesNotThrow(() -> decoder.decode(prefix), "length " + n);
        }
    }

    @Test
    void apmIsConsistentWithCommandCounts()
    {
        DecodeResult result = decoder.decode(gameWithCommands());

        for (AnalyticsSummary summary : result.analytics().values()) {
            long mine = result.commands().stream().filter(c -> c.player() == summary.player()).count();
            assertEquals(mine, summary.actionCount());
            assertTrue(summary.effectiveActionCount() <= summary.actionCount());
            assertTrue(summary.apm() >= 0);
            assertTrue(summary.eapm() <= summary.apm());
        }
        // Alice: 4 commands over 10 minutes
        assertEquals(0, result.analyticsFor(0).orElseThrow().apm());
        assertEquals(4, result.analyticsFor(1).orElseThrow().actionCount());
    }

    @Test
    void supplyNeverDropsBelowTheRaceStart()
    {
        DecodeResult result = decoder.decode(gameWithCommands());

        Map<Race, Integer> startingMax = Map.of(Race.TERRAN, 10, Race.PROTOSS, 9);
        for (AnalyticsSummary summary : result.analytics().values()) {
            int start = startingMax.get(result.players().get(summary.player()).race());
            assertEquals(start, summary.supplyHistory().get(0).maxSupply());
            for (SupplySnapshot snapshot : summary.supplyHistory()) {
                assertTrue(snapshot.currentSupply() >= 0);
                assertTrue(snapshot.maxSupply() >= start);
            }
            assertEquals(0, summary.supplyHistory().get(0).frame());
        }
        assertEquals(18, result.analyticsFor(0).orElseThrow().supplyHistory().get(2).maxSupply());
    }

    // ------------------------------------------------------------------------
    // Reliability and fallbacks
    // ------------------------------------------------------------------------

    @Test
    void missingFrameCountIsInferredFromTheCommandStream()
    {
        DecodeResult result = decoder.decode(twoPlayerGame(legacy())
                .frames(0)
                .commands(CommandBytes.stream().train(0, 7).frameStep(240))
                .build());

        assertEquals(240, result.header().frames());
        assertFalse(result.header().frameCountConfident());
        assertTrue(result.statistics().hasIssue("HEADER_FRAMES_DEFAULTED"));
        assertTrue(result.statistics().hasIssue("HEADER_FRAMES_INFERRED"));
        assertEquals(Reliability.LOW, result.statistics().reliability());
    }

    @Test
    void missingFrameCountWithoutCommandsStaysAtZero()
    {
        DecodeResult result = decoder.decode(twoPlayerGame(legacy()).frames(0).build());

        assertEquals(0, result.header().frames());
        assertFalse(result.statistics().hasIssue("HEADER_FRAMES_INFERRED"));
        assertEquals(0, result.analyticsFor(0).orElseThrow().apm());
    }

    @Test
    void fallbackTierLowersReliabilityToMedium()
    {
        DecodeResult result = decoder.decode(twoPlayerGame(legacy())
                .frames(2_000_000)
                .u32(0x0C, 14_400)
                .build());

        assertEquals(Reliability.MEDIUM, result.statistics().reliability());
        assertTrue(result.header().frameCountConfident());
    }

    @Test
    void truncatedStreamLowersReliabilityToMedium()
    {
        DecodeResult result = decoder.decode(twoPlayerGame(legacy())
                .commands(CommandBytes.stream().train(0, 7).raw(0x0C, 0x00, 0x01))
                .build());

        assertTrue(result.statistics().streamTruncated());
        assertTrue(result.statistics().hasIssue("COMMANDS_TRUNCATED"));
        assertEquals(Reliability.MEDIUM, result.statistics().reliability());
        assertEquals(1, result.commands().size());
    }

    @Test
    void iterationCapLowersReliabilityToMedium()
    {
        ReplayDecoder capped = new ReplayDecoder(ReplayDecoderConfig.builder().withIterationCap(5).build());
        DecodeResult result = capped.decode(gameWithCommands());

        assertTrue(result.statistics().iterationCapReached());
        assertTrue(result.statistics().hasIssue("COMMANDS_ITERATION_CAP"));
        assertEquals(Reliability.MEDIUM, result.statistics().reliability());
    }

    @Test
    void noisyCommandStreamLowersReliabilityToMedium()
    {
        DecodeResult result = decoder.decode(twoPlayerGame(legacy())
                .commands(CommandBytes.stream().train(0, 7).raw(0x04, 0x04, 0x04).train(0, 7))
                .build());

        // the first 0x04 takes the second one with it as a player byte
        assertEquals(2, result.statistics().unknownOpcodes());
        assertEquals(Reliability.MEDIUM, result.statistics().reliability());
    }

    @Test
    void synthesizedRosterIsLowReliability()
    {
        DecodeResult result = decoder.decode(legacy()
                .frames(14_400)
                .mapName("Python")
                .commands(CommandBytes.stream().train(0, 7).train(1, 64))
                .build());

        assertEquals(List.of("Player 1", "Player 2"), result.players().stream().map(PlayerRecord::name).toList());
        assertEquals(2, result.commands().size());
        assertEquals(Reliability.LOW, result.statistics().reliability());
    }

    // ------------------------------------------------------------------------
    // Observability and I/O
    // ------------------------------------------------------------------------

    @Test
    void sinkReceivesIssuesAndCompletion()
    {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        ReplayDecoder observed = new ReplayDecoder(ReplayDecoderConfig.builder().withObservabilitySink(sink).build());

        DecodeResult result = observed.decode(twoPlayerGame(legacy()).frames(0).build());

        assertEquals(1, sink.getFallbacks().size());
        List<Object> events = sink.getAllEvents();
        assertTrue(events.contains(new ParseIssue(ParseIssue.Stage.HEADER, "HEADER_FRAMES_DEFAULTED",
                "No tier produced a plausible value")));
        DecodeCompletedEvent completed = (DecodeCompletedEvent) events.get(events.size() - 1);
        assertEquals(Reliability.LOW, completed.reliability());
        assertEquals(result.statistics().errors().size(), completed.issues());
        assertEquals(2, completed.players());
    }

    @Test
    void sinkReceivesRejection()
    {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        ReplayDecoder observed = new ReplayDecoder(ReplayDecoderConfig.builder().withObservabilitySink(sink).build());

        assertThrows(InvalidFormatException.class, () -> observed.decode(new byte[] { 'M', 'Z', 0, 0 }));
        assertTrue(sink.hasEventOfType(ReplayErrorEvent.class));
        assertFalse(sink.hasEventOfType(DecodeCompletedEvent.class));
    }

    @Test
    void decodesFromFile(@TempDir Path dir) throws Exception
    {
        Path file = dir.resolve("game.rep");
        Files.write(file, gameWithCommands());

        assertEquals(decoder.decode(gameWithCommands()), decoder.decode(file));
    }
}
