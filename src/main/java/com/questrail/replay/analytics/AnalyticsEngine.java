package com.questrail.replay.analytics;

import com.questrail.replay.model.AnalyticsSummary;
import com.questrail.replay.model.Command;
import com.questrail.replay.model.PlayerRecord;
import com.questrail.replay.model.ReplayHeader;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * AnalyticsEngine
 * -----------------------------------------------------------------------------
 * Derives per-player analytics from a decoded command list.
 *
 * <ul>
 *   <li><b>APM / EAPM</b>: the player's commands (effective commands for
 *       EAPM) divided by {@code frames / 24 / 60}, rounded; {@code 0} for a
 *       zero-length game.</li>
 *   <li><b>Build order and supply</b>: see {@link BuildOrderTracker}.</li>
 *   <li><b>Strategy</b>: see {@link StrategicClassifier}.</li>
 * </ul>
 *
 * <p>Stateless; a single instance may be shared between threads.</p>
 */
public final class AnalyticsEngine
{
    /**
     * Analyse every rostered player.
     *
     * @param header   header providing the game length
     * @param players  roster
     * @param commands commands in frame order
     * @return summaries keyed by slot, in slot order
     */
    public Map<Integer, AnalyticsSummary> analyze(ReplayHeader header,
                                                  List<PlayerRecord> players,
                                                  List<Command> commands)
    {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(players, "players");
        Objects.requireNonNull(commands, "commands");

        final Map<Integer, AnalyticsSummary> result = new TreeMap<>();
        for (PlayerRecord player : players) {
            result.put(player.slot(), analyzePlayer(header.frames(), player, commands));
        }
        return result;
    }

    AnalyticsSummary analyzePlayer(long frames, PlayerRecord player, List<Command> commands)
    {
        final BuildOrderTracker tracker = new BuildOrderTracker(player.race());
        int actions = 0;
        int effective = 0;

        for (Command command : commands) {
            if (command.player() != player.slot()) {
                continue;
            }
            actions++;
            if (command.effective()) {
                effective++;
            }
            tracker.accept(command);
        }

        return new AnalyticsSummary(
                player.slot(),
                ActionRateCalculator.perMinute(actions, frames),
                ActionRateCalculator.perMinute(effective, frames),
                actions,
                effective,
                tracker.buildOrder(),
                tracker.supplyHistory(),
                StrategicClassifier.classify(tracker.buildOrder(), tracker.supplyHistory()));
    }
}
