package com.questrail.replay.observability;

import com.questrail.replay.model.ParseIssue;
import com.questrail.replay.model.Reliability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ReplayObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jReplayObservabilitySink implements ReplayObservabilitySink
{
    private static final Logger log = LoggerFactory.getLogger(Slf4jReplayObservabilitySink.class);

    @Override
    public void onFallbackTier(FallbackTierEvent event)
    {
        if (event.isDefault()) {
            log.info("Replay {}: no tier matched, using default", event.field());
        }
        else {
            log.debug("Replay {}: resolved by tier {} ({})", event.field(), event.tierIndex(), event.tier());
        }
    }

    @Override
    public void onIssue(ParseIssue issue)
    {
        log.warn("Replay {} issue {}: {}", issue.stage(), issue.code(), issue.detail());
    }

    @Override
    public void onDecodeCompleted(DecodeCompletedEvent event)
    {
        if (event.reliability() == Reliability.HIGH) {
            log.debug("Replay decoded: {}", event);
        }
        else {
            log.info("Replay decoded with {} reliability: {} frame(s), {} player(s), {} command(s), {} issue(s)",
                    event.reliability(), event.frames(), event.players(), event.commands(), event.issues());
        }
    }

    @Override
    public void onError(ReplayErrorEvent event)
    {
        log.error("Replay rejected: {}", event.message(), event.cause());
    }
}
