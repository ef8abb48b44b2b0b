package com.questrail.replay.observability;

import com.questrail.replay.model.ParseIssue;

/**
 * Receives observability events from the decode pipeline.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface ReplayObservabilitySink
{
    /**
     * Called when a header or roster field was recovered by a tier other than
     * the primary one.
     * @param event the resolver outcome
     */
    void onFallbackTier(FallbackTierEvent event);

    /**
     * Called for every recoverable issue recorded in the parse statistics.
     * @param issue the recorded issue
     */
    void onIssue(ParseIssue issue);

    /**
     * Called once per successful decode.
     * @param event summary of the decode
     */
    void onDecodeCompleted(DecodeCompletedEvent event);

    /**
     * Called when a decode is rejected as a whole.
     * @param event the error event
     */
    void onError(ReplayErrorEvent event);
}
