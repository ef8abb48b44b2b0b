package com.questrail.replay.observability;

import com.questrail.replay.model.ParseIssue;

/**
 * No-op implementation of ReplayObservabilitySink.
 */
public final class NullObservabilitySink implements ReplayObservabilitySink
{
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onFallbackTier(FallbackTierEvent event) {}

    @Override
    public void onIssue(ParseIssue issue) {}

    @Override
    public void onDecodeCompleted(DecodeCompletedEvent event) {}

    @Override
    public void onError(ReplayErrorEvent event) {}
}
