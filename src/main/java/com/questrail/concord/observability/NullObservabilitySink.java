package com.questrail.concord.observability;

/**
 * No-op implementation of CoordinationObservabilitySink.
 */
public final class NullObservabilitySink implements CoordinationObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(EntityTransitionEvent event) {}

    @Override
    public void onMessageDropped(MessageDroppedEvent event) {}

    @Override
    public void onDivergence(DivergenceEvent event) {}

    @Override
    public void onError(CoordinationErrorEvent event) {}
}
