package com.questrail.concord.observability;

/**
 * Receives structured coordination events. Implementations can provide logging,
 * metrics, or tracing.
 *
 * <p>Sinks are invoked on the coordination loop thread and must not block.</p>
 */
public interface CoordinationObservabilitySink {
    /**
     * Called when an intent, round, proposal, session or checkpoint changes state.
     */
    void onStateTransition(EntityTransitionEvent event);

    /**
     * Called when an inbound message is discarded without effect.
     */
    void onMessageDropped(MessageDroppedEvent event);

    /**
     * Called when a peer's reported session state disagrees with the local replica.
     */
    void onDivergence(DivergenceEvent event);

    /**
     * Called when an operation fails (ledger, transport, unexpected exception).
     */
    void onError(CoordinationErrorEvent event);
}
