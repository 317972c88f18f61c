package com.questrail.concord.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CoordinationObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jCoordinationObservabilitySink implements CoordinationObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCoordinationObservabilitySink.class);

    @Override
    public void onStateTransition(EntityTransitionEvent event) {
        if (event.isCreation()) {
            log.info("{} {} created as {} {}",
                event.kind(), event.entityId(), event.toState(), event.detail());
        } else {
            log.info("{} {}: {} -> {} {}",
                event.kind(), event.entityId(), event.fromState(), event.toState(), event.detail());
        }
    }

    @Override
    public void onMessageDropped(MessageDroppedEvent event) {
        log.warn("Dropped message on {} from {} ({}): {}",
            event.channel(),
            event.senderId() != null ? event.senderId() : "<unknown>",
            event.reason(),
            event.detail());
    }

    @Override
    public void onDivergence(DivergenceEvent event) {
        log.warn("Session {} diverges from peer {} at sequence {}: local={} remote={}",
            event.sessionId(), event.peerId(), event.sequence(), event.localDigest(), event.remoteDigest());
    }

    @Override
    public void onError(CoordinationErrorEvent event) {
        log.error("Coordination error: {}", event.message(), event.cause());
    }
}
