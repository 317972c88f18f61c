package com.questrail.concord.observability;

/**
 * Kinds of entity whose lifecycle is reported through
 * {@link EntityTransitionEvent}.
 */
public enum EntityKind {
    INTENT,
    ROUND,
    PROPOSAL,
    ONCHAIN_SUBMISSION,
    SESSION,
    CHECKPOINT,
    PEER
}
