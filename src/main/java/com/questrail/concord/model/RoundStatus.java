package com.questrail.concord.model;

/**
 * Lifecycle of a {@link CoordinationRound}. {@code EXECUTED} and
 * {@code REJECTED} are terminal; a round that never reaches quorum stays
 * {@code VOTING}.
 */
public enum RoundStatus
{
    VOTING,
    EXECUTED,
    REJECTED
}
