package com.questrail.concord.model;

/**
 * Lifecycle of an {@link Intent}.
 *
 * <pre>
 *   PENDING → COORDINATING → { EXECUTED | EXECUTED_BY_PEER | FAILED }
 *                  ↓
 *               PENDING   (candidate that lost an executed round)
 * </pre>
 */
public enum IntentStatus
{
    /** Known locally and eligible for conflict resolution. */
    PENDING,

    /** Named as a candidate in an open coordination round. */
    COORDINATING,

    /** Submitted (and, once confirmed, settled) by this peer. */
    EXECUTED,

    /** Won a round but belongs to another peer, which submits it. */
    EXECUTED_BY_PEER,

    /** Ledger submission or confirmation failed. Terminal. */
    FAILED
}
