package com.questrail.concord.model;

/**
 * Proposal state machine: {@code ACTIVE → FINALIZING → {PASSED | REJECTED}}.
 * Terminal states are never re-opened.
 */
public enum ProposalStatus
{
    ACTIVE,
    FINALIZING,
    PASSED,
    REJECTED;

    public boolean isTerminal() {
        return this == PASSED || this == REJECTED;
    }
}
