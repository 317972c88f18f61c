package com.questrail.concord.model;

/**
 * Settlement status of a passed proposal. Tracked separately from the vote
 * outcome: a failed submission never reverts {@link ProposalStatus#PASSED}.
 */
public enum OnchainStatus
{
    NOT_SUBMITTED,
    SUBMITTED,
    CONFIRMED,
    FAILED
}
