package com.questrail.concord.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single peer's vote on a proposal.
 *
 * @param decision  {@code true} approves, {@code false} rejects
 * @param weight    voting weight, summed during the tally
 * @param timestamp time the vote was recorded locally
 */
public record VoteRecord(boolean decision, long weight, Instant timestamp)
{
    public VoteRecord {
        Objects.requireNonNull(timestamp, "timestamp");
        if (weight < 0) {
            throw new IllegalArgumentException("weight must be non-negative");
        }
    }
}
