package com.questrail.concord.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Tamper-evident summary of a session's state at a point in its move log.
 *
 * @param sessionId   owning session
 * @param sequence    session sequence counter when the checkpoint was taken
 * @param stateDigest lowercase hex SHA-256 of the canonical state
 * @param moveCount   total moves in the log at checkpoint time
 * @param timestamp   creation time
 */
public record Checkpoint(String sessionId,
                         long sequence,
                         String stateDigest,
                         int moveCount,
                         Instant timestamp)
{
    public Checkpoint {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(stateDigest, "stateDigest");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
