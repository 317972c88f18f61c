package com.questrail.concord.observability;

import java.time.Instant;

/**
 * Record representing a state digest mismatch between the local session replica
 * and a peer's report at the same sequence.
 */
public record DivergenceEvent(
    Instant timestamp,
    String sessionId,
    long sequence,
    String peerId,
    String localDigest,
    String remoteDigest
) {
}
