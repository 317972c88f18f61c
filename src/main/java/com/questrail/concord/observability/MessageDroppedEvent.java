package com.questrail.concord.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing an inbound message that was discarded.
 *
 * @param senderId claimed sender, or {@code null} when the message was too malformed to tell
 */
public record MessageDroppedEvent(
    Instant timestamp,
    String channel,
    DropReason reason,
    String senderId,
    String detail
) {
    public MessageDroppedEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(reason, "reason");
        detail = detail == null ? "" : detail;
    }
}
