package com.questrail.concord.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * One entry in a session's move log.
 *
 * @param originator peer that made the move
 * @param payload    opaque move data
 * @param sequence   position in the session log, starting at 0
 * @param timestamp  local time at which the move was appended
 */
public record Move(String originator,
                   Map<String, Object> payload,
                   long sequence,
                   Instant timestamp)
{
    public Move {
        Objects.requireNonNull(originator, "originator");
        Objects.requireNonNull(timestamp, "timestamp");
        payload = Collections.unmodifiableMap(JsonBlobs.deepCopy(Objects.requireNonNull(payload, "payload")));
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be >= 0");
        }
    }
}
