package com.questrail.concord.message;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Envelope
 * -----------------------------------------------------------------------------
 * Minimal structured form shared by every coordination message on the wire.
 *
 * <p>This is the codec's output: syntactically valid, but not yet checked
 * for per-kind fields. Translation into a typed {@link CoordinationMessage}
 * happens in the decode layer.</p>
 *
 * @param kind      message kind as it appears on the wire
 * @param senderId  claimed identity of the sending peer (unauthenticated)
 * @param timestamp sender's clock, epoch seconds
 * @param payload   kind-specific fields
 */
public record Envelope(String kind,
                       String senderId,
                       long timestamp,
                       Map<String, Object> payload)
{
    public Envelope {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(senderId, "senderId");
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(payload, "payload")));
    }
}
