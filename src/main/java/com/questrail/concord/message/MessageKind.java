package com.questrail.concord.message;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of message kinds understood by the coordination engine, with the
 * exact string each one carries in the envelope {@code kind} field.
 */
public enum MessageKind
{
    INTENT("intent"),
    COORDINATION("coordination"),
    PROPOSAL("proposal"),
    VOTE("vote"),
    MOVE("move"),
    SESSION_OPENED("session"),
    SESSION_ENDED("session_end"),
    CHECKPOINT("checkpoint");

    private final String wireName;

    MessageKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<MessageKind> fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(k -> k.wireName.equals(wireName))
                .findFirst();
    }
}
