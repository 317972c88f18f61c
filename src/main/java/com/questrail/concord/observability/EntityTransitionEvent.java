package com.questrail.concord.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a lifecycle change of a coordination entity.
 *
 * @param fromState previous state name, or {@code null} when the entity was just created
 * @param toState   new state name
 * @param detail    free-form context (resource key, tally, sequence), may be empty
 */
public record EntityTransitionEvent(
    Instant timestamp,
    EntityKind kind,
    String entityId,
    String fromState,
    String toState,
    String detail
) {
    public EntityTransitionEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(toState, "toState");
        detail = detail == null ? "" : detail;
    }

    public boolean isCreation() {
        return fromState == null;
    }
}
