package com.questrail.concord.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements CoordinationObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(EntityTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onMessageDropped(MessageDroppedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onDivergence(DivergenceEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(CoordinationErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }

    public List<EntityTransitionEvent> transitionsOf(EntityKind kind) {
        return eventsOfType(EntityTransitionEvent.class).stream()
            .filter(e -> e.kind() == kind)
            .collect(Collectors.toList());
    }

    public List<MessageDroppedEvent> drops(DropReason reason) {
        return eventsOfType(MessageDroppedEvent.class).stream()
            .filter(e -> e.reason() == reason)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    public synchronized void clear() {
        events.clear();
    }
}
