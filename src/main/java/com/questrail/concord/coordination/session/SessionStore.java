package com.questrail.concord.coordination.session;

import com.questrail.concord.model.Session;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory sessions of one peer, owned by its {@link SessionSequencer}.
 * Not thread-safe.
 */
public final class SessionStore
{
    private final Map<String, Session> sessions = new LinkedHashMap<>();

    /**
     * @return {@code false} if a session with the same id is already stored
     */
    public boolean add(Session session) {
        Objects.requireNonNull(session, "session");
        return sessions.putIfAbsent(session.id(), session) == null;
    }

    public Optional<Session> session(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public List<Session> active() {
        return sessions.values().stream().filter(Session::isActive).collect(Collectors.toList());
    }

    public Collection<Session> sessions() {
        return Collections.unmodifiableCollection(sessions.values());
    }
}
