package com.questrail.concord.coordination.session;

import com.questrail.concord.coordination.CoordinationContext;
import com.questrail.concord.message.CoordinationMessage.CheckpointAnnounced;
import com.questrail.concord.message.CoordinationMessage.MoveMade;
import com.questrail.concord.message.CoordinationMessage.SessionEnded;
import com.questrail.concord.message.CoordinationMessage.SessionOpened;
import com.questrail.concord.message.ProtocolChannel;
import com.questrail.concord.model.Checkpoint;
import com.questrail.concord.model.Move;
import com.questrail.concord.model.Session;
import com.questrail.concord.model.SessionStatus;
import com.questrail.concord.observability.DivergenceEvent;
import com.questrail.concord.observability.DropReason;
import com.questrail.concord.observability.EntityKind;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * SessionSequencer
 * =============================================================================
 * Keeps every replica of a session on the same strictly ordered move log.
 *
 * <h2>Ordering</h2>
 * A move is accepted only if its sequence equals the session's next expected
 * sequence. Gaps and duplicates are dropped and reported; nothing is buffered
 * and the session is left untouched.
 *
 * <h2>State</h2>
 * Each accepted move runs the {@link SessionStateRule} for the session type.
 * Outbound moves carry the digest of the resulting state; an inbound move whose
 * digest differs from the local one is reported as a divergence and still
 * accepted.
 *
 * <h2>Checkpoints</h2>
 * Taken after an accepted move (or on a tick, if moves are pending) once either
 * threshold of the {@code CoordinationPolicy} is reached: the move interval, or
 * the time interval since the previous checkpoint. A checkpoint failure is
 * reported and never rolls back the move.
 */
public final class SessionSequencer
{
    private final CoordinationContext context;
    private final SessionStore store;
    private final SessionStateRules rules;

    public SessionSequencer(CoordinationContext context, SessionStore store, SessionStateRules rules) {
        this.context = Objects.requireNonNull(context, "context");
        this.store = Objects.requireNonNull(store, "store");
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    // ------------------------------------------------------------------------
    // Local operations
    // ------------------------------------------------------------------------

    public String createSession(String sessionType, Map<String, Object> initialState) {
        Objects.requireNonNull(sessionType, "sessionType");
        Objects.requireNonNull(initialState, "initialState");

        String id = context.nextId();
        Instant now = context.now();
        Session session = new Session(id, context.localPeerId(), sessionType, initialState, now);
        store.add(session);
        context.transition(EntityKind.SESSION, id, null, session.status(), "type=" + sessionType);

        context.publisher().broadcast(ProtocolChannel.SESSION, new SessionOpened(
                context.localPeerId(), now, id, sessionType, initialState));
        return id;
    }

    /**
     * @return {@code false} if the session is unknown or not ACTIVE
     */
    public boolean makeMove(String sessionId, Map<String, Object> payload) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(payload, "payload");

        Optional<Session> found = store.session(sessionId);
        if (found.isEmpty() || !found.get().isActive()) {
            return false;
        }

        Session session = found.get();
        Instant now = context.now();
        Move move = new Move(context.localPeerId(), payload, session.nextSequence(), now);
        session.append(move);
        session.addParticipant(context.localPeerId());
        String digest = applyRule(session, move);

        context.publisher().broadcast(ProtocolChannel.SESSION, new MoveMade(
                context.localPeerId(), now, sessionId, move.sequence(), payload, digest));

        checkpointIfDue(session, now);
        return true;
    }

    /**
     * Creator only.
     *
     * @return {@code false} if the session is unknown, already ended, or not
     *         created by this peer
     */
    public boolean endSession(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");

        Optional<Session> found = store.session(sessionId);
        if (found.isEmpty()) {
            return false;
        }
        Session session = found.get();
        if (!session.isActive() || !session.creator().equals(context.localPeerId())) {
            return false;
        }

        end(session, "by " + context.localPeerId());
        context.publisher().broadcast(ProtocolChannel.SESSION, new SessionEnded(
                context.localPeerId(), context.now(), sessionId));
        return true;
    }

    /**
     * Evaluate the time threshold for every active session with moves since its
     * last checkpoint.
     *
     * @return number of checkpoints taken
     */
    public int checkpointDue() {
        Instant now = context.now();
        int taken = 0;
        for (Session session : store.active()) {
            if (checkpointIfDue(session, now)) {
                taken++;
            }
        }
        return taken;
    }

    // ------------------------------------------------------------------------
    // Inbound handlers
    // ------------------------------------------------------------------------

    public boolean onSessionOpened(SessionOpened message) {
        Objects.requireNonNull(message, "message");

        Session session = new Session(
                message.sessionId(), message.senderId(), message.sessionType(), message.initialState(), message.timestamp());
        if (!store.add(session)) {
            context.dropped(ProtocolChannel.SESSION, DropReason.STALE, message.senderId(),
                    "duplicate session " + message.sessionId());
            return false;
        }
        context.transition(EntityKind.SESSION, session.id(), null, session.status(),
                "type=" + session.type() + " creator=" + session.creator());
        return true;
    }

    public boolean onMoveReceived(MoveMade message) {
        Objects.requireNonNull(message, "message");

        Optional<Session> found = store.session(message.sessionId());
        if (found.isEmpty()) {
            context.dropped(ProtocolChannel.SESSION, DropReason.UNKNOWN_ENTITY, message.senderId(),
                    "session " + message.sessionId());
            return false;
        }

        Session session = found.get();
        if (!session.isActive()) {
            context.dropped(ProtocolChannel.SESSION, DropReason.STALE, message.senderId(),
                    "session " + session.id() + " is " + session.status());
            return false;
        }
        if (message.moveSequence() != session.nextSequence()) {
            context.dropped(ProtocolChannel.SESSION, DropReason.OUT_OF_ORDER, message.senderId(),
                    "session " + session.id() + " expected " + session.nextSequence()
                            + " got " + message.moveSequence());
            return false;
        }

        Instant now = context.now();
        Move move = new Move(message.senderId(), message.movePayload(), message.moveSequence(), now);
        session.append(move);
        session.addParticipant(message.senderId());
        String localDigest = applyRule(session, move);

        message.optionalStateDigest()
                .filter(remote -> !remote.equals(localDigest))
                .ifPresent(remote -> diverged(session.id(), move.sequence() + 1, message.senderId(), localDigest, remote));

        checkpointIfDue(session, now);
        return true;
    }

    public boolean onSessionEnded(SessionEnded message) {
        Objects.requireNonNull(message, "message");

        Optional<Session> found = store.session(message.sessionId());
        if (found.isEmpty()) {
            context.dropped(ProtocolChannel.SESSION, DropReason.UNKNOWN_ENTITY, message.senderId(),
                    "session " + message.sessionId());
            return false;
        }

        Session session = found.get();
        if (!session.creator().equals(message.senderId())) {
            context.dropped(ProtocolChannel.SESSION, DropReason.NOT_PERMITTED, message.senderId(),
                    "only " + session.creator() + " may end session " + session.id());
            return false;
        }
        if (!session.isActive()) {
            context.dropped(ProtocolChannel.SESSION, DropReason.STALE, message.senderId(),
                    "session " + session.id() + " already ended");
            return false;
        }

        end(session, "by " + message.senderId());
        return true;
    }

    /**
     * Compare a peer's checkpoint with the local one at the same sequence.
     * Absent a local checkpoint at that sequence there is nothing to compare.
     */
    public boolean onCheckpointAnnounced(CheckpointAnnounced message) {
        Objects.requireNonNull(message, "message");

        Optional<Session> found = store.session(message.sessionId());
        if (found.isEmpty()) {
            context.dropped(ProtocolChannel.SESSION, DropReason.UNKNOWN_ENTITY, message.senderId(),
                    "session " + message.sessionId());
            return false;
        }

        Session session = found.get();
        session.checkpoints().stream()
                .filter(cp -> cp.sequence() == message.sequence())
                .findFirst()
                .filter(cp -> !cp.stateDigest().equals(message.stateDigest()))
                .ifPresent(cp -> diverged(session.id(), cp.sequence(), message.senderId(),
                        cp.stateDigest(), message.stateDigest()));
        return true;
    }

    // ------------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------------

    private String applyRule(Session session, Move move) {
        rules.forType(session.type()).apply(session.state(), move);
        return StateDigests.digest(session.state());
    }

    private void end(Session session, String detail) {
        SessionStatus previous = session.status();
        session.end();
        context.transition(EntityKind.SESSION, session.id(), previous, session.status(), detail);
    }

    private void diverged(String sessionId, long sequence, String peerId, String local, String remote) {
        context.observabilitySink().onDivergence(new DivergenceEvent(context.now(), sessionId, sequence, peerId, local, remote));
    }

    private boolean checkpointIfDue(Session session, Instant now) {
        int pending = session.movesSinceCheckpoint();
        if (pending == 0) {
            return false;
        }

        Duration elapsed = Duration.between(session.lastCheckpointAt(), now);
        boolean byCount = pending >= context.policy().checkpointMoveInterval();
        boolean byTime = elapsed.compareTo(context.policy().checkpointTimeInterval()) >= 0;
        if (!byCount && !byTime) {
            return false;
        }

        try {
            Checkpoint checkpoint = new Checkpoint(
                    session.id(),
                    session.nextSequence(),
                    StateDigests.digest(session.state()),
                    session.moves().size(),
                    now);
            session.appendCheckpoint(checkpoint);
            context.transition(EntityKind.CHECKPOINT, session.id() + "@" + checkpoint.sequence(), null, "TAKEN",
                    (byCount ? "moves=" + pending : "elapsed=" + elapsed.getSeconds() + "s")
                            + " digest=" + checkpoint.stateDigest());

            context.publisher().broadcast(ProtocolChannel.SESSION, new CheckpointAnnounced(
                    context.localPeerId(), now, session.id(), checkpoint.sequence(),
                    checkpoint.stateDigest(), checkpoint.moveCount()));

            context.ledgerTargets().checkpointAnchor().ifPresent(target -> anchor(target, checkpoint));
            return true;
        } catch (RuntimeException e) {
            context.error("Checkpoint of session " + session.id() + " failed", e);
            return false;
        }
    }

    /**
     * Record the checkpoint digest on the ledger. Fire-and-forget: the
     * confirmation is not awaited.
     */
    private void anchor(String target, Checkpoint checkpoint) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", checkpoint.sessionId());
        payload.put("sequence", checkpoint.sequence());
        payload.put("stateDigest", checkpoint.stateDigest());

        try {
            long cost = context.ledger().estimateCost(target, payload);
            context.ledger().submit(target, 0L, payload, context.costLimit(cost));
        } catch (RuntimeException e) {
            context.error("Anchoring checkpoint " + checkpoint.sequence() + " of session "
                    + checkpoint.sessionId() + " failed", e);
        }
    }

    // ------------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------------

    public Optional<Session> session(String sessionId) {
        return store.session(sessionId);
    }
}
