package com.questrail.concord.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Session
 * -----------------------------------------------------------------------------
 * A collaborative, strictly ordered sequence of moves shared among participants.
 *
 * <h2>Ordering</h2>
 * <p>The sequence counter starts at 0 and equals the number of accepted moves.
 * {@link #append(Move)} accepts a move only when its sequence equals
 * {@link #nextSequence()}; anything else (gap, duplicate, replay) is refused and
 * leaves the session untouched. Nothing is buffered.</p>
 *
 * <h2>Checkpoints</h2>
 * <p>The checkpoint list is append-only. {@link #movesSinceCheckpoint()} and
 * {@link #lastCheckpointAt()} reset each time a checkpoint is appended.</p>
 */
public final class Session
{
    private final String id;
    private final String creator;
    private final String type;
    private final Map<String, Object> state;
    private final List<Move> moves = new ArrayList<>();
    private final Set<String> participants = new LinkedHashSet<>();
    private final List<Checkpoint> checkpoints = new ArrayList<>();

    private long sequence;
    private SessionStatus status = SessionStatus.ACTIVE;
    private Instant lastCheckpointAt;
    private int movesSinceCheckpoint;

    public Session(String id,
                   String creator,
                   String type,
                   Map<String, Object> initialState,
                   Instant createdAt)
    {
        this.id = Objects.requireNonNull(id, "id");
        this.creator = Objects.requireNonNull(creator, "creator");
        this.type = Objects.requireNonNull(type, "type");
        this.state = JsonBlobs.deepCopy(Objects.requireNonNull(initialState, "initialState"));
        this.lastCheckpointAt = Objects.requireNonNull(createdAt, "createdAt");
        this.participants.add(creator);
    }

    public String id() {
        return id;
    }

    public String creator() {
        return creator;
    }

    public String type() {
        return type;
    }

    /**
     * Live, mutable state blob. Only the sequencer thread (via state rules)
     * writes to it; callers outside the sequencer take a {@link JsonBlobs#deepCopy}.
     */
    public Map<String, Object> state() {
        return state;
    }

    public List<Move> moves() {
        return Collections.unmodifiableList(moves);
    }

    public Set<String> participants() {
        return Collections.unmodifiableSet(participants);
    }

    public List<Checkpoint> checkpoints() {
        return Collections.unmodifiableList(checkpoints);
    }

    public Optional<Checkpoint> latestCheckpoint() {
        return checkpoints.isEmpty()
                ? Optional.empty()
                : Optional.of(checkpoints.get(checkpoints.size() - 1));
    }

    public long nextSequence() {
        return sequence;
    }

    public SessionStatus status() {
        return status;
    }

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    public Instant lastCheckpointAt() {
        return lastCheckpointAt;
    }

    public int movesSinceCheckpoint() {
        return movesSinceCheckpoint;
    }

    public boolean addParticipant(String peerId) {
        return participants.add(Objects.requireNonNull(peerId, "peerId"));
    }

    /**
     * Appends {@code move} if it carries the next expected sequence number.
     *
     * @return {@code false} if the move is out of order; the session is unchanged
     */
    public boolean append(Move move) {
        Objects.requireNonNull(move, "move");
        if (move.sequence() != sequence) {
            return false;
        }
        moves.add(move);
        sequence++;
        movesSinceCheckpoint++;
        return true;
    }

    public void appendCheckpoint(Checkpoint checkpoint) {
        Objects.requireNonNull(checkpoint, "checkpoint");
        Checkpoint previous = latestCheckpoint().orElse(null);
        if (previous != null
                && (checkpoint.sequence() < previous.sequence()
                    || checkpoint.timestamp().isBefore(previous.timestamp()))) {
            throw new IllegalArgumentException("Checkpoint " + checkpoint
                    + " precedes latest checkpoint " + previous);
        }
        checkpoints.add(checkpoint);
        lastCheckpointAt = checkpoint.timestamp();
        movesSinceCheckpoint = 0;
    }

    public void end() {
        status = SessionStatus.ENDED;
    }

    @Override
    public String toString() {
        return "Session{" + id
                + ", type=" + type
                + ", creator=" + creator
                + ", sequence=" + sequence
                + ", status=" + status
                + ", checkpoints=" + checkpoints.size() + '}';
    }
}
