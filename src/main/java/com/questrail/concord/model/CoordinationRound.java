package com.questrail.concord.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * CoordinationRound
 * -----------------------------------------------------------------------------
 * One attempt to resolve competing intents for a single resource into a winner.
 *
 * <p>The candidate list is ordered by the resolution rule, winner first. A round
 * opened locally always names at least two candidates; a round learned from a
 * peer carries whatever candidate list the peer announced, which may be only the
 * proposed intent.</p>
 *
 * <p>Votes are keyed by peer identity. A peer has one vote slot per round.</p>
 */
public final class CoordinationRound
{
    private final String id;
    private final String resourceKey;
    private final String proposedIntentId;
    private final List<String> candidateIntentIds;
    private final Map<String, Boolean> votes = new LinkedHashMap<>();

    private RoundStatus status = RoundStatus.VOTING;

    public CoordinationRound(String id,
                             String resourceKey,
                             String proposedIntentId,
                             List<String> candidateIntentIds)
    {
        this.id = Objects.requireNonNull(id, "id");
        this.resourceKey = Objects.requireNonNull(resourceKey, "resourceKey");
        this.proposedIntentId = Objects.requireNonNull(proposedIntentId, "proposedIntentId");
        this.candidateIntentIds = List.copyOf(Objects.requireNonNull(candidateIntentIds, "candidateIntentIds"));
    }

    public String id() {
        return id;
    }

    public String resourceKey() {
        return resourceKey;
    }

    public String proposedIntentId() {
        return proposedIntentId;
    }

    public List<String> candidateIntentIds() {
        return candidateIntentIds;
    }

    public Map<String, Boolean> votes() {
        return Collections.unmodifiableMap(votes);
    }

    public RoundStatus status() {
        return status;
    }

    public boolean isVoting() {
        return status == RoundStatus.VOTING;
    }

    /**
     * Records a vote for {@code peerId}, replacing any earlier vote from that peer.
     * Votes arriving after the round resolved are ignored.
     *
     * @return {@code true} if the vote was recorded
     */
    public boolean recordVote(String peerId, boolean approve) {
        Objects.requireNonNull(peerId, "peerId");
        if (status != RoundStatus.VOTING) {
            return false;
        }
        votes.put(peerId, approve);
        return true;
    }

    public long approvals() {
        return votes.values().stream().filter(Boolean::booleanValue).count();
    }

    public void resolve(RoundStatus outcome) {
        Objects.requireNonNull(outcome, "outcome");
        if (outcome == RoundStatus.VOTING) {
            throw new IllegalArgumentException("A round cannot be resolved back to VOTING");
        }
        if (status != RoundStatus.VOTING) {
            throw new IllegalStateException("Round " + id + " already " + status);
        }
        this.status = outcome;
    }

    @Override
    public String toString() {
        return "CoordinationRound{" + id
                + ", resource=" + resourceKey
                + ", proposed=" + proposedIntentId
                + ", votes=" + votes
                + ", status=" + status + '}';
    }
}
