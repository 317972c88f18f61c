package com.questrail.concord.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Proposal
 * -----------------------------------------------------------------------------
 * A question put to the peer group, open for votes until its deadline.
 *
 * <h2>Vote slots</h2>
 * <p>Each peer identity owns exactly one slot. A later vote from the same peer
 * replaces the earlier one. Once the proposal leaves {@link ProposalStatus#ACTIVE}
 * the vote map is frozen: {@link #recordVote} refuses further entries.</p>
 */
public final class Proposal
{
    private final String id;
    private final String creator;
    private final Map<String, Object> payload;
    private final Instant createdAt;
    private final Instant deadline;
    private final Map<String, VoteRecord> votes = new LinkedHashMap<>();

    private ProposalStatus status = ProposalStatus.ACTIVE;
    private ProposalResult result;
    private OnchainStatus onchainStatus = OnchainStatus.NOT_SUBMITTED;

    public Proposal(String id,
                    String creator,
                    Map<String, Object> payload,
                    Instant createdAt,
                    Instant deadline)
    {
        this.id = Objects.requireNonNull(id, "id");
        this.creator = Objects.requireNonNull(creator, "creator");
        this.payload = JsonBlobs.deepCopy(Objects.requireNonNull(payload, "payload"));
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.deadline = Objects.requireNonNull(deadline, "deadline");
    }

    public String id() {
        return id;
    }

    public String creator() {
        return creator;
    }

    /**
     * @return a deep copy; the proposal's own payload never changes after creation
     */
    public Map<String, Object> payload() {
        return JsonBlobs.deepCopy(payload);
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant deadline() {
        return deadline;
    }

    public Map<String, VoteRecord> votes() {
        return Collections.unmodifiableMap(votes);
    }

    public ProposalStatus status() {
        return status;
    }

    public Optional<ProposalResult> result() {
        return Optional.ofNullable(result);
    }

    public OnchainStatus onchainStatus() {
        return onchainStatus;
    }

    public boolean isActive() {
        return status == ProposalStatus.ACTIVE;
    }

    /** Deadline is exclusive: a vote at exactly the deadline instant is still accepted. */
    public boolean isExpired(Instant now) {
        return now.isAfter(deadline);
    }

    /**
     * Records {@code vote} in the slot owned by {@code peerId}.
     *
     * @return {@code false} if the proposal is no longer active
     */
    public boolean recordVote(String peerId, VoteRecord vote) {
        Objects.requireNonNull(peerId, "peerId");
        Objects.requireNonNull(vote, "vote");
        if (status != ProposalStatus.ACTIVE) {
            return false;
        }
        votes.put(peerId, vote);
        return true;
    }

    public void beginFinalizing() {
        if (status != ProposalStatus.ACTIVE) {
            throw new IllegalStateException("Proposal " + id + " is " + status + ", not ACTIVE");
        }
        status = ProposalStatus.FINALIZING;
    }

    public void finalizeWith(ProposalResult result) {
        Objects.requireNonNull(result, "result");
        if (status != ProposalStatus.FINALIZING) {
            throw new IllegalStateException("Proposal " + id + " is " + status + ", not FINALIZING");
        }
        this.result = result;
        this.status = result.passed() ? ProposalStatus.PASSED : ProposalStatus.REJECTED;
    }

    public void onchainStatus(OnchainStatus onchainStatus) {
        this.onchainStatus = Objects.requireNonNull(onchainStatus, "onchainStatus");
    }

    @Override
    public String toString() {
        return "Proposal{" + id
                + ", creator=" + creator
                + ", deadline=" + deadline
                + ", votes=" + votes.size()
                + ", status=" + status
                + ", onchain=" + onchainStatus + '}';
    }
}
