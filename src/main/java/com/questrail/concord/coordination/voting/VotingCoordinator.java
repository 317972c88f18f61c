package com.questrail.concord.coordination.voting;

import com.questrail.concord.coordination.CoordinationContext;
import com.questrail.concord.ledger.LedgerReceipt;
import com.questrail.concord.ledger.TxHandle;
import com.questrail.concord.message.CoordinationMessage.ProposalAnnounced;
import com.questrail.concord.message.CoordinationMessage.VoteCast;
import com.questrail.concord.message.ProtocolChannel;
import com.questrail.concord.model.OnchainStatus;
import com.questrail.concord.model.Proposal;
import com.questrail.concord.model.ProposalResult;
import com.questrail.concord.model.ProposalStatus;
import com.questrail.concord.model.VoteRecord;
import com.questrail.concord.observability.DropReason;
import com.questrail.concord.observability.EntityKind;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * VotingCoordinator
 * =============================================================================
 * Proposal lifecycle: creation, weighted vote collection, finalization and
 * conditional ledger submission.
 *
 * <h2>State machine</h2>
 * <pre>
 *   ACTIVE ──(deadline passed | every known peer voted)──▶ FINALIZING ──▶ PASSED | REJECTED
 * </pre>
 * Terminal states never change. Each peer owns one vote slot; a later vote from
 * the same peer replaces the earlier one while the proposal is ACTIVE.
 *
 * <h2>Deadlines</h2>
 * The deadline is exclusive: a vote stamped exactly at the deadline still
 * counts. Expired proposals are finalized by {@link #finalizeExpired()}, which
 * runs at the start of every handler and on every driver tick.
 *
 * <h2>On-chain submission</h2>
 * Only the creator submits a PASSED proposal, to the governance target. A
 * ledger failure sets the on-chain status to FAILED; the outcome stays PASSED.
 */
public final class VotingCoordinator
{
    private final CoordinationContext context;
    private final ProposalStore store;

    public VotingCoordinator(CoordinationContext context, ProposalStore store) {
        this.context = Objects.requireNonNull(context, "context");
        this.store = Objects.requireNonNull(store, "store");
    }

    // ------------------------------------------------------------------------
    // Local operations
    // ------------------------------------------------------------------------

    public String createProposal(Map<String, Object> payload, Duration votingDuration) {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(votingDuration, "votingDuration");
        if (votingDuration.isNegative()) {
            throw new IllegalArgumentException("votingDuration must be non-negative");
        }

        finalizeExpired();

        String id = context.nextId();
        Instant createdAt = context.now();
        long seconds = votingDuration.getSeconds();
        Proposal proposal = new Proposal(id, context.localPeerId(), payload, createdAt, createdAt.plusSeconds(seconds));
        store.add(proposal);
        context.transition(EntityKind.PROPOSAL, id, null, proposal.status(), "deadline=" + proposal.deadline());

        context.publisher().broadcast(ProtocolChannel.VOTE, new ProposalAnnounced(
                context.localPeerId(), createdAt, id, context.localPeerId(), payload, seconds));
        return id;
    }

    /**
     * Cast (or replace) the local vote.
     *
     * @return {@code false} if the proposal is unknown, past its deadline, or no longer ACTIVE
     */
    public boolean submitVote(String proposalId, boolean decision, long weight) {
        Objects.requireNonNull(proposalId, "proposalId");

        finalizeExpired();

        Optional<Proposal> found = store.proposal(proposalId);
        if (found.isEmpty()) {
            return false;
        }
        Proposal proposal = found.get();
        Instant now = context.now();
        if (!proposal.isActive() || proposal.isExpired(now)) {
            return false;
        }

        proposal.recordVote(context.localPeerId(), new VoteRecord(decision, weight, now));
        context.publisher().broadcast(ProtocolChannel.VOTE, new VoteCast(
                context.localPeerId(), now, proposalId, decision, weight));

        checkFinalization(proposal);
        return true;
    }

    // ------------------------------------------------------------------------
    // Inbound handlers
    // ------------------------------------------------------------------------

    public boolean onProposalReceived(ProposalAnnounced message) {
        Objects.requireNonNull(message, "message");

        finalizeExpired();

        Instant deadline = message.timestamp().plusSeconds(message.votingDurationSeconds());
        Proposal proposal = new Proposal(
                message.proposalId(), message.creatorId(), message.payload(), message.timestamp(), deadline);
        if (!store.add(proposal)) {
            context.dropped(ProtocolChannel.VOTE, DropReason.STALE, message.senderId(),
                    "duplicate proposal " + message.proposalId());
            return false;
        }
        context.transition(EntityKind.PROPOSAL, proposal.id(), null, proposal.status(),
                "creator=" + proposal.creator() + " deadline=" + deadline);

        checkFinalization(proposal);
        return true;
    }

    public boolean onVoteReceived(VoteCast message) {
        Objects.requireNonNull(message, "message");

        finalizeExpired();

        Optional<Proposal> found = store.proposal(message.proposalId());
        if (found.isEmpty()) {
            context.dropped(ProtocolChannel.VOTE, DropReason.UNKNOWN_ENTITY, message.senderId(),
                    "proposal " + message.proposalId());
            return false;
        }

        Proposal proposal = found.get();
        if (!proposal.recordVote(message.senderId(),
                new VoteRecord(message.decision(), message.weight(), context.now()))) {
            context.dropped(ProtocolChannel.VOTE, DropReason.STALE, message.senderId(),
                    "proposal " + proposal.id() + " is " + proposal.status());
            return false;
        }

        checkFinalization(proposal);
        return true;
    }

    // ------------------------------------------------------------------------
    // Finalization
    // ------------------------------------------------------------------------

    /**
     * Finalize every ACTIVE proposal whose deadline has passed.
     *
     * @return number of proposals finalized
     */
    public int finalizeExpired() {
        Instant now = context.now();
        int finalized = 0;
        for (Proposal proposal : store.active()) {
            if (proposal.isExpired(now)) {
                finalizeProposal(proposal, "deadline");
                finalized++;
            }
        }
        return finalized;
    }

    private void checkFinalization(Proposal proposal) {
        if (!proposal.isActive()) {
            return;
        }
        if (proposal.isExpired(context.now())) {
            finalizeProposal(proposal, "deadline");
        } else if (proposal.votes().size() >= context.totalKnownPeers()) {
            finalizeProposal(proposal, "all peers voted");
        }
    }

    private void finalizeProposal(Proposal proposal, String trigger) {
        proposal.beginFinalizing();
        context.transition(EntityKind.PROPOSAL, proposal.id(), ProposalStatus.ACTIVE, ProposalStatus.FINALIZING, trigger);

        Tally tally = Tally.of(proposal.votes().values());
        ProposalResult result = new ProposalResult(
                tally.passes(), tally.yesWeight(), tally.noWeight(), tally.totalWeight(), context.now());
        proposal.finalizeWith(result);
        context.transition(EntityKind.PROPOSAL, proposal.id(), ProposalStatus.FINALIZING, proposal.status(),
                "yes=" + tally.yesWeight() + " no=" + tally.noWeight() + " votes=" + tally.voteCount());

        if (result.passed() && proposal.creator().equals(context.localPeerId())) {
            submitOnchain(proposal, result);
        }
    }

    private void submitOnchain(Proposal proposal, ProposalResult result) {
        String target = context.ledgerTargets().governanceTarget();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("proposalId", proposal.id());
        payload.put("payload", proposal.payload());
        payload.put("yesWeight", result.yesWeight());
        payload.put("noWeight", result.noWeight());

        try {
            long cost = context.ledger().estimateCost(target, payload);
            TxHandle handle = context.ledger().submit(target, 0L, payload, context.costLimit(cost));
            setOnchain(proposal, OnchainStatus.SUBMITTED, "tx=" + handle.id());

            LedgerReceipt receipt = context.ledger().awaitConfirmation(handle, context.policy().confirmationTimeout());
            setOnchain(proposal, receipt.succeeded() ? OnchainStatus.CONFIRMED : OnchainStatus.FAILED,
                    "tx=" + handle.id() + " " + receipt.details());
        } catch (RuntimeException e) {
            setOnchain(proposal, OnchainStatus.FAILED, e.getClass().getSimpleName());
            context.error("Ledger submission of proposal " + proposal.id() + " failed", e);
        }
    }

    private void setOnchain(Proposal proposal, OnchainStatus next, String detail) {
        OnchainStatus previous = proposal.onchainStatus();
        proposal.onchainStatus(next);
        context.transition(EntityKind.ONCHAIN_SUBMISSION, proposal.id(), previous, next, detail);
    }

    // ------------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------------

    public Optional<Proposal> proposal(String proposalId) {
        return store.proposal(proposalId);
    }

    /**
     * Current totals without finalizing.
     */
    public Optional<Tally> tally(String proposalId) {
        return store.proposal(proposalId).map(p -> Tally.of(p.votes().values()));
    }
}
