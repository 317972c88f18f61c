package com.questrail.concord.coordination.intent;

import com.questrail.concord.coordination.CoordinationContext;
import com.questrail.concord.ledger.LedgerReceipt;
import com.questrail.concord.ledger.TxHandle;
import com.questrail.concord.message.CoordinationMessage.IntentAnnounced;
import com.questrail.concord.message.CoordinationMessage.RoundProposed;
import com.questrail.concord.message.ProtocolChannel;
import com.questrail.concord.model.CoordinationRound;
import com.questrail.concord.model.Intent;
import com.questrail.concord.model.IntentStatus;
import com.questrail.concord.model.RoundStatus;
import com.questrail.concord.observability.DropReason;
import com.questrail.concord.observability.EntityKind;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * IntentCoordinator
 * =============================================================================
 * Detects intents competing for the same resource, agrees with peers on one
 * winner, and executes it.
 *
 * <h2>Conflict detection</h2>
 * Runs whenever an intent is added (local or remote). If at least two PENDING
 * intents share the resource, they are ranked by {@link IntentOrdering#PRECEDENCE}
 * and a round is opened over the whole ranked list. The round id is derived from
 * the resource and the candidate ids, so peers that see the same conflict open
 * the same round.
 *
 * <h2>Voting</h2>
 * A {@code coordination} message is its sender's approving vote. The local peer
 * votes once per round: when it opens the round, or when it first hears of it
 * from a peer (in which case it broadcasts its own {@code coordination} message).
 * With {@code N = connected peers + 1}, the round resolves once it holds at least
 * {@code floor(N/2) + 1} votes: EXECUTED on a strict majority of approvals,
 * REJECTED otherwise. Both outcomes are terminal.
 *
 * <h2>Execution</h2>
 * A winner created locally is submitted to the ledger and its confirmation
 * awaited; a winner created elsewhere is marked EXECUTED_BY_PEER. The other
 * candidates return to PENDING.
 *
 * <h2>Threading</h2>
 * Confined to the coordination loop thread.
 */
public final class IntentCoordinator
{
    private final CoordinationContext context;
    private final IntentStore store;

    public IntentCoordinator(CoordinationContext context, IntentStore store) {
        this.context = Objects.requireNonNull(context, "context");
        this.store = Objects.requireNonNull(store, "store");
    }

    // ------------------------------------------------------------------------
    // Local operations
    // ------------------------------------------------------------------------

    /**
     * Declare a local intent, announce it and check it for conflicts.
     *
     * @return the new intent's id
     */
    public String createIntent(String resourceKey, String actionDescriptor, int priority) {
        Objects.requireNonNull(resourceKey, "resourceKey");
        Objects.requireNonNull(actionDescriptor, "actionDescriptor");

        String id = context.nextId();
        Instant createdAt = context.now();
        long cost = estimateCost(resourceKey, actionDescriptor);

        Intent intent = new Intent(id, context.localPeerId(), resourceKey, actionDescriptor, cost, priority, createdAt);
        store.add(intent);
        context.transition(EntityKind.INTENT, id, null, intent.status(), "resource=" + resourceKey);

        context.publisher().broadcast(ProtocolChannel.INTENT, new IntentAnnounced(
                context.localPeerId(), createdAt, id, resourceKey, actionDescriptor, cost, priority));

        detectConflict(resourceKey);
        return id;
    }

    private long estimateCost(String resourceKey, String actionDescriptor) {
        try {
            return context.ledger().estimateCost(resourceKey, ledgerPayload(null, resourceKey, actionDescriptor));
        } catch (RuntimeException e) {
            context.error("Cost estimate for " + resourceKey + " failed; recording 0", e);
            return 0L;
        }
    }

    // ------------------------------------------------------------------------
    // Inbound handlers
    // ------------------------------------------------------------------------

    public boolean onIntentReceived(IntentAnnounced message) {
        Objects.requireNonNull(message, "message");

        Intent intent = new Intent(
                message.intentId(),
                message.senderId(),
                message.targetResource(),
                message.actionDescriptor(),
                message.costEstimate(),
                message.priority(),
                message.timestamp());

        if (!store.add(intent)) {
            context.dropped(ProtocolChannel.INTENT, DropReason.STALE, message.senderId(),
                    "duplicate intent " + message.intentId());
            return false;
        }
        context.transition(EntityKind.INTENT, intent.id(), null, intent.status(),
                "resource=" + intent.resourceKey() + " originator=" + intent.originator());

        detectConflict(intent.resourceKey());
        return true;
    }

    public boolean onCoordinationReceived(RoundProposed message) {
        Objects.requireNonNull(message, "message");

        Optional<CoordinationRound> existing = store.round(message.roundId());
        CoordinationRound round;
        if (existing.isPresent()) {
            round = existing.get();
            if (!round.isVoting()) {
                context.dropped(ProtocolChannel.INTENT, DropReason.STALE, message.senderId(),
                        "round " + round.id() + " already " + round.status());
                return false;
            }
        } else {
            round = new CoordinationRound(
                    message.roundId(),
                    message.targetResource(),
                    message.proposedIntentId(),
                    message.candidateIntentIds());
            store.addRound(round);
            context.transition(EntityKind.ROUND, round.id(), null, round.status(),
                    "resource=" + round.resourceKey() + " proposed=" + round.proposedIntentId()
                            + " opener=" + message.senderId());
            markCoordinating(round);

            round.recordVote(context.localPeerId(), true);
            announce(round);
        }

        round.recordVote(message.senderId(), true);
        evaluate(round);
        return true;
    }

    // ------------------------------------------------------------------------
    // Conflict resolution
    // ------------------------------------------------------------------------

    private void detectConflict(String resourceKey) {
        List<Intent> pending = store.intentsFor(resourceKey).stream()
                .filter(Intent::isPending)
                .collect(Collectors.toList());
        if (pending.size() < 2) {
            return;
        }

        List<Intent> ranked = IntentOrdering.rank(pending);
        List<String> candidateIds = ranked.stream().map(Intent::id).collect(Collectors.toList());
        String roundId = IntentOrdering.roundId(resourceKey, candidateIds);

        if (store.round(roundId).isPresent()) {
            // A peer's coordination message for this set got here first.
            return;
        }

        CoordinationRound round = new CoordinationRound(roundId, resourceKey, candidateIds.get(0), candidateIds);
        store.addRound(round);
        context.transition(EntityKind.ROUND, roundId, null, round.status(),
                "resource=" + resourceKey + " proposed=" + round.proposedIntentId()
                        + " candidates=" + candidateIds.size());
        markCoordinating(round);

        round.recordVote(context.localPeerId(), true);
        announce(round);
        evaluate(round);
    }

    private void announce(CoordinationRound round) {
        context.publisher().broadcast(ProtocolChannel.INTENT, new RoundProposed(
                context.localPeerId(),
                context.now(),
                round.id(),
                round.proposedIntentId(),
                round.resourceKey(),
                round.candidateIntentIds()));
    }

    private void markCoordinating(CoordinationRound round) {
        for (String id : candidatesOf(round)) {
            store.intent(id)
                    .filter(Intent::isPending)
                    .ifPresent(intent -> setStatus(intent, IntentStatus.COORDINATING, "round=" + round.id()));
        }
    }

    private void evaluate(CoordinationRound round) {
        int totalPeers = context.totalKnownPeers();
        int quorum = totalPeers / 2 + 1;
        int votes = round.votes().size();
        if (votes < quorum) {
            return;
        }

        long approvals = round.approvals();
        RoundStatus outcome = approvals * 2 > votes ? RoundStatus.EXECUTED : RoundStatus.REJECTED;
        round.resolve(outcome);
        context.transition(EntityKind.ROUND, round.id(), RoundStatus.VOTING, outcome,
                "approvals=" + approvals + "/" + votes + " peers=" + totalPeers);

        for (String id : candidatesOf(round)) {
            if (outcome == RoundStatus.EXECUTED && id.equals(round.proposedIntentId())) {
                continue;
            }
            store.intent(id)
                    .filter(intent -> intent.status() == IntentStatus.COORDINATING)
                    .ifPresent(intent -> setStatus(intent, IntentStatus.PENDING, "round=" + round.id() + " " + outcome));
        }

        if (outcome == RoundStatus.EXECUTED) {
            executeIntent(round.proposedIntentId());
        }
    }

    private static List<String> candidatesOf(CoordinationRound round) {
        return round.candidateIntentIds().isEmpty()
                ? List.of(round.proposedIntentId())
                : round.candidateIntentIds();
    }

    // ------------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------------

    /**
     * Execute the winning intent of a round.
     *
     * @return {@code false} if the intent is unknown to this peer
     */
    public boolean executeIntent(String intentId) {
        Optional<Intent> found = store.intent(intentId);
        if (found.isEmpty()) {
            context.error("Cannot execute unknown intent " + intentId, null);
            return false;
        }

        Intent intent = found.get();
        if (!intent.originator().equals(context.localPeerId())) {
            setStatus(intent, IntentStatus.EXECUTED_BY_PEER, "originator=" + intent.originator());
            return true;
        }

        try {
            TxHandle handle = context.ledger().submit(
                    intent.resourceKey(),
                    0L,
                    ledgerPayload(intent.id(), intent.resourceKey(), intent.actionDescriptor()),
                    context.costLimit(intent.costEstimate()));
            setStatus(intent, IntentStatus.EXECUTED, "tx=" + handle.id());

            LedgerReceipt receipt = context.ledger().awaitConfirmation(handle, context.policy().confirmationTimeout());
            if (!receipt.succeeded()) {
                setStatus(intent, IntentStatus.FAILED, "tx=" + handle.id() + " " + receipt.details());
            }
        } catch (RuntimeException e) {
            setStatus(intent, IntentStatus.FAILED, e.getClass().getSimpleName());
            context.error("Ledger execution of intent " + intent.id() + " failed", e);
        }
        return true;
    }

    private void setStatus(Intent intent, IntentStatus next, String detail) {
        IntentStatus previous = intent.status();
        intent.status(next);
        context.transition(EntityKind.INTENT, intent.id(), previous, next, detail);
    }

    private static Map<String, Object> ledgerPayload(String intentId, String resourceKey, String actionDescriptor) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (intentId != null) {
            payload.put("intentId", intentId);
        }
        payload.put("resourceKey", resourceKey);
        payload.put("actionDescriptor", actionDescriptor);
        return payload;
    }

    // ------------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------------

    public Optional<Intent> intent(String intentId) {
        return store.intent(intentId);
    }

    public Optional<CoordinationRound> round(String roundId) {
        return store.round(roundId);
    }

    public List<Intent> intentsFor(String resourceKey) {
        return store.intentsFor(resourceKey);
    }
}
