package com.questrail.concord.coordination;

import com.questrail.concord.config.CoordinationPolicy;
import com.questrail.concord.config.LedgerTargets;
import com.questrail.concord.internal.time.WallClock;
import com.questrail.concord.ledger.LedgerClient;
import com.questrail.concord.ledger.TimeBoundedLedgerClient;
import com.questrail.concord.message.ProtocolChannel;
import com.questrail.concord.observability.CoordinationErrorEvent;
import com.questrail.concord.observability.CoordinationObservabilitySink;
import com.questrail.concord.observability.DropReason;
import com.questrail.concord.observability.EntityKind;
import com.questrail.concord.observability.EntityTransitionEvent;
import com.questrail.concord.observability.MessageDroppedEvent;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * CoordinationContext
 * -----------------------------------------------------------------------------
 * Collaborators shared by the three coordinators of one peer.
 *
 * <p>Each coordinator owns its store; everything else (identity, outbound
 * messages, ledger, time, policy, reporting) comes from here.</p>
 *
 * <p>Every ledger call made through {@link #ledger()} is bounded by the
 * policy's confirmation timeout; an overrun surfaces as a
 * {@code LedgerException}.</p>
 *
 * <p>{@link #now()} is truncated to whole seconds, the precision at which
 * timestamps cross the wire. Local and remote entities therefore compare on
 * equal terms.</p>
 */
public final class CoordinationContext
{
    private final MessagePublisher publisher;
    private final LedgerClient ledger;
    private final WallClock clock;
    private final CoordinationObservabilitySink observabilitySink;
    private final CoordinationPolicy policy;
    private final LedgerTargets ledgerTargets;
    private final IdGenerator ids;

    public CoordinationContext(MessagePublisher publisher,
                               LedgerClient ledger,
                               WallClock clock,
                               CoordinationObservabilitySink observabilitySink,
                               CoordinationPolicy policy,
                               LedgerTargets ledgerTargets,
                               IdGenerator ids) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.ledger = TimeBoundedLedgerClient.bounded(Objects.requireNonNull(ledger, "ledger"), policy.confirmationTimeout());
        this.ledgerTargets = Objects.requireNonNull(ledgerTargets, "ledgerTargets");
        this.ids = Objects.requireNonNull(ids, "ids");
    }

    public String localPeerId() {
        return publisher.localPeerId();
    }

    public int totalKnownPeers() {
        return publisher.totalKnownPeers();
    }

    public Instant now() {
        return clock.now().truncatedTo(ChronoUnit.SECONDS);
    }

    public String nextId() {
        return ids.nextId();
    }

    public MessagePublisher publisher() {
        return publisher;
    }

    public LedgerClient ledger() {
        return ledger;
    }

    public CoordinationPolicy policy() {
        return policy;
    }

    public LedgerTargets ledgerTargets() {
        return ledgerTargets;
    }

    /**
     * Ledger cost limit for a given estimate under the configured multiplier.
     */
    public long costLimit(long estimate) {
        return (long) Math.ceil(Math.max(0, estimate) * policy.costLimitMultiplier());
    }

    public void transition(EntityKind kind, String entityId, Enum<?> from, Enum<?> to, String detail) {
        transition(kind, entityId, from == null ? null : from.name(), to.name(), detail);
    }

    public void transition(EntityKind kind, String entityId, String from, String to, String detail) {
        observabilitySink.onStateTransition(new EntityTransitionEvent(now(), kind, entityId, from, to, detail));
    }

    public void dropped(ProtocolChannel channel, DropReason reason, String senderId, String detail) {
        observabilitySink.onMessageDropped(new MessageDroppedEvent(now(), channel.id(), reason, senderId, detail));
    }

    public void error(String message, Throwable cause) {
        observabilitySink.onError(new CoordinationErrorEvent(now(), message, cause));
    }

    public CoordinationObservabilitySink observabilitySink() {
        return observabilitySink;
    }
}
