package com.questrail.concord.coordination;

import com.questrail.concord.codec.MessageCodec;
import com.questrail.concord.codec.impl.JsonMessageCodec;
import com.questrail.concord.config.CoordinationPolicy;
import com.questrail.concord.config.LedgerTargets;
import com.questrail.concord.coordination.intent.IntentCoordinator;
import com.questrail.concord.coordination.intent.IntentStore;
import com.questrail.concord.coordination.session.SessionSequencer;
import com.questrail.concord.coordination.session.SessionStateRules;
import com.questrail.concord.coordination.session.SessionStore;
import com.questrail.concord.coordination.voting.ProposalStore;
import com.questrail.concord.coordination.voting.VotingCoordinator;
import com.questrail.concord.internal.decode.CoordinationMessageDecoder;
import com.questrail.concord.internal.encode.CoordinationMessageEncoder;
import com.questrail.concord.ledger.FakeLedgerClient;
import com.questrail.concord.message.CoordinationMessage;
import com.questrail.concord.message.MessageKind;
import com.questrail.concord.message.ProtocolChannel;
import com.questrail.concord.observability.RecordingObservabilitySink;
import com.questrail.concord.router.MessageHandler;
import com.questrail.concord.router.MessageRouter;
import com.questrail.concord.time.ManualWallClock;
import com.questrail.concord.transport.PeerTransport;
import com.questrail.concord.transport.QueuedPeerNetwork;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * TestPeer
 * -----------------------------------------------------------------------------
 * One peer's coordinators wired straight onto a {@link QueuedPeerNetwork},
 * without a driver thread. Inbound payloads are routed synchronously when the
 * network is pumped, so tests control interleaving exactly.
 *
 * <p>Ids are {@code <peerId>-1}, {@code <peerId>-2}, ...</p>
 */
public final class TestPeer {

    public final String id;
    public final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    public final FakeLedgerClient ledger;
    public final IntentCoordinator intents;
    public final VotingCoordinator voting;
    public final SessionSequencer sessions;
    public final MessageRouter router;

    private final PeerTransport transport;
    private final MessageCodec codec = new JsonMessageCodec();
    private final CoordinationMessageEncoder encoder = new CoordinationMessageEncoder();

    private TestPeer(String id,
                     PeerTransport transport,
                     ManualWallClock clock,
                     FakeLedgerClient ledger,
                     CoordinationPolicy policy,
                     LedgerTargets targets) {
        this.id = id;
        this.transport = transport;
        this.ledger = ledger;

        AtomicInteger counter = new AtomicInteger();
        MessagePublisher publisher = new MessagePublisher(transport, encoder, codec, sink, clock);
        CoordinationContext context = new CoordinationContext(
                publisher, ledger, clock, sink, policy, targets, () -> id + "-" + counter.incrementAndGet());

        this.intents = new IntentCoordinator(context, new IntentStore());
        this.voting = new VotingCoordinator(context, new ProposalStore());
        this.sessions = new SessionSequencer(context, new SessionStore(), SessionStateRules.withDefaults());

        this.router = new MessageRouter(codec, new CoordinationMessageDecoder(), sink, clock);
        String intent = ProtocolChannel.INTENT.id();
        String vote = ProtocolChannel.VOTE.id();
        String session = ProtocolChannel.SESSION.id();
        router.registerHandler(intent, MessageKind.INTENT,
                MessageHandler.of(CoordinationMessage.IntentAnnounced.class, intents::onIntentReceived));
        router.registerHandler(intent, MessageKind.COORDINATION,
                MessageHandler.of(CoordinationMessage.RoundProposed.class, intents::onCoordinationReceived));
        router.registerHandler(vote, MessageKind.PROPOSAL,
                MessageHandler.of(CoordinationMessage.ProposalAnnounced.class, voting::onProposalReceived));
        router.registerHandler(vote, MessageKind.VOTE,
                MessageHandler.of(CoordinationMessage.VoteCast.class, voting::onVoteReceived));
        router.registerHandler(session, MessageKind.SESSION_OPENED,
                MessageHandler.of(CoordinationMessage.SessionOpened.class, sessions::onSessionOpened));
        router.registerHandler(session, MessageKind.MOVE,
                MessageHandler.of(CoordinationMessage.MoveMade.class, sessions::onMoveReceived));
        router.registerHandler(session, MessageKind.SESSION_ENDED,
                MessageHandler.of(CoordinationMessage.SessionEnded.class, sessions::onSessionEnded));
        router.registerHandler(session, MessageKind.CHECKPOINT,
                MessageHandler.of(CoordinationMessage.CheckpointAnnounced.class, sessions::onCheckpointAnnounced));

        for (ProtocolChannel channel : ProtocolChannel.values()) {
            transport.onMessage(channel.id(), router::dispatch);
        }
    }

    public static TestPeer join(QueuedPeerNetwork network, String id, ManualWallClock clock) {
        return join(network, id, clock, new FakeLedgerClient(), CoordinationPolicy.defaults(), LedgerTargets.defaults());
    }

    public static TestPeer join(QueuedPeerNetwork network,
                                String id,
                                ManualWallClock clock,
                                FakeLedgerClient ledger,
                                CoordinationPolicy policy,
                                LedgerTargets targets) {
        return new TestPeer(id, network.join(id), clock, ledger, policy, targets);
    }

    /**
     * Deliver {@code message} to this peer as if it had arrived on the wire.
     *
     * @return whether the handler ran to completion
     */
    public boolean receive(ProtocolChannel channel, CoordinationMessage message) {
        return router.dispatch(channel.id(), codec.encode(encoder.encode(message)));
    }

    public PeerTransport transport() {
        return transport;
    }
}
