package com.questrail.concord.runtime;

import com.questrail.concord.codec.MessageCodec;
import com.questrail.concord.codec.impl.JsonMessageCodec;
import com.questrail.concord.config.ConcordRuntimeConfig;
import com.questrail.concord.coordination.CoordinationContext;
import com.questrail.concord.coordination.IdGenerator;
import com.questrail.concord.coordination.MessagePublisher;
import com.questrail.concord.coordination.intent.IntentCoordinator;
import com.questrail.concord.coordination.intent.IntentStore;
import com.questrail.concord.coordination.session.SessionSequencer;
import com.questrail.concord.coordination.session.SessionStateRules;
import com.questrail.concord.coordination.session.SessionStore;
import com.questrail.concord.coordination.voting.ProposalStore;
import com.questrail.concord.coordination.voting.Tally;
import com.questrail.concord.coordination.voting.VotingCoordinator;
import com.questrail.concord.internal.decode.CoordinationMessageDecoder;
import com.questrail.concord.internal.encode.CoordinationMessageEncoder;
import com.questrail.concord.internal.exec.CoordinationDriver;
import com.questrail.concord.internal.exec.CoordinationEventHandler;
import com.questrail.concord.internal.time.MonotonicClock;
import com.questrail.concord.internal.time.MonotonicScheduler;
import com.questrail.concord.internal.time.ScheduledExecutorScheduler;
import com.questrail.concord.internal.time.SystemMonotonicClock;
import com.questrail.concord.internal.time.SystemWallClock;
import com.questrail.concord.internal.time.WallClock;
import com.questrail.concord.ledger.LedgerClient;
import com.questrail.concord.message.CoordinationMessage.CheckpointAnnounced;
import com.questrail.concord.message.CoordinationMessage.IntentAnnounced;
import com.questrail.concord.message.CoordinationMessage.MoveMade;
import com.questrail.concord.message.CoordinationMessage.ProposalAnnounced;
import com.questrail.concord.message.CoordinationMessage.RoundProposed;
import com.questrail.concord.message.CoordinationMessage.SessionEnded;
import com.questrail.concord.message.CoordinationMessage.SessionOpened;
import com.questrail.concord.message.CoordinationMessage.VoteCast;
import com.questrail.concord.message.MessageKind;
import com.questrail.concord.message.ProtocolChannel;
import com.questrail.concord.model.IntentStatus;
import com.questrail.concord.model.JsonBlobs;
import com.questrail.concord.model.OnchainStatus;
import com.questrail.concord.model.Proposal;
import com.questrail.concord.model.ProposalResult;
import com.questrail.concord.model.ProposalStatus;
import com.questrail.concord.model.RoundStatus;
import com.questrail.concord.model.Session;
import com.questrail.concord.model.SessionStatus;
import com.questrail.concord.observability.CoordinationObservabilitySink;
import com.questrail.concord.observability.Slf4jCoordinationObservabilitySink;
import com.questrail.concord.router.MessageHandler;
import com.questrail.concord.router.MessageRouter;
import com.questrail.concord.transport.PeerTransport;
import com.questrail.concord.transport.udp.UdpPeerTransport;
import com.questrail.concord.transport.udp.netty.NettyUdpDatagramEndpoint;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * ConcordRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one peer.
 *
 * <pre>
 *   PeerTransport ──▶ CoordinationDriver ──▶ MessageRouter ──▶ Intent | Voting | Session
 *                          ▲                                        │
 *   local API ─────────────┘                                        ▼
 *                                                        MessagePublisher, LedgerClient
 * </pre>
 *
 * <p>Every public operation is executed on the driver's loop thread and
 * answered through a {@link CompletableFuture}. Queries return copies, never
 * live entities.</p>
 */
public final class ConcordRuntime {
    private final CoordinationDriver driver;
    private final PeerTransport transport;
    private final ScheduledExecutorService ownedSchedulerExecutor;
    private final IntentCoordinator intents;
    private final VotingCoordinator voting;
    private final SessionSequencer sessions;
    private final ConcordRuntimeConfig config;

    private ConcordRuntime(CoordinationDriver driver,
                           PeerTransport transport,
                           ScheduledExecutorService ownedSchedulerExecutor,
                           IntentCoordinator intents,
                           VotingCoordinator voting,
                           SessionSequencer sessions,
                           ConcordRuntimeConfig config) {
        this.driver = driver;
        this.transport = transport;
        this.ownedSchedulerExecutor = ownedSchedulerExecutor;
        this.intents = intents;
        this.voting = voting;
        this.sessions = sessions;
        this.config = config;
    }

    public void start() {
        driver.start();
        transport.start();
    }

    public void stop() {
        transport.stop();
        driver.stop();
        if (ownedSchedulerExecutor != null) {
            ownedSchedulerExecutor.shutdown();
            try {
                if (!ownedSchedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedSchedulerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedSchedulerExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    public String localPeerId() {
        return config.localPeerId();
    }

    /**
     * Process queued events on the calling thread. Only while not started.
     */
    public int drainPending() {
        return driver.drainPending();
    }

    // -------------------------------------------------------------------------
    // Intents
    // -------------------------------------------------------------------------

    public CompletableFuture<String> createIntent(String resourceKey, String actionDescriptor) {
        return createIntent(resourceKey, actionDescriptor, config.policy().defaultPriority());
    }

    public CompletableFuture<String> createIntent(String resourceKey, String actionDescriptor, int priority) {
        return driver.call("createIntent", () -> intents.createIntent(resourceKey, actionDescriptor, priority));
    }

    public CompletableFuture<Optional<IntentStatus>> intentStatus(String intentId) {
        return driver.call("intentStatus", () -> intents.intent(intentId).map(i -> i.status()));
    }

    public CompletableFuture<Optional<RoundStatus>> roundStatus(String roundId) {
        return driver.call("roundStatus", () -> intents.round(roundId).map(r -> r.status()));
    }

    // -------------------------------------------------------------------------
    // Proposals
    // -------------------------------------------------------------------------

    public CompletableFuture<String> createProposal(Map<String, Object> payload) {
        return createProposal(payload, config.policy().defaultVotingDuration());
    }

    public CompletableFuture<String> createProposal(Map<String, Object> payload, Duration votingDuration) {
        return driver.call("createProposal", () -> voting.createProposal(payload, votingDuration));
    }

    public CompletableFuture<Boolean> submitVote(String proposalId, boolean decision, long weight) {
        return driver.call("submitVote", () -> voting.submitVote(proposalId, decision, weight));
    }

    public CompletableFuture<Optional<ProposalStatus>> proposalStatus(String proposalId) {
        return driver.call("proposalStatus", () -> voting.proposal(proposalId).map(Proposal::status));
    }

    public CompletableFuture<Optional<ProposalResult>> proposalResult(String proposalId) {
        return driver.call("proposalResult", () -> voting.proposal(proposalId).flatMap(Proposal::result));
    }

    public CompletableFuture<Optional<OnchainStatus>> onchainStatus(String proposalId) {
        return driver.call("onchainStatus", () -> voting.proposal(proposalId).map(Proposal::onchainStatus));
    }

    public CompletableFuture<Optional<Tally>> tally(String proposalId) {
        return driver.call("tally", () -> voting.tally(proposalId));
    }

    // -------------------------------------------------------------------------
    // Sessions
    // -------------------------------------------------------------------------

    public CompletableFuture<String> createSession(String sessionType, Map<String, Object> initialState) {
        return driver.call("createSession", () -> sessions.createSession(sessionType, initialState));
    }

    public CompletableFuture<Boolean> makeMove(String sessionId, Map<String, Object> payload) {
        return driver.call("makeMove", () -> sessions.makeMove(sessionId, payload));
    }

    public CompletableFuture<Boolean> endSession(String sessionId) {
        return driver.call("endSession", () -> sessions.endSession(sessionId));
    }

    public CompletableFuture<Optional<SessionStatus>> sessionStatus(String sessionId) {
        return driver.call("sessionStatus", () -> sessions.session(sessionId).map(Session::status));
    }

    public CompletableFuture<Optional<Map<String, Object>>> sessionState(String sessionId) {
        return driver.call("sessionState",
                () -> sessions.session(sessionId).map(s -> JsonBlobs.deepCopy(s.state())));
    }

    public CompletableFuture<Optional<Long>> sessionSequence(String sessionId) {
        return driver.call("sessionSequence", () -> sessions.session(sessionId).map(Session::nextSequence));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ConcordRuntimeConfig config;
        private LedgerClient ledger;
        private PeerTransport transport;
        private CoordinationObservabilitySink observabilitySink = new Slf4jCoordinationObservabilitySink();
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicClock monotonicClock = SystemMonotonicClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private IdGenerator ids = IdGenerator.randomUuids();
        private SessionStateRules sessionRules = SessionStateRules.withDefaults();
        private MessageCodec codec = new JsonMessageCodec();

        public Builder withConfig(ConcordRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withLedgerClient(LedgerClient ledger) {
            this.ledger = ledger;
            return this;
        }

        /**
         * Replace the UDP transport built from the config.
         */
        public Builder withTransport(PeerTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder withObservabilitySink(CoordinationObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withWallClock(WallClock clock) {
            this.wallClock = clock;
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock clock) {
            this.monotonicClock = clock;
            return this;
        }

        /**
         * Tick scheduler. When absent the runtime creates and owns a
         * single-threaded executor.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withIdGenerator(IdGenerator ids) {
            this.ids = ids;
            return this;
        }

        public Builder withSessionRules(SessionStateRules rules) {
            this.sessionRules = rules;
            return this;
        }

        public Builder withCodec(MessageCodec codec) {
            this.codec = codec;
            return this;
        }

        public ConcordRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(ledger, "ledger");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(monotonicClock, "monotonicClock");
            Objects.requireNonNull(ids, "ids");
            Objects.requireNonNull(sessionRules, "sessionRules");
            Objects.requireNonNull(codec, "codec");

            // 1. Transport
            PeerTransport peerTransport = transport;
            if (peerTransport == null) {
                peerTransport = new UdpPeerTransport(
                        config.localPeerId(),
                        config.peers(),
                        new NettyUdpDatagramEndpoint(config.bindAddress()),
                        observabilitySink,
                        wallClock);
            } else if (!peerTransport.localPeerId().equals(config.localPeerId())) {
                throw new IllegalArgumentException("Transport peer id " + peerTransport.localPeerId()
                        + " does not match configured " + config.localPeerId());
            }

            // 2. Tick scheduling
            ScheduledExecutorService ownedExecutor = null;
            MonotonicScheduler tickScheduler = scheduler;
            if (tickScheduler == null) {
                ownedExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "concord-tick-" + config.localPeerId());
                    t.setDaemon(true);
                    return t;
                });
                tickScheduler = new ScheduledExecutorScheduler(ownedExecutor, monotonicClock);
            }

            // 3. Coordinators
            MessagePublisher publisher = new MessagePublisher(
                    peerTransport, new CoordinationMessageEncoder(), codec, observabilitySink, wallClock);
            CoordinationContext context = new CoordinationContext(
                    publisher, ledger, wallClock, observabilitySink, config.policy(), config.ledgerTargets(), ids);

            IntentCoordinator intentCoordinator = new IntentCoordinator(context, new IntentStore());
            VotingCoordinator votingCoordinator = new VotingCoordinator(context, new ProposalStore());
            SessionSequencer sessionSequencer = new SessionSequencer(context, new SessionStore(), sessionRules);

            // 4. Routing
            MessageRouter router = new MessageRouter(codec, new CoordinationMessageDecoder(), observabilitySink, wallClock);
            String intentChannel = ProtocolChannel.INTENT.id();
            String voteChannel = ProtocolChannel.VOTE.id();
            String sessionChannel = ProtocolChannel.SESSION.id();

            router.registerHandler(intentChannel, MessageKind.INTENT,
                    MessageHandler.of(IntentAnnounced.class, intentCoordinator::onIntentReceived));
            router.registerHandler(intentChannel, MessageKind.COORDINATION,
                    MessageHandler.of(RoundProposed.class, intentCoordinator::onCoordinationReceived));
            router.registerHandler(voteChannel, MessageKind.PROPOSAL,
                    MessageHandler.of(ProposalAnnounced.class, votingCoordinator::onProposalReceived));
            router.registerHandler(voteChannel, MessageKind.VOTE,
                    MessageHandler.of(VoteCast.class, votingCoordinator::onVoteReceived));
            router.registerHandler(sessionChannel, MessageKind.SESSION_OPENED,
                    MessageHandler.of(SessionOpened.class, sessionSequencer::onSessionOpened));
            router.registerHandler(sessionChannel, MessageKind.MOVE,
                    MessageHandler.of(MoveMade.class, sessionSequencer::onMoveReceived));
            router.registerHandler(sessionChannel, MessageKind.SESSION_ENDED,
                    MessageHandler.of(SessionEnded.class, sessionSequencer::onSessionEnded));
            router.registerHandler(sessionChannel, MessageKind.CHECKPOINT,
                    MessageHandler.of(CheckpointAnnounced.class, sessionSequencer::onCheckpointAnnounced));

            // 5. Driver
            PeerTransport livePeers = peerTransport;
            Duration peerSilence = config.peerSilenceTimeout();
            CoordinationDriver driver = new CoordinationDriver(
                    new CoordinationEventHandler() {
                        @Override
                        public void onInbound(String channel, byte[] payload) {
                            router.dispatch(channel, payload);
                        }

                        @Override
                        public void onTick() {
                            if (!peerSilence.isZero()) {
                                livePeers.expireSilentPeers(peerSilence);
                            }
                            votingCoordinator.finalizeExpired();
                            sessionSequencer.checkpointDue();
                        }
                    },
                    monotonicClock,
                    tickScheduler,
                    config.policy().tickInterval(),
                    wallClock,
                    observabilitySink);

            // 6. Inbound payloads enter the loop, never the coordinators directly.
            for (ProtocolChannel channel : ProtocolChannel.values()) {
                peerTransport.onMessage(channel.id(), driver::deliver);
            }

            return new ConcordRuntime(driver, peerTransport, ownedExecutor,
                    intentCoordinator, votingCoordinator, sessionSequencer, config);
        }
    }
}
