package com.questrail.concord.coordination.voting;

import com.questrail.concord.config.CoordinationPolicy;
import com.questrail.concord.config.LedgerTargets;
import com.questrail.concord.coordination.TestPeer;
import com.questrail.concord.ledger.FakeLedgerClient;
import com.questrail.concord.message.CoordinationMessage.ProposalAnnounced;
import com.questrail.concord.message.CoordinationMessage.VoteCast;
import com.questrail.concord.message.ProtocolChannel;
import com.questrail.concord.model.OnchainStatus;
import com.questrail.concord.model.Proposal;
import com.questrail.concord.model.ProposalResult;
import com.questrail.concord.model.ProposalStatus;
import com.questrail.concord.observability.CoordinationErrorEvent;
import com.questrail.concord.observability.DropReason;
import com.questrail.concord.time.ManualWallClock;
import com.questrail.concord.transport.QueuedPeerNetwork;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VotingCoordinatorTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");
    private static final Map<String, Object> FEE_CHANGE = Map.of("title", "raise fee", "bps", 25);

    private ManualWallClock clock;
    private QueuedPeerNetwork network;

    @BeforeEach
    void setUp() {
        clock = new ManualWallClock(T0);
        network = new QueuedPeerNetwork();
    }

    private static Proposal proposal(TestPeer peer, String id) {
        return peer.voting.proposal(id).orElseThrow();
    }

    @Test
    void weightedMajorityPassesOnceEveryPeerVoted() {
        TestPeer alice = TestPeer.join(network, "alice", clock);
        TestPeer bob = TestPeer.join(network, "bob", clock);
        TestPeer carol = TestPeer.join(network, "carol", clock);

        String id = alice.voting.createProposal(FEE_CHANGE, Duration.ofSeconds(300));
        network.deliverAll();

        assertTrue(alice.voting.submitVote(id, true, 10));
        assertTrue(bob.voting.submitVote(id, true, 5));
        assertTrue(carol.voting.submitVote(id, false, 8));
        network.deliverAll();

        for (TestPeer peer : List.of(alice, bob, carol)) {
            Proposal p = proposal(peer, id);
            assertEquals(ProposalStatus.PASSED, p.status(), peer.id);
            ProposalResult result = p.result().orElseThrow();
            assertTrue(result.passed());
            assertEquals(15, result.yesWeight());
            assertEquals(8, result.noWeight());
            assertEquals(23, result.totalWeight());
        }

        assertEquals(OnchainStatus.CONFIRMED, proposal(alice, id).onchainStatus());
        assertEquals(OnchainStatus.NOT_SUBMITTED, proposal(bob, id).onchainStatus());
        assertEquals(OnchainStatus.NOT_SUBMITTED, proposal(carol, id).onchainStatus());

        assertEquals(1, alice.ledger.submissions().size());
        FakeLedgerClient.Submission tx = alice.ledger.submissions().get(0);
        assertEquals(LedgerTargets.DEFAULT_GOVERNANCE_TARGET, tx.target());
        assertEquals(id, tx.payload().get("proposalId"));
        assertTrue(bob.ledger.submissions().isEmpty());
    }

    @Test
    void tieRejectsAndIsNeverSubmitted() {
        TestPeer alice = TestPeer.join(network, "alice", clock);
        TestPeer bob = TestPeer.join(network, "bob", clock);

        String id = alice.voting.createProposal(FEE_CHANGE, Duration.ofSeconds(300));
        network.deliverAll();
        alice.voting.submitVote(id, true, 5);
        bob.voting.submitVote(id, false, 5);
        network.deliverAll();

        Proposal p = proposal(alice, id);
        assertEquals(ProposalStatus.REJECTED, p.status());
        assertFalse(p.result().orElseThrow().passed());
        assertEquals(OnchainStatus.NOT_SUBMITTED, p.onchainStatus());
        assertTrue(alice.ledger.submissions().isEmpty());
        assertEquals(ProposalStatus.REJECTED, proposal(bob, id).status());
    }

    @Test
    void votesAfterFinalizationChangeNothing() {
        TestPeer alice = TestPeer.join(network, "alice", clock);
        TestPeer bob = TestPeer.join(network, "bob", clock);

        String id = alice.voting.createProposal(FEE_CHANGE, Duration.ofSeconds(300));
        network.deliverAll();
        alice.voting.submitVote(id, true, 3);
        bob.voting.submitVote(id, true, 1);
        network.deliverAll();
        ProposalResult before = proposal(alice, id).result().orElseThrow();

        assertFalse(alice.voting.submitVote(id, false, 100));
        alice.receive(ProtocolChannel.VOTE, new VoteCast("bob", T0, id, false, 100));

        Proposal after = proposal(alice, id);
        assertEquals(ProposalStatus.PASSED, after.status());
        assertEquals(before, after.result().orElseThrow());
        assertEquals(2, after.votes().size());
        assertTrue(after.votes().get("alice").decision());
        assertEquals(1, alice.sink.drops(DropReason.STALE).size());
    }

    @Test
    void laterVoteReplacesEarlierVoteFromSamePeer() {
        TestPeer alice = TestPeer.join(network, "alice", clock);
        TestPeer.join(network, "bob", clock);
        TestPeer.join(network, "carol", clock);

        String id = alice.voting.createProposal(FEE_CHANGE, Duration.ofSeconds(300));
        alice.voting.submitVote(id, true, 3);
        alice.voting.submitVote(id, false, 4);

        Tally tally = alice.voting.tally(id).orElseThrow();
        assertEquals(1, tally.voteCount());
        assertEquals(0, tally.yesWeight());
        assertEquals(4, tally.noWeight());
        assertEquals(ProposalStatus.ACTIVE, proposal(alice, id).status());
    }

    @Test
    void unknownProposalVotesAreRefused() {
        TestPeer alice = TestPeer.join(network, "alice", clock);
        TestPeer.join(network, "bob", clock);

        assertFalse(alice.voting.submitVote("missing", true, 1));
        alice.receive(ProtocolChannel.VOTE, new VoteCast("bob", T0, "missing", true, 1));

        assertEquals(1, alice.sink.drops(DropReason.UNKNOWN_ENTITY).size());
        assertTrue(alice.voting.tally("missing").isEmpty());
        assertTrue(network.pending().isEmpty());
    }

    @Test
    void deadlineIsExclusiveAndSweepFinalizes() {
        TestPeer alice = TestPeer.join(network, "alice", clock);
        TestPeer bob = TestPeer.join(network, "bob", clock);
        TestPeer carol = TestPeer.join(network, "carol", clock);

        String id = alice.voting.createProposal(FEE_CHANGE, Duration.ofSeconds(60));
        network.deliverAll();
        alice.voting.submitVote(id, true, 1);

        clock.advanceSeconds(60);
        assertTrue(bob.voting.submitVote(id, true, 2), "a vote at the deadline instant still counts");
        network.dropAll();

        clock.advanceSeconds(1);
        assertEquals(1, alice.voting.finalizeExpired());
        assertEquals(0, alice.voting.finalizeExpired());

        Proposal p = proposal(alice, id);
        assertEquals(ProposalStatus.PASSED, p.status());
        assertEquals(1, p.result().orElseThrow().yesWeight());
        assertEquals(T0.plusSeconds(61), p.result().orElseThrow().finalizedAt());
        assertEquals(OnchainStatus.CONFIRMED, p.onchainStatus());

        // carol saw no votes before her copy expired
        assertFalse(carol.voting.submitVote(id, true, 5));
        assertEquals(ProposalStatus.REJECTED, proposal(carol, id).status());
        assertEquals(0, proposal(carol, id).result().orElseThrow().totalWeight());
    }

    @Test
    void expiredProposalWithoutVotesIsRejected() {
        TestPeer alice = TestPeer.join(network, "alice", clock);
        TestPeer.join(network, "bob", clock);

        String id = alice.voting.createProposal(FEE_CHANGE, Duration.ofSeconds(10));
        clock.advanceSeconds(11);
        alice.voting.finalizeExpired();

        assertEquals(ProposalStatus.REJECTED, proposal(alice, id).status());
    }

    @Test
    void ledgerFailureKeepsProposalPassed() {
        TestPeer alice = TestPeer.join(network, "alice", clock,
                new FakeLedgerClient().failingSubmissions(), CoordinationPolicy.defaults(), LedgerTargets.defaults());

        String id = alice.voting.createProposal(FEE_CHANGE, Duration.ofSeconds(300));
        alice.voting.submitVote(id, true, 1);

        Proposal p = proposal(alice, id);
        assertEquals(ProposalStatus.PASSED, p.status());
        assertEquals(OnchainStatus.FAILED, p.onchainStatus());
        assertTrue(alice.sink.hasEventOfType(CoordinationErrorEvent.class));
    }

    @Test
    void confirmationOverrunMarksSubmissionFailed() {
        CoordinationPolicy policy = CoordinationPolicy.builder()
                .withConfirmationTimeout(Duration.ofMillis(200))
                .build();
        TestPeer alice = TestPeer.join(network, "alice", clock,
                new FakeLedgerClient().stallingConfirmations(Duration.ofSeconds(5)), policy, LedgerTargets.defaults());

        String id = alice.voting.createProposal(FEE_CHANGE, Duration.ofSeconds(300));
        long start = System.nanoTime();
        alice.voting.submitVote(id, true, 1);
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        Proposal p = proposal(alice, id);
        assertEquals(ProposalStatus.PASSED, p.status());
        assertEquals(OnchainStatus.FAILED, p.onchainStatus());
        assertTrue(elapsedMillis < 3_000, "coordination blocked for " + elapsedMillis + "ms");
    }

    @Test
    void revertedSubmissionIsRecordedAsFailed() {
        TestPeer alice = TestPeer.join(network, "alice", clock,
                new FakeLedgerClient().revertingConfirmations(), CoordinationPolicy.defaults(),
                new LedgerTargets("dao-treasury", null));

        String id = alice.voting.createProposal(FEE_CHANGE, Duration.ofSeconds(300));
        alice.voting.submitVote(id, true, 1);

        assertEquals(OnchainStatus.FAILED, proposal(alice, id).onchainStatus());
        assertEquals("dao-treasury", alice.ledger.submissions().get(0).target());
    }

    @Test
    void remoteProposalDeadlineIsAnchoredToAnnouncement() {
        TestPeer alice = TestPeer.join(network, "alice", clock);
        TestPeer.join(network, "bob", clock);

        ProposalAnnounced announced = new ProposalAnnounced("bob", T0.minusSeconds(30), "bob-1", "bob", FEE_CHANGE, 120);
        assertTrue(alice.receive(ProtocolChannel.VOTE, announced));
        alice.receive(ProtocolChannel.VOTE, announced);

        Proposal p = proposal(alice, "bob-1");
        assertEquals("bob", p.creator());
        assertEquals(T0.plusSeconds(90), p.deadline());
        assertEquals(FEE_CHANGE, p.payload());
        assertEquals(1, alice.sink.drops(DropReason.STALE).size());
    }

    @Test
    void negativeDurationIsRejected() {
        TestPeer alice = TestPeer.join(network, "alice", clock);

        assertThrows(IllegalArgumentException.class,
                () -> alice.voting.createProposal(FEE_CHANGE, Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class,
                () -> alice.voting.submitVote(alice.voting.createProposal(FEE_CHANGE, Duration.ofSeconds(5)), true, -1));
    }
}
