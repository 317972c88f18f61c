package com.questrail.concord.transport.udp;

import com.questrail.concord.codec.ChannelFrame;
import com.questrail.concord.config.PeerDirectory;
import com.questrail.concord.observability.CoordinationErrorEvent;
import com.questrail.concord.observability.DropReason;
import com.questrail.concord.observability.EntityKind;
import com.questrail.concord.observability.EntityTransitionEvent;
import com.questrail.concord.observability.MessageDroppedEvent;
import com.questrail.concord.observability.RecordingObservabilitySink;
import com.questrail.concord.time.ManualWallClock;
import com.questrail.concord.transport.FakeDatagramEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class UdpPeerTransportTest {

    private static final InetSocketAddress BOB = new InetSocketAddress("127.0.0.1", 9201);
    private static final InetSocketAddress CAROL = new InetSocketAddress("127.0.0.1", 9202);
    private static final InetSocketAddress STRANGER = new InetSocketAddress("127.0.0.1", 9299);
    private static final String CHANNEL = "/op/vote/1.0.0";

    private FakeDatagramEndpoint endpoint;
    private RecordingObservabilitySink sink;
    private ManualWallClock clock;
    private UdpPeerTransport transport;

    @BeforeEach
    void setUp() {
        endpoint = new FakeDatagramEndpoint();
        sink = new RecordingObservabilitySink();
        clock = new ManualWallClock(Instant.parse("2026-03-01T12:00:00Z"));
        PeerDirectory directory = PeerDirectory.builder()
                .addPeer("bob", BOB)
                .addPeer("carol", CAROL)
                .build();
        transport = new UdpPeerTransport("alice", directory, endpoint, sink, clock);
    }

    @Test
    void directoryPeersStartConnected() {
        assertEquals(Set.of("bob", "carol"), transport.connectedPeers());
        assertEquals("alice", transport.localPeerId());
    }

    @Test
    void broadcastFramesPayloadForEveryConnectedPeer() {
        byte[] payload = "hello".getBytes(StandardCharsets.UTF_8);

        assertEquals(2, transport.broadcast(CHANNEL, payload));

        assertEquals(List.of(BOB, CAROL), endpoint.destinations());
        ChannelFrame frame = endpoint.outbound().get(0).frame();
        assertEquals(CHANNEL, frame.channel());
        assertArrayEquals(payload, frame.payload());
    }

    @Test
    void sendToUnknownPeerFails() {
        assertFalse(transport.sendTo("mallory", CHANNEL, new byte[]{1}));
        assertTrue(transport.sendTo("carol", CHANNEL, new byte[]{1}));

        assertEquals(List.of(CAROL), endpoint.destinations());
    }

    @Test
    void disconnectedPeerIsSkippedByBroadcastAndQuorum() {
        assertTrue(transport.disconnectPeer("bob"));
        assertFalse(transport.disconnectPeer("bob"));

        assertEquals(Set.of("carol"), transport.connectedPeers());
        assertEquals(1, transport.broadcast(CHANNEL, new byte[]{1}));
        assertEquals(List.of(CAROL), endpoint.destinations());

        List<EntityTransitionEvent> peers = sink.transitionsOf(EntityKind.PEER);
        assertEquals(1, peers.size());
        assertEquals("bob", peers.get(0).entityId());
        assertEquals("DISCONNECTED", peers.get(0).toState());
    }

    @Test
    void datagramFromDisconnectedPeerReconnectsIt() {
        transport.disconnectPeer("carol");
        transport.onMessage(CHANNEL, (channel, payload) -> {});

        endpoint.receiveFrame(CAROL, CHANNEL, new byte[]{1});

        assertEquals(Set.of("bob", "carol"), transport.connectedPeers());
        assertEquals("CONNECTED", sink.transitionsOf(EntityKind.PEER).get(1).toState());
    }

    @Test
    void connectPeerOnlyAcceptsDirectoryPeers() {
        assertFalse(transport.connectPeer("mallory"));
        assertFalse(transport.connectPeer("bob"), "already connected");

        transport.disconnectPeer("bob");
        assertTrue(transport.connectPeer("bob"));
        assertEquals(Set.of("bob", "carol"), transport.connectedPeers());
    }

    @Test
    void silentPeersExpireAndRecoverWhenHeardFrom() {
        transport.onMessage(CHANNEL, (channel, payload) -> {});
        clock.advanceSeconds(20);
        endpoint.receiveFrame(BOB, CHANNEL, new byte[]{1});
        clock.advanceSeconds(15);

        assertEquals(Set.of("carol"), transport.expireSilentPeers(Duration.ofSeconds(30)));
        assertEquals(Set.of("bob"), transport.connectedPeers());
        assertEquals(Set.of(), transport.expireSilentPeers(Duration.ofSeconds(30)));

        endpoint.receiveFrame(CAROL, CHANNEL, new byte[]{2});
        assertEquals(Set.of("bob", "carol"), transport.connectedPeers());
    }

    @Test
    void datagramFromUnknownAddressDoesNotConnectAnyone() {
        transport.disconnectPeer("bob");
        transport.onMessage(CHANNEL, (channel, payload) -> {});

        endpoint.receiveFrame(STRANGER, CHANNEL, new byte[]{1});

        assertEquals(Set.of("carol"), transport.connectedPeers());
    }

    @Test
    void inboundFrameReachesChannelHandler() {
        List<byte[]> received = new ArrayList<>();
        transport.onMessage(CHANNEL, (channel, payload) -> received.add(payload));

        endpoint.receiveFrame(BOB, CHANNEL, new byte[]{7, 7});

        assertEquals(1, received.size());
        assertArrayEquals(new byte[]{7, 7}, received.get(0));
        assertTrue(sink.getAllEvents().isEmpty());
    }

    @Test
    void unframedDatagramIsDroppedAsMalformed() {
        transport.onMessage(CHANNEL, (channel, payload) -> fail("must not be delivered"));

        endpoint.receive(BOB, new byte[]{0x00});

        List<MessageDroppedEvent> drops = sink.eventsOfType(MessageDroppedEvent.class);
        assertEquals(1, drops.size());
        assertEquals(DropReason.MALFORMED, drops.get(0).reason());
        assertEquals("<unframed>", drops.get(0).channel());
    }

    @Test
    void frameOnUnregisteredChannelIsDropped() {
        endpoint.receiveFrame(BOB, "/op/other/1.0.0", new byte[]{1});

        List<MessageDroppedEvent> drops = sink.eventsOfType(MessageDroppedEvent.class);
        assertEquals(1, drops.size());
        assertEquals(DropReason.NO_HANDLER, drops.get(0).reason());
        assertEquals("/op/other/1.0.0", drops.get(0).channel());
    }

    @Test
    void tracksEndpointLifecycle() {
        assertFalse(transport.isUp());
        transport.start();
        assertTrue(transport.isUp());
        assertTrue(endpoint.isRunning());

        endpoint.crash(new IllegalStateException("socket closed"));
        assertFalse(transport.isUp());
        assertTrue(sink.hasEventOfType(CoordinationErrorEvent.class));
    }
}
