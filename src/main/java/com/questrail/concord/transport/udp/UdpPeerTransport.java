package com.questrail.concord.transport.udp;

import com.questrail.concord.codec.ChannelFrame;
import com.questrail.concord.codec.impl.ChannelFraming;
import com.questrail.concord.config.PeerDirectory;
import com.questrail.concord.internal.time.WallClock;
import com.questrail.concord.observability.CoordinationErrorEvent;
import com.questrail.concord.observability.CoordinationObservabilitySink;
import com.questrail.concord.observability.DropReason;
import com.questrail.concord.observability.EntityKind;
import com.questrail.concord.observability.EntityTransitionEvent;
import com.questrail.concord.observability.MessageDroppedEvent;
import com.questrail.concord.transport.DatagramEndpoint;
import com.questrail.concord.transport.DatagramEndpointListener;
import com.questrail.concord.transport.PayloadHandler;
import com.questrail.concord.transport.PeerTransport;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * UdpPeerTransport
 * =============================================================================
 * {@link PeerTransport} over a {@link DatagramEndpoint} and a static
 * {@link PeerDirectory}.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   DatagramEndpoint
 *        → ChannelFraming.decode
 *            → PayloadHandler registered for the channel
 * </pre>
 *
 * <h2>Outbound path</h2>
 * <pre>
 *   (channel, payload)
 *        → ChannelFraming.encode
 *            → DatagramEndpoint.send(address of each target peer)
 * </pre>
 *
 * <p>Datagrams that fail framing, or that arrive on a channel with no handler,
 * are dropped and reported. They never reach the engine.</p>
 *
 * <h2>Peer liveness</h2>
 * Every directory peer starts out connected. A peer leaves the connected set
 * when {@link #disconnectPeer} is called or when {@link #expireSilentPeers}
 * finds it silent, and rejoins it when {@link #connectPeer} is called or a
 * datagram arrives from its address. Broadcasts reach connected peers only,
 * and quorum sizes follow {@link #connectedPeers()}.
 */
public final class UdpPeerTransport implements PeerTransport, DatagramEndpointListener
{
    private static final String UNFRAMED = "<unframed>";
    private static final String CONNECTED = "CONNECTED";
    private static final String DISCONNECTED = "DISCONNECTED";

    private final String localPeerId;
    private final PeerDirectory directory;
    private final DatagramEndpoint endpoint;
    private final CoordinationObservabilitySink observabilitySink;
    private final WallClock clock;

    private final Map<String, PayloadHandler> handlers = new ConcurrentHashMap<>();
    private final Set<String> connected = ConcurrentHashMap.newKeySet();
    // Last datagram from the peer, or the moment it (re)joined the connected set.
    private final Map<String, Instant> lastHeard = new ConcurrentHashMap<>();

    private volatile boolean up;

    public UdpPeerTransport(String localPeerId,
                            PeerDirectory directory,
                            DatagramEndpoint endpoint,
                            CoordinationObservabilitySink observabilitySink,
                            WallClock clock) {
        this.localPeerId = Objects.requireNonNull(localPeerId, "localPeerId");
        this.directory = Objects.requireNonNull(directory, "directory");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(clock, "clock");

        Instant now = clock.now();
        for (String peer : directory.allPeers()) {
            connected.add(peer);
            lastHeard.put(peer, now);
        }
        this.endpoint.setListener(this);
    }

    @Override
    public String localPeerId() {
        return localPeerId;
    }

    @Override
    public void start() {
        endpoint.start();
    }

    @Override
    public void stop() {
        endpoint.stop();
    }

    public boolean isUp() {
        return up;
    }

    @Override
    public int broadcast(String channel, byte[] payload) {
        byte[] datagram = frame(channel, payload);

        int handed = 0;
        for (String peer : directory.allPeers()) {
            if (!connected.contains(peer)) {
                continue;
            }
            Optional<InetSocketAddress> address = directory.resolve(peer);
            if (address.isPresent()) {
                endpoint.send(address.get(), datagram);
                handed++;
            }
        }
        return handed;
    }

    @Override
    public boolean sendTo(String peerId, String channel, byte[] payload) {
        Objects.requireNonNull(peerId, "peerId");

        Optional<InetSocketAddress> address = directory.resolve(peerId);
        if (address.isEmpty()) {
            return false;
        }
        endpoint.send(address.get(), frame(channel, payload));
        return true;
    }

    @Override
    public void onMessage(String channel, PayloadHandler handler) {
        handlers.put(Objects.requireNonNull(channel, "channel"), Objects.requireNonNull(handler, "handler"));
    }

    @Override
    public Set<String> connectedPeers() {
        Set<String> view = new LinkedHashSet<>();
        for (String peer : directory.allPeers()) {
            if (connected.contains(peer)) {
                view.add(peer);
            }
        }
        return Collections.unmodifiableSet(view);
    }

    /**
     * @return {@code false} if the peer is not in the directory or already connected
     */
    public boolean connectPeer(String peerId) {
        return connect(Objects.requireNonNull(peerId, "peerId"), "connected explicitly");
    }

    /**
     * @return {@code false} if the peer was not connected
     */
    public boolean disconnectPeer(String peerId) {
        return disconnect(Objects.requireNonNull(peerId, "peerId"), "disconnected explicitly");
    }

    @Override
    public Set<String> expireSilentPeers(Duration silence) {
        Objects.requireNonNull(silence, "silence");
        Instant now = clock.now();
        Set<String> expired = new LinkedHashSet<>();
        for (String peer : directory.allPeers()) {
            Instant heard = lastHeard.get(peer);
            if (connected.contains(peer) && heard != null
                    && Duration.between(heard, now).compareTo(silence) >= 0
                    && disconnect(peer, "silent since " + heard)) {
                expired.add(peer);
            }
        }
        return expired;
    }

    private boolean connect(String peerId, String detail) {
        if (!directory.allPeers().contains(peerId) || !connected.add(peerId)) {
            return false;
        }
        lastHeard.put(peerId, clock.now());
        peerTransition(peerId, DISCONNECTED, CONNECTED, detail);
        return true;
    }

    private boolean disconnect(String peerId, String detail) {
        if (!connected.remove(peerId)) {
            return false;
        }
        peerTransition(peerId, CONNECTED, DISCONNECTED, detail);
        return true;
    }

    private void peerTransition(String peerId, String from, String to, String detail) {
        observabilitySink.onStateTransition(new EntityTransitionEvent(
                clock.now(), EntityKind.PEER, peerId, from, to, detail));
    }

    private static byte[] frame(String channel, byte[] payload) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(payload, "payload");
        return ChannelFraming.encode(new ChannelFrame(channel, payload));
    }

    // -------------------------------------------------------------------------
    // DatagramEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        up = true;
    }

    @Override
    public void onTransportDown(Throwable cause) {
        up = false;
        if (cause != null) {
            observabilitySink.onError(new CoordinationErrorEvent(clock.now(), "UDP transport down", cause));
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        directory.peerAt(remote).ifPresent(peer -> {
            if (!connect(peer, "heard from " + remote)) {
                lastHeard.put(peer, clock.now());
            }
        });

        Optional<ChannelFrame> frame = ChannelFraming.decode(payload);
        if (frame.isEmpty()) {
            observabilitySink.onMessageDropped(new MessageDroppedEvent(
                    clock.now(), UNFRAMED, DropReason.MALFORMED, null,
                    "Invalid channel framing from " + remote));
            return;
        }

        ChannelFrame f = frame.get();
        PayloadHandler handler = handlers.get(f.channel());
        if (handler == null) {
            observabilitySink.onMessageDropped(new MessageDroppedEvent(
                    clock.now(), f.channel(), DropReason.NO_HANDLER, null,
                    "No handler for channel, from " + remote));
            return;
        }

        handler.onPayload(f.channel(), f.payload());
    }
}
