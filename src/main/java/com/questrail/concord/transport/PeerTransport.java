package com.questrail.concord.transport;

import java.time.Duration;
import java.util.Set;

/**
 * PeerTransport
 * -----------------------------------------------------------------------------
 * Port through which the coordination engine reaches other peers.
 *
 * <p>Payloads are opaque encoded messages. Each payload travels on a named
 * channel (see {@code ProtocolChannel}); inbound payloads are handed to the
 * handler registered for their channel.</p>
 *
 * <p>Delivery is best-effort: no acknowledgement, ordering or duplicate
 * suppression is promised.</p>
 */
public interface PeerTransport
{
    /**
     * @return identity under which this peer sends
     */
    String localPeerId();

    /**
     * Send to every connected peer.
     *
     * @return number of peers the payload was handed to
     */
    int broadcast(String channel, byte[] payload);

    /**
     * Send to a single peer.
     *
     * @return {@code false} if the peer is unknown or the send could not be issued
     */
    boolean sendTo(String peerId, String channel, byte[] payload);

    /**
     * Register the inbound handler for a channel. At most one per channel; a
     * later registration replaces the earlier one.
     */
    void onMessage(String channel, PayloadHandler handler);

    /**
     * @return currently reachable remote peers, excluding the local peer
     */
    Set<String> connectedPeers();

    /**
     * Disconnect every connected peer not heard from within {@code silence}.
     * Transports without liveness tracking disconnect nobody.
     *
     * @return ids of the peers disconnected by this call
     */
    default Set<String> expireSilentPeers(Duration silence) {
        return Set.of();
    }

    void start();

    void stop();
}
