package com.questrail.concord.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a datagram-based transport (UDP-style).
 *
 * <p>The endpoint moves whole datagrams only. Channel framing, peer lookup and
 * message decoding live above it, in {@code UdpPeerTransport}.</p>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test harness.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Start the endpoint and begin receiving datagrams.
     *
     * <p>On successful bind the listener receives
     * {@link DatagramEndpointListener#onTransportUp()} once.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources. The listener
     * receives {@link DatagramEndpointListener#onTransportDown(Throwable)}.
     */
    void stop();

    /**
     * Send one datagram. Silently discarded if the endpoint is not up.
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Must be called before {@link #start()}.
     */
    void setListener(DatagramEndpointListener listener);
}
