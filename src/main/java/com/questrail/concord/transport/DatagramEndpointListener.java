package com.questrail.concord.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks are serialized by the endpoint. Netty endpoints deliver them on
 * the channel's event loop.</p>
 */
public interface DatagramEndpointListener
{
    void onTransportUp();

    /**
     * @param cause diagnostic cause; {@code null} for orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called once per received datagram, with the payload copied out of any
     * framework buffer. The payload is a complete unit; no streaming.
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
