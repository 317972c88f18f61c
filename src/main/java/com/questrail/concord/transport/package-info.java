/**
 * Concord Transport Ports
 * =============================================================================
 *
 * Framework-agnostic boundary between the coordination engine and the network.
 *
 * <p>{@link com.questrail.concord.transport.PeerTransport} is what the engine
 * sees: peer ids, named channels and opaque payloads. The datagram ports below
 * it keep Netty types out of everything above the UDP adapter; upper layers see
 * only {@code byte[]} payloads and {@link java.net.SocketAddress} endpoints.</p>
 *
 * <h2>Constraints</h2>
 * Implementations of these ports:
 * <ul>
 *   <li>perform transport I/O only</li>
 *   <li>do not decode messages or interpret their kinds</li>
 *   <li>do not retry, acknowledge or reorder</li>
 * </ul>
 */
package com.questrail.concord.transport;
