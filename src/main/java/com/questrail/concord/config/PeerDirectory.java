package com.questrail.concord.config;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Static peer directory for the UDP transport.
 * Maps remote peer ids to their datagram addresses. The local peer is not listed.
 */
public final class PeerDirectory {
    private final Map<String, InetSocketAddress> peers;

    private PeerDirectory(Map<String, InetSocketAddress> peers) {
        this.peers = Collections.unmodifiableMap(new LinkedHashMap<>(peers));
    }

    /**
     * Resolves a peer id to its address.
     */
    public Optional<InetSocketAddress> resolve(String peerId) {
        return Optional.ofNullable(peers.get(peerId));
    }

    /**
     * Reverse lookup: the peer configured at {@code address}, if any.
     */
    public Optional<String> peerAt(SocketAddress address) {
        for (Map.Entry<String, InetSocketAddress> e : peers.entrySet()) {
            if (e.getValue().equals(address)) {
                return Optional.of(e.getKey());
            }
        }
        return Optional.empty();
    }

    /**
     * Returns all configured remote peer ids, in registration order.
     */
    public Set<String> allPeers() {
        return peers.keySet();
    }

    public static PeerDirectory empty() {
        return new PeerDirectory(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, InetSocketAddress> peers = new LinkedHashMap<>();

        public Builder addPeer(String peerId, InetSocketAddress address) {
            Objects.requireNonNull(peerId, "peerId");
            if (peerId.isBlank()) {
                throw new IllegalArgumentException("peerId must not be blank");
            }
            if (peers.containsKey(peerId)) {
                throw new IllegalArgumentException("Duplicate peer: " + peerId);
            }
            peers.put(peerId, Objects.requireNonNull(address, "address"));
            return this;
        }

        public PeerDirectory build() {
            return new PeerDirectory(peers);
        }
    }
}
