package com.questrail.concord.config;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for the Concord UDP runtime.
 *
 * <p>{@code peerSilenceTimeout}: a connected peer not heard from for this long
 * is disconnected on the next tick and no longer counts towards quorums.
 * {@link Duration#ZERO} (the default) keeps every directory peer connected
 * until it is disconnected explicitly.</p>
 */
public record ConcordRuntimeConfig(
    String localPeerId,
    InetSocketAddress bindAddress,
    PeerDirectory peers,
    CoordinationPolicy policy,
    LedgerTargets ledgerTargets,
    Duration peerSilenceTimeout
) {
    public ConcordRuntimeConfig {
        Objects.requireNonNull(localPeerId, "localPeerId");
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(peers, "peers");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(ledgerTargets, "ledgerTargets");
        Objects.requireNonNull(peerSilenceTimeout, "peerSilenceTimeout");

        if (localPeerId.isBlank()) {
            throw new IllegalArgumentException("localPeerId must not be blank");
        }
        if (peers.allPeers().contains(localPeerId)) {
            throw new IllegalArgumentException("Peer directory must not list the local peer: " + localPeerId);
        }
        if (peerSilenceTimeout.isNegative()) {
            throw new IllegalArgumentException("peerSilenceTimeout must be non-negative");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String localPeerId;
        private InetSocketAddress bindAddress;
        private PeerDirectory peers = PeerDirectory.empty();
        private CoordinationPolicy policy = CoordinationPolicy.defaults();
        private LedgerTargets ledgerTargets = LedgerTargets.defaults();
        private Duration peerSilenceTimeout = Duration.ZERO;

        public Builder withLocalPeerId(String localPeerId) {
            this.localPeerId = localPeerId;
            return this;
        }

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withPeers(PeerDirectory peers) {
            this.peers = peers;
            return this;
        }

        public Builder withPolicy(CoordinationPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder withLedgerTargets(LedgerTargets ledgerTargets) {
            this.ledgerTargets = ledgerTargets;
            return this;
        }

        public Builder withPeerSilenceTimeout(Duration peerSilenceTimeout) {
            this.peerSilenceTimeout = peerSilenceTimeout;
            return this;
        }

        public ConcordRuntimeConfig build() {
            return new ConcordRuntimeConfig(localPeerId, bindAddress, peers, policy, ledgerTargets, peerSilenceTimeout);
        }
    }
}
