package com.questrail.concord.config;

import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ConcordRuntimeConfigTest {

    private static final InetSocketAddress BIND = new InetSocketAddress("127.0.0.1", 0);

    @Test
    void buildsWithDefaults() {
        ConcordRuntimeConfig config = ConcordRuntimeConfig.builder()
                .withLocalPeerId("alice")
                .withBindAddress(BIND)
                .build();

        assertTrue(config.peers().allPeers().isEmpty());
        assertEquals(CoordinationPolicy.defaults(), config.policy());
        assertEquals("governance", config.ledgerTargets().governanceTarget());
        assertTrue(config.ledgerTargets().checkpointAnchor().isEmpty());
        assertEquals(Duration.ZERO, config.peerSilenceTimeout());
    }

    @Test
    void peerSilenceTimeoutMustNotBeNegative() {
        assertThrows(IllegalArgumentException.class, () -> ConcordRuntimeConfig.builder()
                .withLocalPeerId("alice")
                .withBindAddress(BIND)
                .withPeerSilenceTimeout(Duration.ofSeconds(-1))
                .build());
    }

    @Test
    void localPeerMustNotBeInDirectory() {
        PeerDirectory peers = PeerDirectory.builder()
                .addPeer("alice", new InetSocketAddress("127.0.0.1", 9300))
                .build();

        assertThrows(IllegalArgumentException.class, () -> ConcordRuntimeConfig.builder()
                .withLocalPeerId("alice")
                .withBindAddress(BIND)
                .withPeers(peers)
                .build());
    }

    @Test
    void requiresIdentityAndBindAddress() {
        assertThrows(NullPointerException.class,
                () -> ConcordRuntimeConfig.builder().withBindAddress(BIND).build());
        assertThrows(IllegalArgumentException.class,
                () -> ConcordRuntimeConfig.builder().withLocalPeerId(" ").withBindAddress(BIND).build());
        assertThrows(NullPointerException.class,
                () -> ConcordRuntimeConfig.builder().withLocalPeerId("alice").build());
    }

    @Test
    void directoryRejectsDuplicatesAndResolvesKnownPeers() {
        InetSocketAddress bob = new InetSocketAddress("127.0.0.1", 9301);
        PeerDirectory.Builder builder = PeerDirectory.builder().addPeer("bob", bob);

        assertThrows(IllegalArgumentException.class, () -> builder.addPeer("bob", bob));
        PeerDirectory directory = builder.build();
        assertEquals(bob, directory.resolve("bob").orElseThrow());
        assertTrue(directory.resolve("carol").isEmpty());
        assertEquals("bob", directory.peerAt(new InetSocketAddress("127.0.0.1", 9301)).orElseThrow());
        assertTrue(directory.peerAt(new InetSocketAddress("127.0.0.1", 9399)).isEmpty());
    }

    @Test
    void ledgerTargetsValidateNames() {
        assertThrows(IllegalArgumentException.class, () -> new LedgerTargets(" ", null));
        assertThrows(IllegalArgumentException.class, () -> new LedgerTargets("governance", ""));
        assertEquals("anchors", new LedgerTargets("governance", "anchors").checkpointAnchor().orElseThrow());
    }
}
