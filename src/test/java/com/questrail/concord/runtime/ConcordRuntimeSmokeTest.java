package com.questrail.concord.runtime;

import com.questrail.concord.config.ConcordRuntimeConfig;
import com.questrail.concord.ledger.FakeLedgerClient;
import com.questrail.concord.model.OnchainStatus;
import com.questrail.concord.model.ProposalStatus;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full stack on a real loop thread and a real UDP socket (ephemeral port).
 */
class ConcordRuntimeSmokeTest {

    @Test
    void fullStackLifecycle() throws Exception {
        ConcordRuntime runtime = ConcordRuntime.builder()
                .withConfig(ConcordRuntimeConfig.builder()
                        .withLocalPeerId("solo")
                        .withBindAddress(new InetSocketAddress("127.0.0.1", 0))
                        .build())
                .withLedgerClient(new FakeLedgerClient())
                .build();

        runtime.start();
        try {
            String id = runtime.createProposal(Map.of("title", "solo")).get(2, TimeUnit.SECONDS);
            assertTrue(runtime.submitVote(id, true, 1).get(2, TimeUnit.SECONDS));

            assertEquals(Optional.of(ProposalStatus.PASSED), runtime.proposalStatus(id).get(2, TimeUnit.SECONDS));
            assertEquals(Optional.of(OnchainStatus.CONFIRMED), runtime.onchainStatus(id).get(2, TimeUnit.SECONDS));
        } finally {
            runtime.stop();
        }

        assertTrue(runtime.createIntent("r", "a").isCompletedExceptionally());
    }
}
