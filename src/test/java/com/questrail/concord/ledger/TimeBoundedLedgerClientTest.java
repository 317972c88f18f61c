package com.questrail.concord.ledger;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TimeBoundedLedgerClientTest {

    @Test
    void fastCallsPassThrough() {
        FakeLedgerClient fake = new FakeLedgerClient().withCost(42);
        LedgerClient client = new TimeBoundedLedgerClient(fake, Duration.ofSeconds(5));

        assertEquals(42L, client.estimateCost("t", Map.of()));
        TxHandle handle = client.submit("t", 0L, Map.of("k", "v"), 50);
        assertTrue(client.awaitConfirmation(handle, Duration.ofSeconds(2)).succeeded());

        assertEquals(1, fake.submissions().size());
        assertEquals(List.of(Duration.ofSeconds(2)), fake.confirmationTimeouts());
    }

    @Test
    void confirmationTimeoutIsCappedAtBound() {
        FakeLedgerClient fake = new FakeLedgerClient();
        LedgerClient client = new TimeBoundedLedgerClient(fake, Duration.ofSeconds(1));

        client.awaitConfirmation(new TxHandle("tx-1"), Duration.ofMinutes(10));

        assertEquals(List.of(Duration.ofSeconds(1)), fake.confirmationTimeouts());
    }

    @Test
    void overrunBecomesLedgerException() {
        LedgerClient client = new TimeBoundedLedgerClient(
                new FakeLedgerClient().stallingConfirmations(Duration.ofSeconds(5)), Duration.ofMillis(100));

        long start = System.nanoTime();
        LedgerException e = assertThrows(LedgerException.class,
                () -> client.awaitConfirmation(new TxHandle("tx-1"), Duration.ofMillis(100)));
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        assertTrue(e.getMessage().contains("awaitConfirmation"), e.getMessage());
        assertTrue(elapsedMillis < 3_000, "waited " + elapsedMillis + "ms");
    }

    @Test
    void delegateFailuresAreRethrownUnchanged() {
        LedgerClient client = new TimeBoundedLedgerClient(
                new FakeLedgerClient().failingSubmissions(), Duration.ofSeconds(1));

        LedgerException e = assertThrows(LedgerException.class, () -> client.submit("t", 0L, Map.of(), 1));
        assertEquals("submission rejected", e.getMessage());
    }

    @Test
    void alreadyBoundedClientIsNotWrappedTwice() {
        LedgerClient once = TimeBoundedLedgerClient.bounded(new FakeLedgerClient(), Duration.ofSeconds(1));

        assertSame(once, TimeBoundedLedgerClient.bounded(once, Duration.ofSeconds(1)));
        assertNotSame(once, TimeBoundedLedgerClient.bounded(once, Duration.ofSeconds(2)));
    }

    @Test
    void rejectsNonPositiveBound() {
        assertThrows(IllegalArgumentException.class,
                () -> new TimeBoundedLedgerClient(new FakeLedgerClient(), Duration.ZERO));
    }
}
