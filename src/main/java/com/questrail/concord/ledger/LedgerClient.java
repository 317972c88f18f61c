package com.questrail.concord.ledger;

import java.time.Duration;
import java.util.Map;

/**
 * LedgerClient
 * -----------------------------------------------------------------------------
 * Port to the external ledger on which coordinated outcomes are committed.
 *
 * <p>All three calls may block. Coordinators reach implementations through a
 * {@link TimeBoundedLedgerClient}, which abandons any call that overruns the
 * configured confirmation timeout.</p>
 *
 * <p>Failures are reported as {@link LedgerException}. Coordinators never
 * retry.</p>
 */
public interface LedgerClient
{
    /**
     * @param target  ledger destination (contract, account, topic)
     * @param payload call data
     * @return estimated cost in ledger units
     */
    long estimateCost(String target, Map<String, Object> payload);

    /**
     * @param costLimit upper bound on the cost the ledger may charge
     * @return handle for {@link #awaitConfirmation}
     */
    TxHandle submit(String target, long value, Map<String, Object> payload, long costLimit);

    /**
     * Wait at most {@code timeout} for the submission to be confirmed.
     *
     * @return receipt; a timeout is reported as a receipt that did not succeed
     *         or as a {@link LedgerException}
     */
    LedgerReceipt awaitConfirmation(TxHandle handle, Duration timeout);
}
