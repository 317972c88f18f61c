package com.questrail.concord.ledger;

import java.util.Objects;

/**
 * Outcome of a confirmation wait.
 *
 * @param details ledger-specific description (block, reason); never {@code null}
 */
public record LedgerReceipt(boolean succeeded, String details)
{
    public LedgerReceipt {
        Objects.requireNonNull(details, "details");
    }

    public static LedgerReceipt success(String details) {
        return new LedgerReceipt(true, details);
    }

    public static LedgerReceipt failure(String details) {
        return new LedgerReceipt(false, details);
    }
}
