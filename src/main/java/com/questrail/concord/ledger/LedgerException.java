package com.questrail.concord.ledger;

/**
 * Raised by {@link LedgerClient} implementations when the ledger cannot be
 * reached or rejects a call.
 */
public class LedgerException extends RuntimeException
{
    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
