package com.questrail.concord.ledger;

import java.util.Objects;

/**
 * Opaque reference to a submitted ledger transaction.
 */
public record TxHandle(String id)
{
    public TxHandle {
        Objects.requireNonNull(id, "id");
    }
}
