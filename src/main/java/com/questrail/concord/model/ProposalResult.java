package com.questrail.concord.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of a finalized proposal. A proposal passes only when the approving
 * weight strictly exceeds the rejecting weight; ties reject.
 */
public record ProposalResult(boolean passed,
                             long yesWeight,
                             long noWeight,
                             long totalWeight,
                             Instant finalizedAt)
{
    public ProposalResult {
        Objects.requireNonNull(finalizedAt, "finalizedAt");
    }
}
