package com.questrail.concord.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Ledger destinations used by the coordinators.
 *
 * @param governanceTarget where passed proposals are submitted
 * @param checkpointTarget where session checkpoints are anchored; {@code null} disables anchoring
 */
public record LedgerTargets(String governanceTarget, String checkpointTarget) {

    public static final String DEFAULT_GOVERNANCE_TARGET = "governance";

    public LedgerTargets {
        Objects.requireNonNull(governanceTarget, "governanceTarget");
        if (governanceTarget.isBlank()) {
            throw new IllegalArgumentException("governanceTarget must not be blank");
        }
        if (checkpointTarget != null && checkpointTarget.isBlank()) {
            throw new IllegalArgumentException("checkpointTarget must not be blank when present");
        }
    }

    public static LedgerTargets defaults() {
        return new LedgerTargets(DEFAULT_GOVERNANCE_TARGET, null);
    }

    public Optional<String> checkpointAnchor() {
        return Optional.ofNullable(checkpointTarget);
    }
}
