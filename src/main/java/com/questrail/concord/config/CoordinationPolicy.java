package com.questrail.concord.config;

import java.time.Duration;
import java.util.Objects;

/**
 * CoordinationPolicy
 * -----------------------------------------------------------------------------
 * Tunable thresholds of the coordination engine.
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>checkpointMoveInterval</b>: accepted moves after which a session
 *       checkpoint is taken.</li>
 *   <li><b>checkpointTimeInterval</b>: elapsed time since the last checkpoint
 *       after which the next accepted move (or tick) takes one.</li>
 *   <li><b>confirmationTimeout</b>: upper bound on every single ledger
 *       call, the confirmation wait included. Expiry is a failure.</li>
 *   <li><b>defaultVotingDuration</b>: voting window used when a proposal is
 *       created without one.</li>
 *   <li><b>defaultPriority</b>: intent priority used when none is given.</li>
 *   <li><b>tickInterval</b>: spacing of the driver's housekeeping tick
 *       (expired proposals, time-based checkpoints).</li>
 *   <li><b>costLimitMultiplier</b>: ledger cost limit as a multiple of the
 *       intent's cost estimate.</li>
 * </ul>
 */
public record CoordinationPolicy(
        int checkpointMoveInterval,
        Duration checkpointTimeInterval,
        Duration confirmationTimeout,
        Duration defaultVotingDuration,
        int defaultPriority,
        Duration tickInterval,
        double costLimitMultiplier
) {
    public CoordinationPolicy {
        Objects.requireNonNull(checkpointTimeInterval, "checkpointTimeInterval");
        Objects.requireNonNull(confirmationTimeout, "confirmationTimeout");
        Objects.requireNonNull(defaultVotingDuration, "defaultVotingDuration");
        Objects.requireNonNull(tickInterval, "tickInterval");

        if (checkpointMoveInterval < 1) {
            throw new IllegalArgumentException("checkpointMoveInterval must be >= 1");
        }
        if (checkpointTimeInterval.isNegative() || checkpointTimeInterval.isZero()) {
            throw new IllegalArgumentException("checkpointTimeInterval must be positive");
        }
        if (confirmationTimeout.isNegative() || confirmationTimeout.isZero()) {
            throw new IllegalArgumentException("confirmationTimeout must be positive");
        }
        if (defaultVotingDuration.isNegative()) {
            throw new IllegalArgumentException("defaultVotingDuration must be non-negative");
        }
        if (tickInterval.isNegative() || tickInterval.isZero()) {
            throw new IllegalArgumentException("tickInterval must be positive");
        }
        if (!(costLimitMultiplier >= 1.0) || Double.isInfinite(costLimitMultiplier)) {
            throw new IllegalArgumentException("costLimitMultiplier must be a finite value >= 1.0");
        }
    }

    /**
     * <ul>
     *   <li>checkpointMoveInterval: 10</li>
     *   <li>checkpointTimeInterval: 300s</li>
     *   <li>confirmationTimeout: 60s</li>
     *   <li>defaultVotingDuration: 300s</li>
     *   <li>defaultPriority: 5</li>
     *   <li>tickInterval: 1s</li>
     *   <li>costLimitMultiplier: 1.0</li>
     * </ul>
     */
    public static CoordinationPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int checkpointMoveInterval = 10;
        private Duration checkpointTimeInterval = Duration.ofSeconds(300);
        private Duration confirmationTimeout = Duration.ofSeconds(60);
        private Duration defaultVotingDuration = Duration.ofSeconds(300);
        private int defaultPriority = 5;
        private Duration tickInterval = Duration.ofSeconds(1);
        private double costLimitMultiplier = 1.0;

        public Builder withCheckpointMoveInterval(int moves) {
            this.checkpointMoveInterval = moves;
            return this;
        }

        public Builder withCheckpointTimeInterval(Duration interval) {
            this.checkpointTimeInterval = interval;
            return this;
        }

        public Builder withConfirmationTimeout(Duration timeout) {
            this.confirmationTimeout = timeout;
            return this;
        }

        public Builder withDefaultVotingDuration(Duration duration) {
            this.defaultVotingDuration = duration;
            return this;
        }

        public Builder withDefaultPriority(int priority) {
            this.defaultPriority = priority;
            return this;
        }

        public Builder withTickInterval(Duration interval) {
            this.tickInterval = interval;
            return this;
        }

        public Builder withCostLimitMultiplier(double multiplier) {
            this.costLimitMultiplier = multiplier;
            return this;
        }

        public CoordinationPolicy build() {
            return new CoordinationPolicy(
                    checkpointMoveInterval,
                    checkpointTimeInterval,
                    confirmationTimeout,
                    defaultVotingDuration,
                    defaultPriority,
                    tickInterval,
                    costLimitMultiplier);
        }
    }
}
