package com.questrail.concord.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a task registered with a {@link MonotonicScheduler}.
 */
public interface Cancellable
{
    /**
     * @return {@code true} if the task will no longer run; {@code false} if it
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
