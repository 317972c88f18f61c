package com.questrail.concord.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Elapsed-time source for the coordination loop's own cadence (tick spacing).
 *
 * <p>Protocol-visible times (intent creation, proposal deadlines, checkpoint
 * intervals) are exchanged between peers as epoch seconds and therefore come
 * from {@link WallClock}. Only local scheduling uses this clock.</p>
 */
public interface MonotonicClock
{
    /**
     * @return a non-decreasing tick value in nanoseconds, meaningful only for
     *         differences
     */
    long nowNanos();
}
