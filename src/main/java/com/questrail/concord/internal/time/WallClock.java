package com.questrail.concord.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Source of protocol-visible time.
 *
 * <p>Entity timestamps, proposal deadlines and checkpoint intervals are all
 * derived from this clock. Peers exchange these values at second precision, so
 * coordinators truncate to seconds before storing or comparing them.</p>
 *
 * <p>Clock skew between peers is not corrected.</p>
 */
public interface WallClock
{
    Instant now();
}
