package com.questrail.courier.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Source of event timestamps.
 *
 * <p>Timestamps are informational: they end up in state snapshots and
 * observability events. Nothing in the requester or server adapter makes a
 * decision based on them, so a wall clock that jumps is acceptable.</p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
