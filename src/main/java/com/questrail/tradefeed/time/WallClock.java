package com.questrail.tradefeed.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly to timestamp diagnostic events.
 *
 * <p>
 * Dispatch behavior never depends on this clock. Tests substitute a fixed
 * clock to make recorded events comparable.
 * </p>
 */
@FunctionalInterface
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
