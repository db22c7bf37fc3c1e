package com.questrail.assetexport.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for operational delays (worker settling, connect timeouts).
 *
 * <p>Wall-clock time is used only for event timestamps; anything that decides
 * <em>when</em> something happens reads this clock instead.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
