package com.questrail.assetexport.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly for observability timestamps. It must not
 * drive delays or timeouts; use {@link MonotonicClock} for those.
 */
public interface WallClock
{
    Instant now();
}
