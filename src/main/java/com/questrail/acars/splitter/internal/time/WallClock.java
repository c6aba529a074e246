package com.questrail.acars.splitter.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Calendar time used only to stamp observability events.
 *
 * <p>It may jump (NTP, manual adjustment) and MUST NOT drive flush decisions;
 * use {@link MonotonicClock} for those.</p>
 */
@FunctionalInterface
public interface WallClock
{
    Instant now();
}
