package com.questrail.acars.splitter.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every idle/timeout decision made by the splitter.
 *
 * <p>Source activity is recorded in ticks from this clock and compared against
 * the buffer timeout. Wall-clock time is never used for those comparisons, so an
 * NTP step or a manual clock change cannot trigger (or suppress) a timeout flush.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically non-decreasing tick value in nanoseconds.
     * Only differences between two readings are meaningful.
     */
    long nowNanos();

    /**
     * Nanoseconds elapsed since an earlier reading of this clock.
     */
    default long elapsedSince(long earlierNanos)
    {
        return nowNanos() - earlierNanos;
    }
}
