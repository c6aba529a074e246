package com.questrail.acars.splitter.internal.exec;

/**
 * Why a message left its source buffer.
 */
public enum FlushReason {
    /** Bounded by the next message's delimiter (ordinary framing). */
    DELIMITED,
    /** Forced out by the sweep after the source went idle; may be incomplete. */
    TIMEOUT,
    /** Forced out because the buffer exceeded its size cap; may be incomplete. */
    OVERFLOW
}
