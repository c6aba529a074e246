package com.questrail.acars.splitter.observability;

import java.time.Instant;

/**
 * A source's UDP socket was bound ({@code up}) or closed/failed.
 *
 * @param cause failure cause when the transport went down abnormally; {@code null}
 *              for a successful bind or an orderly close
 */
public record TransportStateEvent(
    Instant timestamp,
    int port,
    boolean up,
    Throwable cause
) {
}
