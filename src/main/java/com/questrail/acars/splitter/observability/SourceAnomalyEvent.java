package com.questrail.acars.splitter.observability;

import java.time.Instant;

/**
 * A source produced input the splitter had to drop or cannot frame.
 * These are non-fatal and processing of the source continues.
 *
 * @param bufferedChars size of the source buffer when the anomaly was detected
 *                      (for {@link Kind#BUFFER_DISCARDED} and {@link Kind#LEADING_TEXT_DISCARDED},
 *                      the number of characters dropped)
 */
public record SourceAnomalyEvent(
    Instant timestamp,
    int port,
    Kind kind,
    int bufferedChars
) {
    public enum Kind {
        /** Datagram payload was not valid UTF-8 and was dropped. */
        UNDECODABLE_DATAGRAM,
        /** A stale buffer holds no delimiter, so the sweep cannot flush it. */
        NO_DELIMITER,
        /** A delimiter-free buffer grew past its cap and was discarded. */
        BUFFER_DISCARDED,
        /** Text ahead of the first timestamp line was dropped when the buffer was framed. */
        LEADING_TEXT_DISCARDED
    }
}
