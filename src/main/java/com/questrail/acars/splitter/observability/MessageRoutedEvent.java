package com.questrail.acars.splitter.observability;

import com.questrail.acars.splitter.classify.SplitStrategy;
import com.questrail.acars.splitter.internal.exec.FlushReason;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A reassembled message was classified and appended to its bucket.
 *
 * @param port   source the message came from
 * @param key    classification key, empty when the message went to the unclassified bucket
 * @param bucket bucket file name (relative to the output directory)
 */
public record MessageRoutedEvent(
    Instant timestamp,
    int port,
    FlushReason reason,
    SplitStrategy strategy,
    Optional<String> key,
    String bucket
) {
    public MessageRoutedEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(bucket, "bucket");
    }
}
