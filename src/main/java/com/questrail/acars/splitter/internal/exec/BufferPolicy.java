package com.questrail.acars.splitter.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * BufferPolicy
 * -----------------------------------------------------------------------------
 * Operational limits on how long and how much unframed text a source may hold.
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>bufferTimeout</b>: the sweep period. A source is considered idle once
 *       no flush has happened for more than twice this value
 *       ({@link #idleThreshold()}); its pending message is then forced out.</li>
 *   <li><b>maxBufferChars</b>: cap on a source buffer after framing. A buffer
 *       above the cap is flushed from its first delimiter, or discarded if it has
 *       none. This bounds memory for a producer that never emits a timestamp line.</li>
 * </ul>
 */
public record BufferPolicy(Duration bufferTimeout, int maxBufferChars) {

    public static final Duration DEFAULT_BUFFER_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_BUFFER_CHARS = 1 << 20;

    public BufferPolicy {
        Objects.requireNonNull(bufferTimeout, "bufferTimeout");

        if (bufferTimeout.isNegative() || bufferTimeout.isZero()) {
            throw new IllegalArgumentException("bufferTimeout must be positive");
        }
        if (maxBufferChars <= 0) {
            throw new IllegalArgumentException("maxBufferChars must be positive");
        }
    }

    /**
     * 60 second timeout, 1 MiB-character cap.
     */
    public static BufferPolicy defaults() {
        return new BufferPolicy(DEFAULT_BUFFER_TIMEOUT, DEFAULT_MAX_BUFFER_CHARS);
    }

    public static BufferPolicy withBufferTimeout(Duration bufferTimeout) {
        return new BufferPolicy(bufferTimeout, DEFAULT_MAX_BUFFER_CHARS);
    }

    /**
     * Minimum quiet time before the sweep forces a source's pending message out.
     */
    public Duration idleThreshold() {
        return bufferTimeout.multipliedBy(2);
    }
}
