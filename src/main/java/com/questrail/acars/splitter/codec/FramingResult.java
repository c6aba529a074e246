package com.questrail.acars.splitter.codec;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one ordinary framing pass over a source buffer.
 *
 * @param frames   complete messages, trimmed, in delimiter order
 * @param consumed length of the buffer prefix that the frames (and any junk before
 *                 the first delimiter) occupied; the caller removes exactly this
 *                 prefix so the buffer starts at the last delimiter
 */
public record FramingResult(List<String> frames, int consumed) {

    private static final FramingResult NONE = new FramingResult(List.of(), 0);

    public FramingResult {
        frames = List.copyOf(Objects.requireNonNull(frames, "frames"));
        if (consumed < 0) {
            throw new IllegalArgumentException("consumed must be >= 0");
        }
    }

    /** Nothing extractable: fewer than two delimiters in the buffer. */
    public static FramingResult none() {
        return NONE;
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }
}
