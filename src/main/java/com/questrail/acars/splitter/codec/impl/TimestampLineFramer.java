package com.questrail.acars.splitter.codec.impl;

import com.questrail.acars.splitter.codec.FramingResult;
import com.questrail.acars.splitter.codec.MessageFramer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * TimestampLineFramer
 * -----------------------------------------------------------------------------
 * {@link MessageFramer} for JAERO text output, delimited by
 * {@code HH:MM:SS DD-MM-YY UTC} header lines (see {@link TimestampDelimiter}).
 *
 * <p>Every emitted message is trimmed of surrounding whitespace, which removes
 * the blank line(s) JAERO writes between records.</p>
 *
 * <p>Text that precedes the first delimiter cannot belong to any message that
 * will be seen; ordinary framing consumes it together with the first complete
 * frame.</p>
 */
public final class TimestampLineFramer implements MessageFramer
{
    @Override
    public FramingResult frameComplete(CharSequence buffer)
    {
        Objects.requireNonNull(buffer, "buffer");

        int[] offsets = TimestampDelimiter.offsets(buffer);
        if (offsets.length < 2) {
            // A lone delimiter starts a message but cannot bound one.
            return FramingResult.none();
        }

        List<String> frames = new ArrayList<>(offsets.length - 1);
        for (int i = 0; i < offsets.length - 1; i++) {
            frames.add(buffer.subSequence(offsets[i], offsets[i + 1]).toString().strip());
        }

        return new FramingResult(frames, offsets[offsets.length - 1]);
    }

    @Override
    public Optional<String> framePending(CharSequence buffer)
    {
        Objects.requireNonNull(buffer, "buffer");

        int first = TimestampDelimiter.first(buffer);
        if (first < 0) {
            return Optional.empty();
        }
        return Optional.of(buffer.subSequence(first, buffer.length()).toString().strip());
    }

    @Override
    public List<String> frameAll(CharSequence text)
    {
        Objects.requireNonNull(text, "text");

        int[] offsets = TimestampDelimiter.offsets(text);
        List<String> frames = new ArrayList<>(offsets.length);
        for (int i = 0; i < offsets.length; i++) {
            int end = (i + 1 < offsets.length) ? offsets[i + 1] : text.length();
            frames.add(text.subSequence(offsets[i], end).toString().strip());
        }
        return frames;
    }

    @Override
    public boolean containsDelimiter(CharSequence buffer)
    {
        return TimestampDelimiter.first(Objects.requireNonNull(buffer, "buffer")) >= 0;
    }

    @Override
    public OptionalInt firstDelimiter(CharSequence buffer)
    {
        int first = TimestampDelimiter.first(Objects.requireNonNull(buffer, "buffer"));
        return first < 0 ? OptionalInt.empty() : OptionalInt.of(first);
    }
}
