package com.questrail.acars.splitter.codec.impl;

import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TimestampDelimiter
 * -----------------------------------------------------------------------------
 * Locates JAERO message header lines in a text buffer.
 *
 * <p>A delimiter is {@code HH:MM:SS DD-MM-YY UTC} starting at column 0: two
 * digits per field, a single space between time and date, and the literal
 * {@code UTC} token. Only {@code \n} starts a new line, so a stray {@code \r}
 * cannot create a column 0 in the middle of a line.</p>
 *
 * <p>The pattern does not validate the time or date values ({@code 99:99:99}
 * matches); it is purely structural.</p>
 */
final class TimestampDelimiter
{
    static final Pattern PATTERN = Pattern.compile(
            "^\\d{2}:\\d{2}:\\d{2} \\d{2}-\\d{2}-\\d{2} UTC",
            Pattern.MULTILINE | Pattern.UNIX_LINES);

    private static final int[] NONE = new int[0];

    private TimestampDelimiter() {}

    /**
     * Start offsets of every non-overlapping delimiter, ascending.
     */
    static int[] offsets(CharSequence text)
    {
        Matcher m = PATTERN.matcher(text);
        int[] found = NONE;
        int count = 0;
        while (m.find()) {
            if (count == found.length) {
                found = Arrays.copyOf(found, Math.max(4, count * 2));
            }
            found[count++] = m.start();
        }
        return count == found.length ? found : Arrays.copyOf(found, count);
    }

    /**
     * Start offset of the first delimiter, or {@code -1} if there is none.
     */
    static int first(CharSequence text)
    {
        Matcher m = PATTERN.matcher(text);
        return m.find() ? m.start() : -1;
    }
}
