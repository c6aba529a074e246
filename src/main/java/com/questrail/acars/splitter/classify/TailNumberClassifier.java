package com.questrail.acars.splitter.classify;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the aircraft registration that follows the {@code AES:} / {@code GES:}
 * fields and the channel number of a JAERO header line.
 *
 * <p>JAERO prints the registration with a leading {@code .} separator
 * ({@code .PTZNG}); dots at either end are stripped from the key.</p>
 */
public final class TailNumberClassifier implements MessageClassifier {

    static final Pattern TAIL =
            Pattern.compile("AES:[A-F0-9]+\\s+GES:[A-Z0-9]+\\s+\\d+\\s+(\\.?[A-Za-z0-9-]+)");

    @Override
    public Optional<String> classify(String message) {
        Objects.requireNonNull(message, "message");

        Matcher m = TAIL.matcher(message);
        if (!m.find()) {
            return Optional.empty();
        }

        String tail = stripDots(m.group(1));
        return tail.isEmpty() ? Optional.empty() : Optional.of(tail);
    }

    private static String stripDots(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '.') {
            start++;
        }
        while (end > start && s.charAt(end - 1) == '.') {
            end--;
        }
        return s.substring(start, end);
    }
}
