package com.questrail.acars.splitter.classify;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the two-character ACARS label.
 *
 * <p>In JAERO output the label follows the {@code !} mode/ack marker of the
 * header line, e.g. {@code ... ! H1 D ...} yields {@code H1}.</p>
 */
public final class LabelClassifier implements MessageClassifier {

    static final Pattern LABEL = Pattern.compile("!\\s+([A-Za-z0-9]{2})\\s+[A-Za-z0-9]");

    @Override
    public Optional<String> classify(String message) {
        Objects.requireNonNull(message, "message");

        Matcher m = LABEL.matcher(message);
        if (m.find()) {
            return Optional.of(m.group(1));
        }
        return Optional.empty();
    }
}
