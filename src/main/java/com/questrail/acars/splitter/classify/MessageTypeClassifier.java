package com.questrail.acars.splitter.classify;

import java.util.Objects;
import java.util.Optional;

/**
 * Buckets messages by application type.
 *
 * <p>Markers are tested in priority order CPDLC, ADS-C, MIAM; anything else is
 * {@link #OTHER}. This classifier always produces a key.</p>
 */
public final class MessageTypeClassifier implements MessageClassifier {

    public static final String CPDLC = "CPDLC";
    public static final String ADS_C = "ADS-C";
    public static final String MIAM = "MIAM";
    public static final String OTHER = "OTHER";

    private static final String CPDLC_MARKER = "FANS-1/A CPDLC";

    @Override
    public Optional<String> classify(String message) {
        Objects.requireNonNull(message, "message");

        if (message.contains(CPDLC_MARKER)) {
            return Optional.of(CPDLC);
        }
        if (message.contains(ADS_C)) {
            return Optional.of(ADS_C);
        }
        if (message.contains(MIAM)) {
            return Optional.of(MIAM);
        }
        return Optional.of(OTHER);
    }
}
