package com.questrail.acars.splitter.classify;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Splits messages in two by a case-insensitive substring test against one keyword.
 *
 * <p>Always produces a key: {@code containing_<keyword>} or
 * {@code not_containing_<keyword>}, using the keyword exactly as configured.</p>
 */
public final class KeywordClassifier implements MessageClassifier {

    public static final String MATCHED_PREFIX = "containing_";
    public static final String UNMATCHED_PREFIX = "not_containing_";

    private final String keyword;
    private final String needle;

    public KeywordClassifier(String keyword) {
        Objects.requireNonNull(keyword, "keyword");
        if (keyword.isBlank()) {
            throw new IllegalArgumentException("keyword must not be blank");
        }
        this.keyword = keyword;
        this.needle = keyword.toLowerCase(Locale.ROOT);
    }

    public String keyword() {
        return keyword;
    }

    public String matchedKey() {
        return MATCHED_PREFIX + keyword;
    }

    public String unmatchedKey() {
        return UNMATCHED_PREFIX + keyword;
    }

    @Override
    public Optional<String> classify(String message) {
        Objects.requireNonNull(message, "message");

        boolean hit = message.toLowerCase(Locale.ROOT).contains(needle);
        return Optional.of(hit ? matchedKey() : unmatchedKey());
    }
}
