package com.questrail.acars.splitter.classify;

import java.util.Locale;
import java.util.Optional;

/**
 * How reassembled messages are distributed across output buckets.
 *
 * <p>The {@link #configName()} is the value accepted for {@code split_by} in the
 * configuration file; {@link #bucketPrefix()} is the file-name prefix used for
 * keyed buckets of this strategy.</p>
 */
public enum SplitStrategy {
    /** Two-character ACARS message label. */
    LABEL("label", "acars_label_"),
    /** Aircraft registration / tail number. */
    TAIL("tail", "acars_tail_"),
    /** CPDLC, ADS-C, MIAM or OTHER. */
    TYPE("type", "acars_type_"),
    /** Whether the message mentions one configured keyword. */
    KEYWORD("keyword", "acars_");

    private final String configName;
    private final String bucketPrefix;

    SplitStrategy(String configName, String bucketPrefix) {
        this.configName = configName;
        this.bucketPrefix = bucketPrefix;
    }

    public String configName() {
        return configName;
    }

    public String bucketPrefix() {
        return bucketPrefix;
    }

    /**
     * Looks up a strategy by its configuration name (case-insensitive, surrounding
     * whitespace ignored).
     *
     * @return the strategy, or empty if {@code name} is null or unknown
     */
    public static Optional<SplitStrategy> fromConfigName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (SplitStrategy s : values()) {
            if (s.configName.equals(normalized)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
