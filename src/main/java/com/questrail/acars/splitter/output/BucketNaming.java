package com.questrail.acars.splitter.output;

import com.questrail.acars.splitter.classify.SplitStrategy;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Deterministic bucket file names.
 *
 * <pre>
 *   label   + key K  → acars_label_K.txt
 *   tail    + key K  → acars_tail_K.txt
 *   type    + key K  → acars_type_K.txt
 *   keyword + key K  → acars_K.txt   (K is containing_W / not_containing_W)
 *   any     + none   → acars_unclassified.txt
 * </pre>
 *
 * <p>Characters outside {@code [A-Za-z0-9._-]} in the key are replaced with
 * {@code _}, so a key can never name a path outside the output directory.</p>
 */
public final class BucketNaming {

    public static final String UNCLASSIFIED = "acars_unclassified.txt";

    private static final String SUFFIX = ".txt";
    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9._-]");

    private BucketNaming() {}

    public static String bucketFor(SplitStrategy strategy, Optional<String> key) {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(key, "key");

        return key.filter(k -> !k.isEmpty())
                .map(k -> strategy.bucketPrefix() + sanitize(k) + SUFFIX)
                .orElse(UNCLASSIFIED);
    }

    static String sanitize(String key) {
        return UNSAFE.matcher(key).replaceAll("_");
    }
}
