package com.questrail.acars.splitter.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one offline split.
 *
 * @param messagesPerBucket messages written, per bucket file name, in first-seen order
 * @param classified        messages the strategy matched; for keyword splitting,
 *                          those containing the keyword
 * @param failed            messages that could not be written
 */
public record SplitSummary(Map<String, Integer> messagesPerBucket, int classified, int failed) {
    public SplitSummary {
        Objects.requireNonNull(messagesPerBucket, "messagesPerBucket");
        messagesPerBucket = Collections.unmodifiableMap(new LinkedHashMap<>(messagesPerBucket));
    }

    public static SplitSummary empty() {
        return new SplitSummary(Map.of(), 0, 0);
    }

    public int written() {
        return messagesPerBucket.values().stream().mapToInt(Integer::intValue).sum();
    }
}
