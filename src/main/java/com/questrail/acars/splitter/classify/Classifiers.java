package com.questrail.acars.splitter.classify;

import java.util.Objects;
import java.util.Optional;

/**
 * Factory and one-shot entry point for the built-in classification strategies.
 */
public final class Classifiers {

    private Classifiers() {}

    /**
     * Returns the classifier for a strategy.
     *
     * @param keyword required (non-blank) for {@link SplitStrategy#KEYWORD}, ignored otherwise
     * @throws IllegalArgumentException if the keyword strategy is requested without a keyword
     */
    public static MessageClassifier forStrategy(SplitStrategy strategy, String keyword) {
        Objects.requireNonNull(strategy, "strategy");

        return switch (strategy) {
            case LABEL -> new LabelClassifier();
            case TAIL -> new TailNumberClassifier();
            case TYPE -> new MessageTypeClassifier();
            case KEYWORD -> {
                if (keyword == null) {
                    throw new IllegalArgumentException("keyword strategy requires a keyword");
                }
                yield new KeywordClassifier(keyword);
            }
        };
    }

    /**
     * {@code classify(message, strategy, keyword?) -> key | none}.
     */
    public static Optional<String> classify(String message, SplitStrategy strategy, String keyword) {
        return forStrategy(strategy, keyword).classify(message);
    }
}
