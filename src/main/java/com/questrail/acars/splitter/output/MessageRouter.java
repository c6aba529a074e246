package com.questrail.acars.splitter.output;

import com.questrail.acars.splitter.classify.MessageClassifier;
import com.questrail.acars.splitter.classify.SplitStrategy;

import java.util.Objects;
import java.util.Optional;

/**
 * Classifies a message and appends it to the matching bucket.
 *
 * <pre>
 *   message → MessageClassifier → key | none → BucketNaming → BucketWriter
 * </pre>
 *
 * Stateless apart from its collaborators; safe to share across sources.
 */
public final class MessageRouter {

    private final SplitStrategy strategy;
    private final MessageClassifier classifier;
    private final BucketWriter writer;

    public MessageRouter(SplitStrategy strategy, MessageClassifier classifier, BucketWriter writer) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    public SplitStrategy strategy() {
        return strategy;
    }

    public BucketWriter writer() {
        return writer;
    }

    /**
     * @throws BucketWriteException if the bucket file cannot be written
     */
    public RoutedMessage route(String message) {
        Objects.requireNonNull(message, "message");

        Optional<String> key = classifier.classify(message);
        String bucket = BucketNaming.bucketFor(strategy, key);
        return new RoutedMessage(key, bucket, writer.append(bucket, message));
    }
}
