package com.questrail.acars.splitter.runtime;

import com.questrail.acars.splitter.classify.KeywordClassifier;
import com.questrail.acars.splitter.classify.SplitStrategy;
import com.questrail.acars.splitter.codec.MessageFramer;
import com.questrail.acars.splitter.codec.impl.TimestampLineFramer;
import com.questrail.acars.splitter.config.OutputSettings;
import com.questrail.acars.splitter.output.BucketWriteException;
import com.questrail.acars.splitter.output.MessageRouter;
import com.questrail.acars.splitter.output.RoutedMessage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * LogFileSplitter
 * =============================================================================
 * Offline mode: splits an existing JAERO log file into the same buckets the
 * UDP runtime would produce.
 *
 * <p>The whole file is framed at once: every timestamp line starts a message
 * that runs to the next one or to end of file. Text before the first timestamp
 * line is ignored. Messages are appended to buckets exactly as in UDP mode, so
 * existing bucket files are extended, not replaced.</p>
 */
public final class LogFileSplitter {
    private static final Logger log = LoggerFactory.getLogger(LogFileSplitter.class);

    private final MessageFramer framer;
    private final MessageRouter router;

    public LogFileSplitter(MessageFramer framer, MessageRouter router) {
        this.framer = Objects.requireNonNull(framer, "framer");
        this.router = Objects.requireNonNull(router, "router");
    }

    public static LogFileSplitter forOutput(OutputSettings output) {
        Objects.requireNonNull(output, "output");
        return new LogFileSplitter(new TimestampLineFramer(), RuntimeWiring.router(output));
    }

    /**
     * Split {@code input} into buckets.
     *
     * @throws IOException if the input cannot be read as UTF-8
     * @throws BucketWriteException if the output directory cannot be created
     */
    public SplitSummary split(Path input) throws IOException {
        Objects.requireNonNull(input, "input");

        String content = Files.readString(input);
        List<String> messages = framer.frameAll(content);
        if (messages.isEmpty()) {
            log.warn("Can't distinguish headers--bad formatting? Set JAERO to output format 3.");
            return SplitSummary.empty();
        }

        router.writer().prepare();

        Map<String, Integer> counts = new LinkedHashMap<>();
        int classified = 0;
        int failed = 0;
        for (String message : messages) {
            try {
                RoutedMessage routed = router.route(message);
                counts.merge(routed.bucket(), 1, Integer::sum);
                if (isClassified(routed)) {
                    classified++;
                }
            }
            catch (BucketWriteException e) {
                log.error("Cannot write message to {}", e.path(), e);
                failed++;
            }
        }

        SplitSummary summary = new SplitSummary(counts, classified, failed);
        report(summary);
        return summary;
    }

    /**
     * A keyword split only counts messages that contain the keyword.
     */
    private boolean isClassified(RoutedMessage routed) {
        if (router.strategy() == SplitStrategy.KEYWORD) {
            return routed.key().filter(k -> k.startsWith(KeywordClassifier.MATCHED_PREFIX)).isPresent();
        }
        return routed.key().isPresent();
    }

    private void report(SplitSummary summary) {
        Map<String, Integer> buckets = summary.messagesPerBucket();
        if (summary.written() > 0 && summary.classified() == 0) {
            log.warn("No messages could be classified by {}.", router.strategy().configName());
        }

        Path dir = router.writer().outputDirectory();
        buckets.forEach((bucket, count) ->
            log.info("Wrote {} with {} messages", dir.resolve(bucket), count));

        if (summary.failed() > 0) {
            log.warn("{} messages could not be written", summary.failed());
        }
    }
}
