package com.questrail.acars.splitter.internal.exec;

import com.questrail.acars.splitter.classify.MessageClassifier;
import com.questrail.acars.splitter.classify.SplitStrategy;
import com.questrail.acars.splitter.codec.impl.TimestampLineFramer;
import com.questrail.acars.splitter.internal.source.SourceRegistry;
import com.questrail.acars.splitter.observability.RecordingObservabilitySink;
import com.questrail.acars.splitter.observability.SourceAnomalyEvent;
import com.questrail.acars.splitter.output.BucketWriter;
import com.questrail.acars.splitter.output.MessageRouter;
import com.questrail.acars.splitter.time.DeterministicScheduler;
import com.questrail.acars.splitter.time.ManualMonotonicClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TimeoutSweeperTest
 * -----------------------------------------------------------------------------
 * Drives the recurring sweep with a manual clock and deterministic scheduler.
 */
class TimeoutSweeperTest {

    private static final int PORT = 5555;
    private static final Duration TIMEOUT = Duration.ofSeconds(60);

    private static final String MSG1 = "00:16:25 01-01-24 UTC msg1\nbody1";
    private static final String MSG2 = "00:17:02 01-01-24 UTC msg2\nbody2";

    @TempDir
    Path tempDir;

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    private StreamSplitter splitter(MessageClassifier classifier) {
        return new StreamSplitter(
            new SourceRegistry(List.of(PORT), clock),
            new TimestampLineFramer(),
            new MessageRouter(SplitStrategy.TYPE, classifier, new BucketWriter(tempDir)),
            BufferPolicy.withBufferTimeout(TIMEOUT),
            clock,
            () -> Instant.EPOCH,
            sink);
    }

    private TimeoutSweeper sweeper(StreamSplitter splitter) {
        return new TimeoutSweeper(splitter, scheduler, clock, () -> Instant.EPOCH, sink);
    }

    private void advance(Duration d) {
        clock.advance(d);
        scheduler.runDueTasks();
    }

    @Test
    void idleRemainderIsFlushedAfterTwiceTheTimeout() throws IOException {
        StreamSplitter splitter = splitter(m -> Optional.of("OTHER"));
        TimeoutSweeper sweeper = sweeper(splitter);
        sweeper.start();

        splitter.onText(PORT, MSG1 + "\n" + MSG2);
        Path bucket = tempDir.resolve("acars_type_OTHER.txt");
        assertEquals(MSG1, Files.readString(bucket));

        // Sweeps at 60s and 120s: not yet idle for more than 120s.
        advance(TIMEOUT);
        advance(TIMEOUT);
        assertEquals(MSG2, splitter.sources().source(PORT).snapshot());

        // Sweep at 180s flushes.
        advance(TIMEOUT);
        assertTrue(splitter.sources().source(PORT).isEmpty());
        assertEquals(MSG1 + "\n\n" + MSG2, Files.readString(bucket));
        assertEquals(FlushReason.TIMEOUT, sink.getRoutedMessages().get(1).reason());
    }

    @Test
    void sweepKeepsRunningEveryPeriod() {
        StreamSplitter splitter = splitter(m -> Optional.of("OTHER"));
        sweeper(splitter).start();
        splitter.onText(PORT, "no delimiter");

        for (int i = 0; i < 5; i++) {
            advance(TIMEOUT);
        }

        // Sweeps at 180s, 240s and 300s find the buffer stale.
        long warnings = sink.getAnomalies().stream()
            .filter(a -> a.kind() == SourceAnomalyEvent.Kind.NO_DELIMITER)
            .count();
        assertEquals(3, warnings);
        assertEquals("no delimiter", splitter.sources().source(PORT).snapshot());
    }

    @Test
    void nothingRunsBeforeTheFirstPeriod() {
        StreamSplitter splitter = splitter(m -> Optional.of("OTHER"));
        sweeper(splitter).start();

        clock.advance(TIMEOUT.minusMillis(1));
        assertEquals(0, scheduler.runDueTasks());

        clock.advanceMillis(1);
        assertEquals(1, scheduler.runDueTasks());
    }

    @Test
    void stopCancelsFutureSweeps() {
        StreamSplitter splitter = splitter(m -> Optional.of("OTHER"));
        TimeoutSweeper sweeper = sweeper(splitter);
        sweeper.start();
        assertTrue(sweeper.isRunning());

        sweeper.stop();
        splitter.onText(PORT, MSG2);
        clock.advance(TIMEOUT.multipliedBy(10));

        assertEquals(0, scheduler.runDueTasks());
        assertFalse(sweeper.isRunning());
        assertEquals(MSG2, splitter.sources().source(PORT).snapshot());
    }

    @Test
    void startIsIdempotent() {
        TimeoutSweeper sweeper = sweeper(splitter(m -> Optional.of("OTHER")));

        sweeper.start();
        sweeper.start();

        assertEquals(1, scheduler.pendingCount());
    }

    @Test
    void failingSweepIsReportedAndRescheduled() {
        StreamSplitter splitter = splitter(m -> {
            throw new IllegalStateException("classifier failure");
        });
        sweeper(splitter).start();
        splitter.onText(PORT, MSG2);

        advance(TIMEOUT.multipliedBy(3));

        assertEquals(1, sink.getErrors().size());
        assertInstanceOf(IllegalStateException.class, sink.getErrors().get(0).cause());
        assertEquals(1, scheduler.pendingCount());
    }
}
