package com.questrail.acars.splitter.internal.exec;

import com.questrail.acars.splitter.codec.FramingResult;
import com.questrail.acars.splitter.codec.MessageFramer;
import com.questrail.acars.splitter.internal.source.SourceBuffer;
import com.questrail.acars.splitter.internal.source.SourceRegistry;
import com.questrail.acars.splitter.internal.time.MonotonicClock;
import com.questrail.acars.splitter.internal.time.WallClock;
import com.questrail.acars.splitter.observability.MessageRoutedEvent;
import com.questrail.acars.splitter.observability.NullObservabilitySink;
import com.questrail.acars.splitter.observability.SourceAnomalyEvent;
import com.questrail.acars.splitter.observability.SplitterErrorEvent;
import com.questrail.acars.splitter.observability.SplitterObservabilitySink;
import com.questrail.acars.splitter.output.BucketWriteException;
import com.questrail.acars.splitter.output.MessageRouter;
import com.questrail.acars.splitter.output.RoutedMessage;

import java.util.Objects;
import java.util.Optional;

/**
 * StreamSplitter
 * =============================================================================
 * The per-source buffering, framing, forced-flush and routing engine.
 *
 * <h2>Ordinary path</h2>
 * <pre>
 *   text → SourceBuffer.append
 *        → MessageFramer.frameComplete   (N delimiters → N-1 messages)
 *            → buffer keeps everything from the last delimiter
 *            → MessageRouter.route (classify + append to bucket), in delimiter order
 *        → buffer cap check
 * </pre>
 *
 * <h2>Forced paths</h2>
 * <ul>
 *   <li>{@link #sweepIdleSources()}: a non-empty source whose last flush is older
 *       than {@link BufferPolicy#idleThreshold()} has everything from its first
 *       delimiter emitted as one message ({@link FlushReason#TIMEOUT}) and its
 *       buffer cleared. Without any delimiter the buffer and its activity tick
 *       are left alone and a {@code NO_DELIMITER} anomaly is reported on every sweep.</li>
 *   <li>Buffer cap: after framing, a buffer longer than
 *       {@link BufferPolicy#maxBufferChars()} is flushed the same way
 *       ({@link FlushReason#OVERFLOW}) or, lacking a delimiter, discarded with a
 *       {@code BUFFER_DISCARDED} anomaly.</li>
 * </ul>
 *
 * <p>Whichever path cuts the buffer, non-blank text ahead of the first delimiter
 * is dropped and reported as a {@code LEADING_TEXT_DISCARDED} anomaly.</p>
 *
 * <h2>Activity</h2>
 * A source's activity tick moves only when a flush containing a delimiter
 * happens. Receiving data does not count as activity: a source that keeps
 * trickling one unterminated message is still swept.
 *
 * <h2>Threading</h2>
 * Production calls every method from the single transport event loop. Each
 * source's compound operations also run under that source's monitor, so the
 * engine stays consistent when callers use several threads; sources never block
 * each other.
 *
 * <h2>Failure isolation</h2>
 * A bucket that cannot be written loses that one message (reported through
 * {@link SplitterObservabilitySink#onError}); the remaining messages of the same
 * pass and all other sources carry on.
 */
public final class StreamSplitter {

    private final SourceRegistry sources;
    private final MessageFramer framer;
    private final MessageRouter router;
    private final BufferPolicy policy;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final SplitterObservabilitySink observabilitySink;

    public StreamSplitter(SourceRegistry sources,
                          MessageFramer framer,
                          MessageRouter router,
                          BufferPolicy policy,
                          MonotonicClock clock,
                          WallClock wallClock,
                          SplitterObservabilitySink observabilitySink)
    {
        this.sources = Objects.requireNonNull(sources, "sources");
        this.framer = Objects.requireNonNull(framer, "framer");
        this.router = Objects.requireNonNull(router, "router");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public SourceRegistry sources() {
        return sources;
    }

    public BufferPolicy policy() {
        return policy;
    }

    /**
     * Append decoded text to a source and emit every message it completes.
     *
     * @return number of messages emitted by ordinary framing (overflow flushes not counted)
     * @throws IllegalArgumentException if {@code port} is not a configured source
     */
    public int onText(int port, CharSequence text) {
        Objects.requireNonNull(text, "text");
        SourceBuffer source = sources.source(port);

        synchronized (source) {
            source.append(text);
            int emitted = frameDelimited(source);
            enforceCap(source);
            return emitted;
        }
    }

    /**
     * Re-run ordinary framing without new input. Emits nothing unless the buffer
     * gained a delimiter since the last pass.
     */
    public int frame(int port) {
        SourceBuffer source = sources.source(port);
        synchronized (source) {
            return frameDelimited(source);
        }
    }

    /**
     * Record that a datagram for {@code port} was dropped because it could not be decoded.
     */
    public void onUndecodableDatagram(int port) {
        SourceBuffer source = sources.source(port);
        observabilitySink.onSourceAnomaly(new SourceAnomalyEvent(
            wallClock.now(), port, SourceAnomalyEvent.Kind.UNDECODABLE_DATAGRAM, source.length()));
    }

    /**
     * One sweep over all sources; see the class documentation.
     *
     * @return number of sources force-flushed
     */
    public int sweepIdleSources() {
        long now = clock.nowNanos();
        long idleNanos = policy.idleThreshold().toNanos();
        int flushed = 0;

        for (SourceBuffer source : sources.all()) {
            synchronized (source) {
                if (source.isEmpty() || now - source.lastActivityNanos() <= idleNanos) {
                    continue;
                }

                Optional<String> pending = framer.framePending(source.view());
                if (pending.isEmpty()) {
                    // Retried on the next sweep; the buffer cap bounds its growth meanwhile.
                    observabilitySink.onSourceAnomaly(new SourceAnomalyEvent(
                        wallClock.now(), source.port(), SourceAnomalyEvent.Kind.NO_DELIMITER, source.length()));
                    continue;
                }

                reportLeadingText(source);
                source.clear();
                emit(source.port(), FlushReason.TIMEOUT, pending.get());
                source.markActivity(now);
                flushed++;
            }
        }
        return flushed;
    }

    private int frameDelimited(SourceBuffer source) {
        FramingResult result = framer.frameComplete(source.view());
        if (result.isEmpty()) {
            return 0;
        }

        reportLeadingText(source);
        source.removePrefix(result.consumed());
        for (String message : result.frames()) {
            emit(source.port(), FlushReason.DELIMITED, message);
        }
        source.markActivity(clock.nowNanos());
        return result.frames().size();
    }

    private void enforceCap(SourceBuffer source) {
        if (source.length() <= policy.maxBufferChars()) {
            return;
        }

        Optional<String> pending = framer.framePending(source.view());
        if (pending.isPresent()) {
            reportLeadingText(source);
            source.clear();
            emit(source.port(), FlushReason.OVERFLOW, pending.get());
            source.markActivity(clock.nowNanos());
        }
        else {
            int dropped = source.clear();
            observabilitySink.onSourceAnomaly(new SourceAnomalyEvent(
                wallClock.now(), source.port(), SourceAnomalyEvent.Kind.BUFFER_DISCARDED, dropped));
        }
    }

    /**
     * Reports non-blank text ahead of the first delimiter, which the caller is
     * about to drop. Call only when the buffer holds a delimiter.
     */
    private void reportLeadingText(SourceBuffer source) {
        CharSequence view = source.view();
        int first = framer.firstDelimiter(view).orElse(0);
        if (first > 0 && !view.subSequence(0, first).toString().isBlank()) {
            observabilitySink.onSourceAnomaly(new SourceAnomalyEvent(
                wallClock.now(), source.port(), SourceAnomalyEvent.Kind.LEADING_TEXT_DISCARDED, first));
        }
    }

    private void emit(int port, FlushReason reason, String message) {
        try {
            RoutedMessage routed = router.route(message);
            observabilitySink.onMessageRouted(new MessageRoutedEvent(
                wallClock.now(), port, reason, router.strategy(), routed.key(), routed.bucket()));
        }
        catch (BucketWriteException e) {
            observabilitySink.onError(new SplitterErrorEvent(
                wallClock.now(), "Port " + port + ": message dropped, bucket write failed", e));
        }
    }
}
