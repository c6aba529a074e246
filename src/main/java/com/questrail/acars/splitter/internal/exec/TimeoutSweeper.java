package com.questrail.acars.splitter.internal.exec;

import com.questrail.acars.splitter.internal.time.Cancellable;
import com.questrail.acars.splitter.internal.time.MonotonicClock;
import com.questrail.acars.splitter.internal.time.MonotonicScheduler;
import com.questrail.acars.splitter.internal.time.WallClock;
import com.questrail.acars.splitter.observability.NullObservabilitySink;
import com.questrail.acars.splitter.observability.SplitterErrorEvent;
import com.questrail.acars.splitter.observability.SplitterObservabilitySink;

import java.util.Objects;

/**
 * TimeoutSweeper
 * -----------------------------------------------------------------------------
 * The single recurring task that bounds message latency for sources that fall
 * silent mid-message.
 *
 * <p>Every {@link BufferPolicy#bufferTimeout()} it runs
 * {@link StreamSplitter#sweepIdleSources()}. Scheduling goes through the
 * {@link MonotonicScheduler}, which in production is backed by the transport
 * event loop; a sweep therefore never runs concurrently with datagram
 * handling.</p>
 *
 * <p>An exception escaping a sweep is reported and the next sweep still runs.</p>
 */
public final class TimeoutSweeper {

    private final StreamSplitter splitter;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final SplitterObservabilitySink observabilitySink;

    private Cancellable handle;

    public TimeoutSweeper(StreamSplitter splitter,
                          MonotonicScheduler scheduler,
                          MonotonicClock clock,
                          WallClock wallClock,
                          SplitterObservabilitySink observabilitySink) {
        this.splitter = Objects.requireNonNull(splitter, "splitter");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Arms the recurring sweep. Idempotent.
     */
    public synchronized void start() {
        if (handle == null) {
            handle = scheduler.scheduleRepeating(splitter.policy().bufferTimeout(), clock, this::sweepOnce);
        }
    }

    /**
     * Cancels the recurring sweep. Idempotent; a sweep already running completes.
     */
    public synchronized void stop() {
        if (handle != null) {
            handle.cancel();
            handle = null;
        }
    }

    public synchronized boolean isRunning() {
        return handle != null;
    }

    void sweepOnce() {
        try {
            splitter.sweepIdleSources();
        }
        catch (RuntimeException e) {
            observabilitySink.onError(new SplitterErrorEvent(wallClock.now(), "Timeout sweep failed", e));
        }
    }
}
