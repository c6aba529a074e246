package com.questrail.acars.splitter.internal.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <p>In the UDP runtime the executor is the single-threaded transport event loop,
 * which is what serializes the timeout sweep with datagram handling. Any other
 * {@code ScheduledExecutorService} works too.</p>
 *
 * <p>Absolute monotonic deadlines are converted to relative delays at scheduling
 * time using the supplied clock; callers must compute deadlines from the same
 * clock. A deadline in the past runs as soon as the executor is free.</p>
 *
 * <p>The executor is borrowed, not owned: shutting it down is the caller's job.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);

        // Never interrupt a sweep that is already writing files.
        return () -> future.cancel(false);
    }
}
