package com.questrail.acars.splitter.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Scheduler surface for the splitter's deferred work (the timeout sweep).
 *
 * <p>Deadlines are expressed in {@link MonotonicClock} nanoseconds, never in
 * wall-clock instants. Production runs this on the transport event loop so
 * scheduled work is serialized with datagram handling; tests drive it by hand.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos deadline in {@link MonotonicClock#nowNanos()} ticks
     * @param task          task to run once
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule a one-shot task after {@code delay}, measured on {@code clock}.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        return scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }

    /**
     * Run {@code task} every {@code period}, first after one period has elapsed.
     *
     * <p>The next run is armed when the previous one finishes (fixed delay), so a
     * slow run never overlaps the following one. An exception thrown by the task
     * does not stop the repetition. Cancelling the returned handle cancels the
     * pending run and every later one.</p>
     *
     * @param period strictly positive interval between runs
     */
    default Cancellable scheduleRepeating(Duration period, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(period, "period");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("period must be > 0");
        }

        RepeatingTask repeating = new RepeatingTask(this, period, clock, task);
        repeating.arm();
        return repeating;
    }
}
