package com.questrail.acars.splitter.internal.time;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fixed-delay repetition built from one-shot {@link MonotonicScheduler} arms.
 *
 * @see MonotonicScheduler#scheduleRepeating(Duration, MonotonicClock, Runnable)
 */
final class RepeatingTask implements Runnable, Cancellable
{
    private final MonotonicScheduler scheduler;
    private final Duration period;
    private final MonotonicClock clock;
    private final Runnable task;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile Cancellable pending;

    RepeatingTask(MonotonicScheduler scheduler, Duration period, MonotonicClock clock, Runnable task)
    {
        this.scheduler = scheduler;
        this.period = period;
        this.clock = clock;
        this.task = task;
    }

    void arm()
    {
        if (cancelled.get()) {
            return;
        }
        Cancellable next = scheduler.scheduleAfter(period, clock, this);
        pending = next;
        // cancel() may have read the previous handle while this arm was in flight.
        if (cancelled.get()) {
            next.cancel();
        }
    }

    @Override
    public void run()
    {
        if (cancelled.get()) {
            return;
        }
        try {
            task.run();
        }
        finally {
            arm();
        }
    }

    @Override
    public boolean cancel()
    {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        Cancellable p = pending;
        if (p != null) {
            p.cancel();
        }
        return true;
    }
}
