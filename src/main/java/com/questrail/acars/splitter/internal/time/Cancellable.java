package com.questrail.acars.splitter.internal.time;

/**
 * Handle returned by {@link MonotonicScheduler} for a pending (or repeating) task.
 */
@FunctionalInterface
public interface Cancellable
{
    /**
     * Attempt to cancel the task.
     *
     * @return {@code true} if this call cancelled it; {@code false} if it had
     *         already run (one-shot tasks) or was cancelled earlier.
     */
    boolean cancel();
}
