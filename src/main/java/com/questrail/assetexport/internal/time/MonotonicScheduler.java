package com.questrail.assetexport.internal.time;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * MonotonicScheduler
 * =============================================================================
 * Scheduler surface for deferred work, expressed in monotonic deadlines.
 *
 * <p>The handshake uses {@link #delay(Duration, MonotonicClock)} to wait for a
 * freshly enabled worker to bind its port. Tests substitute a deterministic
 * implementation so the wait never touches real time.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos monotonic deadline in nanoseconds (from {@link MonotonicClock#nowNanos()})
     * @param task          runnable task
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule after a duration, measured against the given clock.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        long deadline = clock.nowNanos() + delay.toNanos();
        return scheduleAtNanos(deadline, task);
    }

    /**
     * Returns a future that completes once {@code delay} has elapsed.
     *
     * <p>A zero delay still goes through the scheduler, so callers observe the
     * same asynchronous boundary either way.</p>
     */
    default CompletableFuture<Void> delay(Duration delay, MonotonicClock clock)
    {
        CompletableFuture<Void> elapsed = new CompletableFuture<>();
        scheduleAfter(delay, clock, () -> elapsed.complete(null));
        return elapsed;
    }
}
