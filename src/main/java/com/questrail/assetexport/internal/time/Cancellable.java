package com.questrail.assetexport.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a task armed on a {@link MonotonicScheduler}.
 *
 * <p>The export core arms two kinds of timer: the worker settling delay and
 * per-call request timeouts. The latter are cancelled when the response
 * arrives.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
