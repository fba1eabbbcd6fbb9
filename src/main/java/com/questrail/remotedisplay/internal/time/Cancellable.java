package com.questrail.remotedisplay.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a scheduled timer.
 *
 * <p>Sessions hold these for challenge timeouts and batch controllers hold them
 * for expire timers. Teardown cancels every handle it still owns, so a
 * closed connection never leaves a timer behind.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled earlier.
     */
    boolean cancel();

    /**
     * Handle for "nothing scheduled". Cancelling it is a no-op.
     */
    Cancellable NONE = () -> false;
}
