package com.questrail.remotedisplay.internal.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <p>Deadlines are converted into relative delays at scheduling time using the
 * same {@link MonotonicClock} the callers use to compute them. A deadline in
 * the past runs immediately.</p>
 *
 * <p>The executor is not owned here: the runtime that created it shuts it down.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler
{
    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock)
    {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task)
    {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);

        // never interrupt a timer that is already running
        return () -> future.cancel(false);
    }
}
