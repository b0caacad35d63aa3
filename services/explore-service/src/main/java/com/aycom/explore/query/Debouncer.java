package com.aycom.explore.query;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs the last scheduled task once the quiet window has passed without another
 * {@link #schedule(Runnable)}. Rescheduling cancels the pending task rather than running it.
 */
public class Debouncer {
    private final ScheduledExecutorService scheduler;
    private final long quietMs;
    private ScheduledFuture<?> pending;

    public Debouncer(ScheduledExecutorService scheduler, long quietMs) {
        this.scheduler = scheduler;
        this.quietMs = Math.max(0L, quietMs);
    }

    public synchronized void schedule(Runnable task) {
        cancel();
        pending = scheduler.schedule(() -> {
            synchronized (Debouncer.this) {
                pending = null;
            }
            task.run();
        }, quietMs, TimeUnit.MILLISECONDS);
    }

    public synchronized boolean cancel() {
        if (pending == null) {
            return false;
        }
        boolean cancelled = pending.cancel(false);
        pending = null;
        return cancelled;
    }

    public synchronized boolean isPending() {
        return pending != null;
    }
}
