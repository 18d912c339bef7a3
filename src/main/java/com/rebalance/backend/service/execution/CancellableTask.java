package com.rebalance.backend.service.execution;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle of a polled background task. Cancelling is idempotent and stops further polls.
 */
public final class CancellableTask {

    private final String name;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> future;

    CancellableTask(String name) {
        this.name = name;
    }

    void bind(ScheduledFuture<?> scheduled) {
        this.future = scheduled;
        if (cancelled.get()) {
            scheduled.cancel(false);
        }
    }

    public String name() {
        return name;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            ScheduledFuture<?> scheduled = this.future;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }
    }
}
