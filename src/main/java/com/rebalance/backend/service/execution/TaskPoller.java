package com.rebalance.backend.service.execution;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.BooleanSupplier;

/**
 * Polls a condition on the shared scheduler until it holds, the task is cancelled, or the timeout passes.
 */
@Component
@Slf4j
public class TaskPoller {

    private final ThreadPoolTaskScheduler scheduler;
    private final Clock clock;

    public TaskPoller(@Qualifier("taskPollScheduler") ThreadPoolTaskScheduler scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * @param done      checked on every tick; the task ends quietly once it returns true
     * @param onTimeout run once if {@code done} never held within {@code timeout}
     */
    public CancellableTask pollUntil(String name, BooleanSupplier done, Duration timeout, Duration interval,
                                     Runnable onTimeout) {
        CancellableTask task = new CancellableTask(name);
        Instant deadline = Instant.now(clock).plus(timeout);
        task.bind(scheduler.scheduleAtFixedRate(() -> {
            if (task.isCancelled()) {
                return;
            }
            try {
                if (done.getAsBoolean()) {
                    task.cancel();
                    return;
                }
                if (!Instant.now(clock).isBefore(deadline)) {
                    task.cancel();
                    onTimeout.run();
                }
            } catch (RuntimeException e) {
                log.error("Polled task failed task={}", name, e);
                task.cancel();
            }
        }, interval));
        return task;
    }
}
