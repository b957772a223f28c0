package com.maxsort.organizer.testutil;

import com.maxsort.organizer.scheduling.Cancellable;
import com.maxsort.organizer.scheduling.Ticker;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ticker that only fires when the test calls {@link #tick()}.
 */
public class ManualTicker implements Ticker {

    private final List<ScheduledTask> tasks = new CopyOnWriteArrayList<>();

    @Override
    public Cancellable schedule(Runnable task, Duration interval) {
        ScheduledTask scheduled = new ScheduledTask(task, interval);
        tasks.add(scheduled);
        return () -> scheduled.cancelled = true;
    }

    /**
     * Run every task that has not been cancelled, once.
     */
    public void tick() {
        for (ScheduledTask task : tasks) {
            if (!task.cancelled) {
                task.runnable.run();
            }
        }
    }

    public int activeCount() {
        return (int) tasks.stream().filter(t -> !t.cancelled).count();
    }

    public Duration lastInterval() {
        return tasks.isEmpty() ? null : tasks.get(tasks.size() - 1).interval;
    }

    private static final class ScheduledTask {
        private final Runnable runnable;
        private final Duration interval;
        private volatile boolean cancelled;

        private ScheduledTask(Runnable runnable, Duration interval) {
            this.runnable = runnable;
            this.interval = interval;
        }
    }
}
