package com.maxsort.organizer.scheduling;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

@Component
public class TaskSchedulerTicker implements Ticker {

    private final TaskScheduler taskScheduler;
    private final Clock clock;

    public TaskSchedulerTicker(TaskScheduler taskScheduler, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    @Override
    public Cancellable schedule(Runnable task, Duration interval) {
        ScheduledFuture<?> future = taskScheduler.scheduleAtFixedRate(task, clock.instant().plus(interval), interval);
        return () -> future.cancel(false);
    }
}
