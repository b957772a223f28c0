package com.maxsort.organizer.scheduling;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ScheduledFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class TaskSchedulerTickerTest {

    @Mock private TaskScheduler taskScheduler;
    @Mock private ScheduledFuture<Object> future;

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void schedule_firstRunOneIntervalFromNow() {
        doReturn(future).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        TaskSchedulerTicker ticker = new TaskSchedulerTicker(taskScheduler, clock);

        ticker.schedule(() -> { }, Duration.ofSeconds(2));

        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class),
                eq(Instant.parse("2024-05-01T10:00:02Z")), eq(Duration.ofSeconds(2)));
    }

    @Test
    void cancel_stopsFutureWithoutInterrupting() {
        doReturn(future).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        TaskSchedulerTicker ticker = new TaskSchedulerTicker(taskScheduler, clock);

        ticker.schedule(() -> { }, Duration.ofMillis(500)).cancel();

        verify(future).cancel(false);
    }
}
