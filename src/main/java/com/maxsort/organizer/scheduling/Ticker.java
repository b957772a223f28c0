package com.maxsort.organizer.scheduling;

import java.time.Duration;

/**
 * Fixed-rate task scheduling behind an interface, so tests can drive time by hand.
 */
public interface Ticker {

    /**
     * Run {@code task} every {@code interval}, first run one interval from now.
     *
     * @return handle that stops further runs
     */
    Cancellable schedule(Runnable task, Duration interval);
}
