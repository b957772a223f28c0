package com.maxsort.organizer.monitor;

import org.springframework.stereotype.Component;

import java.util.OptionalInt;

/**
 * Suggests concurrency from available processors and free heap. File operations are
 * I/O bound, so the hint allows a few operations per core.
 */
@Component
public class RuntimeResourceMonitor implements ResourceMonitor {

    private static final int OPERATIONS_PER_CORE = 4;
    private static final double LOW_MEMORY_RATIO = 0.10;

    private final Runtime runtime;

    public RuntimeResourceMonitor() {
        this(Runtime.getRuntime());
    }

    RuntimeResourceMonitor(Runtime runtime) {
        this.runtime = runtime;
    }

    @Override
    public OptionalInt concurrencyHint() {
        int hint = runtime.availableProcessors() * OPERATIONS_PER_CORE;
        long max = runtime.maxMemory();
        if (max != Long.MAX_VALUE && max > 0) {
            long free = max - (runtime.totalMemory() - runtime.freeMemory());
            if ((double) free / max < LOW_MEMORY_RATIO) {
                hint = Math.max(1, hint / 2);
            }
        }
        return OptionalInt.of(Math.max(1, hint));
    }
}
