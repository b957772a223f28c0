package com.maxsort.organizer.monitor;

import java.util.OptionalInt;

/**
 * Source of a non-authoritative concurrency hint. Consumers may only use it to lower their own limits.
 */
public interface ResourceMonitor {

    OptionalInt concurrencyHint();
}
