package com.maxsort.organizer.scheduling;

@FunctionalInterface
public interface Cancellable {

    void cancel();
}
