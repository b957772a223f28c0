package com.maxsort.organizer.events;

@FunctionalInterface
public interface PipelineEventListener {

    void onEvent(PipelineEvent event);
}
