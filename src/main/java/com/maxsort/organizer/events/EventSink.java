package com.maxsort.organizer.events;

/**
 * Broadcast channel for pipeline transitions. Consumers (progress UIs, audit) subscribe;
 * the core only publishes.
 */
public interface EventSink {

    void publish(PipelineEvent event);

    void subscribe(PipelineEventListener listener);

    void unsubscribe(PipelineEventListener listener);
}
