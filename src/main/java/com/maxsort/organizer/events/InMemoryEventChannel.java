package com.maxsort.organizer.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Delivers events synchronously on the publishing thread, in publication order.
 */
@Component
public class InMemoryEventChannel implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventChannel.class);

    private final List<PipelineEventListener> listeners = new CopyOnWriteArrayList<>();

    @Override
    public void publish(PipelineEvent event) {
        for (PipelineEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.warn("Event listener {} failed on {}: {}",
                        listener.getClass().getSimpleName(), event.type().getWireName(), e.getMessage(), e);
            }
        }
    }

    @Override
    public void subscribe(PipelineEventListener listener) {
        listeners.add(listener);
    }

    @Override
    public void unsubscribe(PipelineEventListener listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }
}
