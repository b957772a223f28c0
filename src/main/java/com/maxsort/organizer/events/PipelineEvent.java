package com.maxsort.organizer.events;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Notification of a queue, batch or transaction transition.
 *
 * @param type      what happened
 * @param source    component that published the event
 * @param payload   event details, read-only; null values are dropped
 * @param timestamp epoch millis at publication
 */
public record PipelineEvent(PipelineEventType type, String source, Map<String, Object> payload, long timestamp) {

    public PipelineEvent {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (payload != null) {
            payload.forEach((k, v) -> {
                if (v != null) copy.put(k, v);
            });
        }
        payload = Collections.unmodifiableMap(copy);
    }

    /**
     * Build an event from alternating key/value arguments.
     */
    public static PipelineEvent of(PipelineEventType type, String source, Clock clock, Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Event payload needs key/value pairs");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            payload.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return new PipelineEvent(type, source, payload, clock.millis());
    }

    public Object get(String key) {
        return payload.get(key);
    }
}
