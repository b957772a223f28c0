package com.maxsort.organizer.events;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryEventChannelTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private final InMemoryEventChannel channel = new InMemoryEventChannel();

    @Test
    void publish_deliversInOrderToEverySubscriber() {
        List<String> first = new ArrayList<>();
        List<String> second = new ArrayList<>();
        channel.subscribe(e -> first.add(e.type().getWireName()));
        channel.subscribe(e -> second.add(e.type().getWireName()));

        channel.publish(PipelineEvent.of(PipelineEventType.BATCH_QUEUED, "test", clock, "batchId", "b-1"));
        channel.publish(PipelineEvent.of(PipelineEventType.BATCH_STARTED, "test", clock, "batchId", "b-1"));

        assertThat(first).containsExactly("batch-queued", "batch-started");
        assertThat(second).containsExactly("batch-queued", "batch-started");
    }

    @Test
    void publish_failingListenerDoesNotStopOthers() {
        List<PipelineEvent> received = new ArrayList<>();
        channel.subscribe(e -> {
            throw new IllegalStateException("listener broke");
        });
        channel.subscribe(received::add);

        channel.publish(PipelineEvent.of(PipelineEventType.QUEUE_CLEARED, "test", clock, "clearedCount", 3));

        assertThat(received).hasSize(1);
    }

    @Test
    void unsubscribe_stopsDelivery() {
        List<PipelineEvent> received = new ArrayList<>();
        PipelineEventListener listener = received::add;
        channel.subscribe(listener);

        channel.unsubscribe(listener);
        channel.publish(PipelineEvent.of(PipelineEventType.QUEUE_CLEARED, "test", clock));

        assertThat(received).isEmpty();
        assertThat(channel.listenerCount()).isZero();
    }

    @Test
    void event_dropsNullValuesAndIsReadOnly() {
        PipelineEvent event = PipelineEvent.of(PipelineEventType.TRANSACTION_FAILED, "executor", clock,
                "transactionId", "tx-1", "error", null);

        assertThat(event.payload()).containsOnlyKeys("transactionId");
        assertThat(event.timestamp()).isEqualTo(clock.millis());
        assertThatThrownBy(() -> event.payload().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void event_oddKeyValueCount_throws() {
        assertThatThrownBy(() -> PipelineEvent.of(PipelineEventType.QUEUE_FULL, "test", clock, "only-key"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void event_constructorCopiesPayload() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("count", 1);
        PipelineEvent event = new PipelineEvent(PipelineEventType.REVIEW_ITEMS_ADDED, "review", payload, 0);

        payload.put("count", 2);

        assertThat(event.get("count")).isEqualTo(1);
    }
}
