package ai.storefront.translator.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class EventBusTest {

    private static final Instant AT = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void deliversEventsInPublicationOrder() {
        RecordingEventListener listener = new RecordingEventListener();
        try (EventBus bus = new EventBus(4)) {
            bus.subscribe(listener);
            bus.publish(JobEvent.started(AT));
            for (int i = 1; i <= 10; i++) {
                bus.publish(JobEvent.progress(AT, "job_1", 10, i, 0, i * 10));
            }
            bus.publish(JobEvent.jobCompleted(AT, "job_1"));

            assertThat(bus.flush(Duration.ofSeconds(5))).isTrue();
        }

        assertThat(listener.types()).startsWith(EventType.STARTED).endsWith(EventType.JOB_COMPLETED).hasSize(12);
        assertThat(listener.ofType(EventType.PROGRESS))
                .extracting(event -> event.intAttribute(JobEvent.COMPLETED))
                .containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
    }

    @Test
    void failingListenerDoesNotStopDelivery() {
        RecordingEventListener listener = new RecordingEventListener();
        try (EventBus bus = new EventBus()) {
            bus.subscribe(event -> {
                throw new IllegalStateException("listener broke");
            });
            bus.subscribe(listener);
            bus.publish(JobEvent.itemFailed(AT, "job_1", "item_1", "boom"));
            bus.publish(JobEvent.itemRetry(AT, "job_1", "item_2", 2));
            bus.flush(Duration.ofSeconds(5));
        }

        assertThat(listener.events()).hasSize(2);
        assertThat(listener.events().get(0).error()).contains("boom");
        assertThat(listener.events().get(1).intAttribute(JobEvent.RETRY_COUNT)).isEqualTo(2);
    }

    @Test
    void unsubscribedListenerStopsReceiving() {
        RecordingEventListener listener = new RecordingEventListener();
        try (EventBus bus = new EventBus()) {
            bus.subscribe(listener);
            bus.publish(JobEvent.jobRetry(AT, "job_1"));
            bus.flush(Duration.ofSeconds(5));
            bus.unsubscribe(listener);
            bus.publish(JobEvent.jobCancelled(AT, "job_1"));
            bus.flush(Duration.ofSeconds(5));
        }

        assertThat(listener.types()).containsExactly(EventType.JOB_RETRY);
    }

    @Test
    void publicationsAfterCloseAreDropped() {
        RecordingEventListener listener = new RecordingEventListener();
        EventBus bus = new EventBus();
        bus.subscribe(listener);
        bus.close();

        bus.publish(JobEvent.stopped(AT));

        assertThat(bus.flush(Duration.ofMillis(100))).isTrue();
        assertThat(listener.events()).isEmpty();
    }

    @Test
    void wireNamesRoundTrip() {
        assertThat(EventType.ITEM_CACHE_HIT.wireName()).isEqualTo("item:cache-hit");
        assertThat(EventType.fromWireName("job:completed")).isEqualTo(EventType.JOB_COMPLETED);
        assertThatThrownBy(() -> EventType.fromWireName("job:exploded")).isInstanceOf(IllegalArgumentException.class);
    }
}
