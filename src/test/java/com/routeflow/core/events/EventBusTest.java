package com.routeflow.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static PipelineEvent stageDone(String runId, String stage) {
        return PipelineEvent.of(PipelineEvent.STAGE_COMPLETED, runId, stage, Map.of("elapsedMs", 5L));
    }

    private static PipelineEvent completed(String runId) {
        return PipelineEvent.of(PipelineEvent.RUN_COMPLETED, runId, null, Map.of("path", "full"));
    }

    @Nested
    @DisplayName("run listeners")
    class RunListenerTests {

        @Test
        @DisplayName("deliver only the subscribed run's events, in order")
        void deliversRunEventsInOrder() {
            List<PipelineEvent> received = new ArrayList<>();
            eventBus.subscribe("RF-1", received::add);

            eventBus.publish(stageDone("RF-1", "routing"));
            eventBus.publish(stageDone("RF-2", "routing"));
            eventBus.publish(stageDone("RF-1", "gate"));

            assertEquals(List.of("routing", "gate"), received.stream().map(PipelineEvent::stage).toList());
        }

        @Test
        @DisplayName("closing the subscription stops delivery")
        void close() {
            List<PipelineEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("RF-1", received::add);

            eventBus.publish(stageDone("RF-1", "routing"));
            subscription.close();
            subscription.close();
            eventBus.publish(stageDone("RF-1", "gate"));

            assertEquals(1, received.size());
            assertEquals(0, eventBus.listenerCount("RF-1"));
        }

        @Test
        @DisplayName("a typed listener sees only its event type")
        void typedListener() {
            List<PipelineEvent> received = new ArrayList<>();
            eventBus.subscribe("RF-1", PipelineEvent.STAGE_COMPLETED, received::add);

            eventBus.publish(PipelineEvent.of(PipelineEvent.RUN_STARTED, "RF-1", null, Map.of()));
            eventBus.publish(stageDone("RF-1", "routing"));
            eventBus.publish(completed("RF-1"));

            assertEquals(1, received.size());
            assertEquals("routing", received.get(0).stage());
        }
    }

    @Nested
    @DisplayName("run completion")
    class CompletionTests {

        @Test
        @DisplayName("listeners receive run.completed and are then dropped")
        void droppedAfterCompletion() {
            List<String> received = new ArrayList<>();
            eventBus.subscribe("RF-1", event -> received.add(event.eventType()));

            eventBus.publish(stageDone("RF-1", "routing"));
            eventBus.publish(completed("RF-1"));
            eventBus.publish(stageDone("RF-1", "late"));

            assertEquals(List.of(PipelineEvent.STAGE_COMPLETED, PipelineEvent.RUN_COMPLETED), received);
            assertEquals(0, eventBus.listenerCount("RF-1"));
        }

        @Test
        @DisplayName("completing one run leaves other runs' listeners in place")
        void otherRunsUntouched() {
            eventBus.subscribe("RF-1", event -> { });
            eventBus.subscribe("RF-2", event -> { });

            eventBus.publish(completed("RF-1"));

            assertEquals(0, eventBus.listenerCount("RF-1"));
            assertEquals(1, eventBus.listenerCount("RF-2"));
        }
    }

    @Test
    @DisplayName("a throwing listener does not stop the others")
    void isolatesListenerFailures() {
        List<PipelineEvent> received = new ArrayList<>();
        eventBus.subscribe("RF-1", e -> {
            throw new IllegalStateException("listener broke");
        });
        eventBus.subscribe("RF-1", received::add);

        assertDoesNotThrow(() -> eventBus.publish(stageDone("RF-1", "routing")));
        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("events without listeners are ignored")
    void noListeners() {
        assertDoesNotThrow(() -> eventBus.publish(stageDone("RF-9", "routing")));
        assertDoesNotThrow(() -> eventBus.publish(completed("RF-9")));
    }

    @Test
    @DisplayName("concurrent publishes are all delivered")
    void concurrentPublishes() throws InterruptedException {
        CopyOnWriteArrayList<PipelineEvent> received = new CopyOnWriteArrayList<>();
        eventBus.subscribe("RF-1", received::add);

        int threads = 8;
        CountDownLatch latch = new CountDownLatch(threads);
        for (int t = 0; t < threads; t++) {
            new Thread(() -> {
                for (int i = 0; i < 50; i++) {
                    eventBus.publish(stageDone("RF-1", "invocation"));
                }
                latch.countDown();
            }).start();
        }

        assertTrue(latch.await(10, TimeUnit.SECONDS));
        assertEquals(threads * 50, received.size());
    }
}
