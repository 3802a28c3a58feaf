package com.routeflow.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Delivers progress events to the listeners of the run they belong to.
 * <p>
 * Listeners are scoped to one run id. A run's listeners receive its
 * {@value PipelineEvent#RUN_COMPLETED} event and are then dropped, so nothing
 * outlives the run even if a caller never closes its subscription.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, List<Consumer<PipelineEvent>>> listeners = new ConcurrentHashMap<>();

    public void publish(PipelineEvent event) {
        List<Consumer<PipelineEvent>> runListeners = event.isTerminal()
                ? listeners.remove(event.runId())
                : listeners.get(event.runId());
        if (runListeners == null) {
            log.trace("No listeners for {} of run {}", event.eventType(), event.runId());
            return;
        }
        for (Consumer<PipelineEvent> listener : runListeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener for run {} failed on {}: {}", event.runId(), event.eventType(), e.getMessage(), e);
            }
        }
    }

    /**
     * Registers a listener for every event of one run.
     */
    public Subscription subscribe(String runId, Consumer<PipelineEvent> listener) {
        listeners.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> listeners.computeIfPresent(runId, (k, current) -> {
            current.remove(listener);
            return current.isEmpty() ? null : current;
        });
    }

    /**
     * Registers a listener for one event type of one run.
     */
    public Subscription subscribe(String runId, String eventType, Consumer<PipelineEvent> listener) {
        return subscribe(runId, event -> {
            if (eventType.equals(event.eventType())) {
                listener.accept(event);
            }
        });
    }

    int listenerCount(String runId) {
        List<Consumer<PipelineEvent>> runListeners = listeners.get(runId);
        return runListeners != null ? runListeners.size() : 0;
    }

    /**
     * Handle that removes a listener; closing twice is harmless.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {

        @Override
        void close();
    }
}
