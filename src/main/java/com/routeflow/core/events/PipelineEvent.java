package com.routeflow.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Progress event emitted while a run executes.
 *
 * @param eventType "run.started", "stage.completed" or "run.completed"
 * @param runId     the run this event belongs to
 * @param stage     the stage this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record PipelineEvent(
    String eventType,
    String runId,
    String stage,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String RUN_STARTED = "run.started";
    public static final String STAGE_COMPLETED = "stage.completed";
    public static final String RUN_COMPLETED = "run.completed";

    public static PipelineEvent of(String eventType, String runId, String stage, Map<String, Object> payload) {
        return new PipelineEvent(eventType, runId, stage, payload, Instant.now());
    }

    /**
     * Whether this is the last event a run publishes.
     */
    public boolean isTerminal() {
        return RUN_COMPLETED.equals(eventType);
    }
}
