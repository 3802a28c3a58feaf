package com.routeflow.core.stages;

import com.routeflow.core.state.RunState;

import java.util.Map;

/**
 * A named unit of the pipeline. Reads the current {@link RunState} and returns
 * a partial update that the graph merges according to {@link RunState#SCHEMA}.
 * Continuation signals are derived from the merged state by the two decision
 * stages, never from the update itself.
 */
public interface Stage {

    String name();

    Map<String, Object> apply(RunState state);
}
