package com.routeflow.core.model;

/**
 * Continuation signals returned by the two decision points of the pipeline.
 * <ul>
 *   <li>after the gate: {@link #PROCEED} or {@link #BLOCK}</li>
 *   <li>after the early-exit check: {@link #EXIT} or {@link #CONTINUE}</li>
 * </ul>
 */
public enum Fork {
    PROCEED,
    BLOCK,
    EXIT,
    CONTINUE
}
