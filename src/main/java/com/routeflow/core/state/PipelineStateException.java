package com.routeflow.core.state;

/**
 * Thrown when a stage update breaks a RunState invariant, such as rewriting
 * a write-once field or re-entering a stage. Fatal to the run.
 */
public class PipelineStateException extends RuntimeException {

    public PipelineStateException(String message) {
        super(message);
    }
}
