package com.routeflow.core.model;

/**
 * Which branch of the pipeline produced the final response.
 */
public enum TerminalPath {
    CLARIFICATION,
    BLOCKED,
    EARLY_EXIT,
    FULL,
    DEGRADED;

    public String tag() {
        return name().toLowerCase();
    }
}
