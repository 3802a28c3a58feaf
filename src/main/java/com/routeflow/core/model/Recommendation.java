package com.routeflow.core.model;

import java.io.Serializable;

/**
 * A prioritized action item. Any field except {@code action} may be
 * missing when it comes straight from the model; validation fills or flags it.
 */
public record Recommendation(
    Priority priority,
    String action,
    String reason,
    String expectedImpact
) implements Serializable {

    public Recommendation withPriority(Priority newPriority) {
        return new Recommendation(newPriority, action, reason, expectedImpact);
    }

    public boolean hasAction() {
        return action != null && !action.isBlank();
    }

    public boolean hasReason() {
        return reason != null && !reason.isBlank();
    }
}
