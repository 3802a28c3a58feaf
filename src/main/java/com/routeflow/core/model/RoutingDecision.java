package com.routeflow.core.model;

import java.util.List;

/**
 * Output of the routing stage. Either a set of candidate specialists or a
 * clarification request, never both.
 */
public record RoutingDecision(
    List<String> specialists,
    double confidence,
    String rationale,
    boolean clarificationNeeded,
    String clarificationMessage,
    boolean fallback
) {

    public RoutingDecision {
        specialists = specialists != null ? List.copyOf(specialists) : List.of();
    }

    public static RoutingDecision routed(List<String> specialists, double confidence,
                                         String rationale, boolean fallback) {
        return new RoutingDecision(specialists, confidence, rationale, false, null, fallback);
    }

    public static RoutingDecision clarify(double confidence, String rationale,
                                          String message, boolean fallback) {
        return new RoutingDecision(List.of(), confidence, rationale, true, message, fallback);
    }
}
