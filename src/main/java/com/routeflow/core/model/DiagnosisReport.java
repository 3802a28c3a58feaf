package com.routeflow.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Cross-specialist assessment as returned by the reasoning capability.
 * Severity is kept as text here and normalised with {@link Severity#parse}.
 */
public record DiagnosisReport(
    List<String> issues,
    List<String> rootCauses,
    List<String> correlations,
    String severity,
    String summary
) implements Serializable {

    public DiagnosisReport {
        issues = issues != null ? List.copyOf(issues) : List.of();
        rootCauses = rootCauses != null ? List.copyOf(rootCauses) : List.of();
        correlations = correlations != null ? List.copyOf(correlations) : List.of();
    }
}
