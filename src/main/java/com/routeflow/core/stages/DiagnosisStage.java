package com.routeflow.core.stages;

import com.routeflow.core.model.DiagnosisReport;
import com.routeflow.core.model.Severity;
import com.routeflow.core.model.SpecialistOutcome;
import com.routeflow.core.reasoning.ReasoningClient;
import com.routeflow.core.reasoning.ReasoningParser;
import com.routeflow.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Synthesizes a cross-specialist assessment from the invocation outcomes.
 * <p>
 * A single successful outcome for an informational question is passed
 * through as-is without a reasoning call. An empty outcome map produces a
 * "no data" diagnosis rather than an error.
 */
@Component
public class DiagnosisStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(DiagnosisStage.class);

    public static final String NAME = "diagnosis";

    private static final int MAX_OUTCOME_CHARS = 4000;

    private final ReasoningClient reasoningClient;

    public DiagnosisStage(ReasoningClient reasoningClient) {
        this.reasoningClient = reasoningClient;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Object> apply(RunState state) {
        Map<String, SpecialistOutcome> outcomes = state.outcomes();
        Map<String, String> errors = state.specialistErrors();

        if (outcomes.isEmpty()) {
            String summary = "No data available: none of the selected specialists returned results"
                    + (errors.isEmpty() ? "." : " (failed: " + String.join(", ", errors.keySet()) + ").");
            log.info("Diagnosis skipped, no specialist outcomes");
            return update(new DiagnosisReport(List.of(), List.of(), List.of(), Severity.LOW.name(), summary),
                    Severity.LOW, false, List.of(), "Diagnosis: no data available");
        }

        if (outcomes.size() == 1 && QueryIntentClassifier.isInformational(state.query())) {
            var only = outcomes.entrySet().iterator().next();
            log.info("Informational query answered by {} alone, skipping reasoning", only.getKey());
            return update(new DiagnosisReport(List.of(), List.of(), List.of(), Severity.LOW.name(),
                            Objects.requireNonNullElse(only.getValue().response(), "")),
                    Severity.LOW, true, List.of(),
                    "Diagnosis: informational shortcut using " + only.getKey());
        }

        try {
            String reply = reasoningClient.complete(buildPrompt(state.query(), outcomes, errors));
            DiagnosisReport report = ReasoningParser.parse(reply, DiagnosisReport.class);
            Severity severity = Severity.parse(report.severity());
            if (report.summary() == null || report.summary().isBlank()) {
                report = new DiagnosisReport(report.issues(), report.rootCauses(), report.correlations(),
                        severity.name(), fallbackSummary(outcomes, errors));
            }
            log.info("Diagnosis: severity={}, issues={}, rootCauses={}",
                    severity, report.issues().size(), report.rootCauses().size());
            return update(report, severity, false, List.of("reasoning:diagnosis"),
                    "Diagnosis: severity %s, %d issue(s)".formatted(severity, report.issues().size()));
        } catch (RuntimeException e) {
            log.warn("Diagnosis via reasoning failed, using outcome summary: {}", e.getMessage());
            return update(fallbackReport(outcomes, errors), fallbackSeverity(errors), false,
                    List.of("reasoning:diagnosis"), "Diagnosis: fallback summary (" + e.getMessage() + ")");
        }
    }

    static DiagnosisReport fallbackReport(Map<String, SpecialistOutcome> outcomes, Map<String, String> errors) {
        var issues = new ArrayList<String>();
        errors.forEach((id, message) -> issues.add("No data from " + id + ": " + message));
        return new DiagnosisReport(issues, List.of(), List.of(),
                fallbackSeverity(errors).name(), fallbackSummary(outcomes, errors));
    }

    private static Severity fallbackSeverity(Map<String, String> errors) {
        return errors.isEmpty() ? Severity.LOW : Severity.MEDIUM;
    }

    private static String fallbackSummary(Map<String, SpecialistOutcome> outcomes, Map<String, String> errors) {
        var sb = new StringBuilder();
        outcomes.forEach((id, outcome) -> {
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append("**").append(id).append(":** ").append(outcome.response());
        });
        if (!errors.isEmpty()) {
            sb.append("\n\nUnavailable: ").append(String.join(", ", errors.keySet()));
        }
        return sb.toString();
    }

    private static String buildPrompt(String query, Map<String, SpecialistOutcome> outcomes,
                                      Map<String, String> errors) {
        var sb = new StringBuilder();
        sb.append("Diagnose the campaign situation from the specialist findings below.\n\n");
        sb.append("User question: \"").append(query).append("\"\n\n");
        outcomes.forEach((id, outcome) -> {
            String text = Objects.requireNonNullElse(outcome.response(), "");
            if (text.length() > MAX_OUTCOME_CHARS) {
                text = text.substring(0, MAX_OUTCOME_CHARS) + "...";
            }
            sb.append("### ").append(id).append('\n').append(text).append("\n\n");
        });
        if (!errors.isEmpty()) {
            sb.append("Specialists that failed: ").append(String.join(", ", errors.keySet())).append("\n\n");
        }
        sb.append("""
                Respond with a JSON object only:
                {"issues": [...], "rootCauses": [...], "correlations": [...],
                 "severity": "low|medium|high|critical", "summary": "..."}
                Use an empty issues list when nothing is wrong.
                """);
        return sb.toString();
    }

    private static Map<String, Object> update(DiagnosisReport report, Severity severity, boolean shortcut,
                                              List<String> capabilities, String trace) {
        return Map.of(
                RunState.ISSUES, report.issues(),
                RunState.ROOT_CAUSES, report.rootCauses(),
                RunState.CORRELATIONS, report.correlations(),
                RunState.SEVERITY, severity.name(),
                RunState.DIAGNOSIS_SUMMARY, report.summary(),
                RunState.DIAGNOSIS_SHORTCUT, shortcut,
                RunState.CAPABILITIES_INVOKED, capabilities,
                RunState.TRACE, List.of(trace));
    }
}
