package com.routeflow.core.stages;

import com.routeflow.core.model.Recommendation;
import com.routeflow.core.model.TerminalPath;
import com.routeflow.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Assembles the user-facing answer from whatever the run produced.
 * <p>
 * Precedence, first match wins: clarification, gate block, early exit,
 * full analysis. Never returns blank text.
 */
@Component
public class ResponseStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(ResponseStage.class);

    public static final String NAME = "response";

    static final double EARLY_EXIT_CONFIDENCE = 0.8;
    static final double DEFAULT_CONFIDENCE = 0.8;
    static final double PARTIAL_CONFIDENCE = 0.5;
    static final int MAX_NOTES = 3;

    static final String DEFAULT_CLARIFICATION =
            "I'm not sure what you're asking about. Could you rephrase your question with more detail?";

    /**
     * Rendered answer and the branch that produced it.
     */
    public record Rendered(String text, double confidence, TerminalPath path) {}

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Object> apply(RunState state) {
        Rendered rendered = render(state);
        long elapsed = state.startedAt() > 0 ? System.currentTimeMillis() - state.startedAt() : 0L;
        log.info("Response assembled via {} path, confidence {}", rendered.path().tag(), rendered.confidence());
        return Map.of(
                RunState.FINAL_RESPONSE, rendered.text(),
                RunState.CONFIDENCE, rendered.confidence(),
                RunState.TERMINAL_PATH, rendered.path().name(),
                RunState.TOTAL_ELAPSED_MS, elapsed,
                RunState.TRACE, List.of("Response: " + rendered.path().tag()));
    }

    /**
     * Pure rendering of the final answer from a state snapshot.
     */
    public Rendered render(RunState state) {
        if (state.clarificationNeeded()) {
            String message = state.clarificationMessage();
            return new Rendered(message.isBlank() ? DEFAULT_CLARIFICATION : message, 0.0, TerminalPath.CLARIFICATION);
        }
        if (state.gateApproved().isPresent() && !state.gateApproved().get()) {
            return new Rendered("Unable to process query: " + state.blockReason(), 0.0, TerminalPath.BLOCKED);
        }
        if (state.earlyExit()) {
            String text = state.earlyExitResponse();
            if (text.isBlank()) {
                text = state.diagnosisSummary().isBlank() ? EarlyExitStage.NOTHING_FOUND : state.diagnosisSummary();
            }
            return new Rendered(text, EARLY_EXIT_CONFIDENCE, TerminalPath.EARLY_EXIT);
        }
        return new Rendered(fullReport(state),
                state.recommendationConfidence().orElse(DEFAULT_CONFIDENCE), TerminalPath.FULL);
    }

    /**
     * Answer for a run that did not reach this stage. Decisions already made
     * upstream (clarification, block, early exit) are still honoured; otherwise
     * any diagnosis gathered so far is returned with a note.
     */
    public Rendered renderDegraded(RunState state, Throwable cause) {
        String reason = describe(cause);
        if (state.clarificationNeeded()
                || state.gateApproved().filter(approved -> !approved).isPresent()
                || state.earlyExit()) {
            Rendered decided = render(state);
            return new Rendered(decided.text(), decided.confidence(), TerminalPath.DEGRADED);
        }
        if (state.hasDiagnosis() && !state.diagnosisSummary().isBlank()) {
            String text = "## Partial Analysis\n\n"
                    + "**Severity:** " + state.severity().map(Enum::name).orElse("UNKNOWN") + "\n\n"
                    + state.diagnosisSummary() + "\n\n"
                    + "_The analysis did not complete (" + reason + "). Recommendations are unavailable._";
            return new Rendered(text, PARTIAL_CONFIDENCE, TerminalPath.DEGRADED);
        }
        return new Rendered("I encountered an error processing your request: " + reason,
                0.0, TerminalPath.DEGRADED);
    }

    private static String fullReport(RunState state) {
        var sb = new StringBuilder();
        sb.append("# Analysis Results\n\n");
        sb.append("**Query:** ").append(state.query()).append("\n\n");

        sb.append("## Diagnosis\n\n");
        sb.append("**Severity:** ").append(state.severity().map(Enum::name).orElse("UNKNOWN")).append("\n\n");
        if (!state.diagnosisSummary().isBlank()) {
            sb.append(state.diagnosisSummary()).append("\n\n");
        }
        if (!state.rootCauses().isEmpty()) {
            sb.append("**Root Causes:**\n");
            state.rootCauses().forEach(cause -> sb.append("- ").append(cause).append('\n'));
            sb.append('\n');
        }

        sb.append("## Recommendations\n\n");
        List<Recommendation> recommendations = state.validatedRecommendations();
        if (recommendations.isEmpty()) {
            sb.append("No recommendations were generated.\n\n");
        }
        for (int i = 0; i < recommendations.size(); i++) {
            Recommendation r = recommendations.get(i);
            sb.append("### ").append(i + 1).append(". [").append(r.priority()).append("] ")
                    .append(r.action()).append('\n');
            if (r.hasReason()) {
                sb.append("**Why:** ").append(r.reason()).append('\n');
            }
            if (r.expectedImpact() != null && !r.expectedImpact().isBlank()) {
                sb.append("**Expected Impact:** ").append(r.expectedImpact()).append('\n');
            }
            sb.append('\n');
        }

        List<String> notes = state.validationWarnings().stream().limit(MAX_NOTES).toList();
        if (!notes.isEmpty() || !state.specialistErrors().isEmpty()) {
            sb.append("## Notes\n\n");
            notes.forEach(note -> sb.append("- ").append(note).append('\n'));
            if (!state.specialistErrors().isEmpty()) {
                sb.append("- Data unavailable from: ")
                        .append(String.join(", ", state.specialistErrors().keySet())).append('\n');
            }
        }
        return sb.toString().trim();
    }

    static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null && !cause.getMessage().isBlank()
                ? cause.getMessage()
                : cause.getClass().getSimpleName();
    }
}
