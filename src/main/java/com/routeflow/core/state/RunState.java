package com.routeflow.core.state;

import com.routeflow.core.model.Recommendation;
import com.routeflow.core.model.Severity;
import com.routeflow.core.model.SpecialistOutcome;
import com.routeflow.core.model.TerminalPath;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-query record threaded through the pipeline.
 * <p>
 * {@link #SCHEMA} is the single place where each field's merge rule lives:
 * primary outputs are write-once, bookkeeping lists are appenders, and the
 * specialist and timing maps are merged key by key.
 */
public class RunState extends AgentState {

    // ── Identity ─────────────────────────────────────────────────────
    public static final String RUN_ID = "runId";
    public static final String QUERY = "query";
    public static final String SESSION_ID = "sessionId";
    public static final String USER_ID = "userId";
    public static final String STARTED_AT = "startedAt";
    public static final String DEADLINE_AT = "deadlineAt";

    // ── Routing ──────────────────────────────────────────────────────
    public static final String ROUTED_SPECIALISTS = "routedSpecialists";
    public static final String ROUTING_CONFIDENCE = "routingConfidence";
    public static final String ROUTING_RATIONALE = "routingRationale";
    public static final String CLARIFICATION_NEEDED = "clarificationNeeded";
    public static final String CLARIFICATION_MESSAGE = "clarificationMessage";

    // ── Gate ─────────────────────────────────────────────────────────
    public static final String GATE_APPROVED = "gateApproved";
    public static final String APPROVED_SPECIALISTS = "approvedSpecialists";
    public static final String GATE_WARNINGS = "gateWarnings";
    public static final String BLOCK_REASON = "blockReason";

    // ── Invocation ───────────────────────────────────────────────────
    public static final String OUTCOMES = "outcomes";
    public static final String SPECIALIST_ERRORS = "specialistErrors";

    // ── Diagnosis ────────────────────────────────────────────────────
    public static final String ISSUES = "issues";
    public static final String ROOT_CAUSES = "rootCauses";
    public static final String CORRELATIONS = "correlations";
    public static final String SEVERITY = "severity";
    public static final String DIAGNOSIS_SUMMARY = "diagnosisSummary";
    public static final String DIAGNOSIS_SHORTCUT = "diagnosisShortcut";

    // ── Early exit ───────────────────────────────────────────────────
    public static final String EARLY_EXIT = "earlyExit";
    public static final String EARLY_EXIT_REASON = "earlyExitReason";
    public static final String EARLY_EXIT_RESPONSE = "earlyExitResponse";

    // ── Recommendation / validation ──────────────────────────────────
    public static final String RECOMMENDATIONS = "recommendations";
    public static final String RECOMMENDATION_CONFIDENCE = "recommendationConfidence";
    public static final String ACTION_PLAN = "actionPlan";
    public static final String VALIDATED_RECOMMENDATIONS = "validatedRecommendations";
    public static final String VALIDATION_WARNINGS = "validationWarnings";
    public static final String VALIDATION_ERRORS = "validationErrors";

    // ── Bookkeeping ──────────────────────────────────────────────────
    public static final String CAPABILITIES_INVOKED = "capabilitiesInvoked";
    public static final String TRACE = "trace";
    public static final String STAGES_RUN = "stagesRun";
    public static final String STAGE_TIMINGS = "stageTimings";

    // ── Final output ─────────────────────────────────────────────────
    public static final String FINAL_RESPONSE = "finalResponse";
    public static final String CONFIDENCE = "confidence";
    public static final String TERMINAL_PATH = "terminalPath";
    public static final String TOTAL_ELAPSED_MS = "totalElapsedMs";

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Write-once channels ──────────────────────────────────────
        Map.entry(RUN_ID,                    StateReducers.writeOnce(RUN_ID)),
        Map.entry(QUERY,                     StateReducers.writeOnce(QUERY)),
        Map.entry(SESSION_ID,                StateReducers.writeOnce(SESSION_ID)),
        Map.entry(USER_ID,                   StateReducers.writeOnce(USER_ID)),
        Map.entry(STARTED_AT,                StateReducers.writeOnce(STARTED_AT)),
        Map.entry(DEADLINE_AT,               StateReducers.writeOnce(DEADLINE_AT)),
        Map.entry(ROUTED_SPECIALISTS,        StateReducers.writeOnce(ROUTED_SPECIALISTS)),
        Map.entry(ROUTING_CONFIDENCE,        StateReducers.writeOnce(ROUTING_CONFIDENCE)),
        Map.entry(ROUTING_RATIONALE,         StateReducers.writeOnce(ROUTING_RATIONALE)),
        Map.entry(CLARIFICATION_NEEDED,      StateReducers.writeOnce(CLARIFICATION_NEEDED)),
        Map.entry(CLARIFICATION_MESSAGE,     StateReducers.writeOnce(CLARIFICATION_MESSAGE)),
        Map.entry(GATE_APPROVED,             StateReducers.writeOnce(GATE_APPROVED)),
        Map.entry(APPROVED_SPECIALISTS,      StateReducers.writeOnce(APPROVED_SPECIALISTS)),
        Map.entry(GATE_WARNINGS,             StateReducers.writeOnce(GATE_WARNINGS)),
        Map.entry(BLOCK_REASON,              StateReducers.writeOnce(BLOCK_REASON)),
        Map.entry(ISSUES,                    StateReducers.writeOnce(ISSUES)),
        Map.entry(ROOT_CAUSES,               StateReducers.writeOnce(ROOT_CAUSES)),
        Map.entry(CORRELATIONS,              StateReducers.writeOnce(CORRELATIONS)),
        Map.entry(SEVERITY,                  StateReducers.writeOnce(SEVERITY)),
        Map.entry(DIAGNOSIS_SUMMARY,         StateReducers.writeOnce(DIAGNOSIS_SUMMARY)),
        Map.entry(DIAGNOSIS_SHORTCUT,        StateReducers.writeOnce(DIAGNOSIS_SHORTCUT)),
        Map.entry(EARLY_EXIT,                StateReducers.writeOnce(EARLY_EXIT)),
        Map.entry(EARLY_EXIT_REASON,         StateReducers.writeOnce(EARLY_EXIT_REASON)),
        Map.entry(EARLY_EXIT_RESPONSE,       StateReducers.writeOnce(EARLY_EXIT_RESPONSE)),
        Map.entry(RECOMMENDATIONS,           StateReducers.writeOnce(RECOMMENDATIONS)),
        Map.entry(RECOMMENDATION_CONFIDENCE, StateReducers.writeOnce(RECOMMENDATION_CONFIDENCE)),
        Map.entry(ACTION_PLAN,               StateReducers.writeOnce(ACTION_PLAN)),
        Map.entry(VALIDATED_RECOMMENDATIONS, StateReducers.writeOnce(VALIDATED_RECOMMENDATIONS)),
        Map.entry(VALIDATION_WARNINGS,       StateReducers.writeOnce(VALIDATION_WARNINGS)),
        Map.entry(VALIDATION_ERRORS,         StateReducers.writeOnce(VALIDATION_ERRORS)),
        Map.entry(FINAL_RESPONSE,            StateReducers.writeOnce(FINAL_RESPONSE)),
        Map.entry(CONFIDENCE,                StateReducers.writeOnce(CONFIDENCE)),
        Map.entry(TERMINAL_PATH,             StateReducers.writeOnce(TERMINAL_PATH)),
        Map.entry(TOTAL_ELAPSED_MS,          StateReducers.writeOnce(TOTAL_ELAPSED_MS)),

        // ── Key-wise map channels ────────────────────────────────────
        Map.entry(OUTCOMES,                  StateReducers.<SpecialistOutcome>keyed()),
        Map.entry(SPECIALIST_ERRORS,         StateReducers.<String>keyed()),
        Map.entry(STAGE_TIMINGS,             StateReducers.<Long>keyed()),

        // ── Appender channels (list accumulation) ────────────────────
        Map.entry(CAPABILITIES_INVOKED,      Channels.appender(ArrayList::new)),
        Map.entry(TRACE,                     Channels.appender(ArrayList::new)),
        Map.entry(STAGES_RUN,                Channels.appender(ArrayList::new))
    );

    public RunState(Map<String, Object> initData) {
        super(initData);
    }

    // ── Identity ─────────────────────────────────────────────────────

    public String runId() {
        return this.<String>value(RUN_ID).orElse("");
    }

    public String query() {
        return this.<String>value(QUERY).orElse("");
    }

    public Optional<String> sessionId() {
        return this.<String>value(SESSION_ID).filter(s -> !s.isBlank());
    }

    public String userId() {
        return this.<String>value(USER_ID).orElse("");
    }

    public long startedAt() {
        return this.<Number>value(STARTED_AT).map(Number::longValue).orElse(0L);
    }

    /** Absolute run deadline in epoch millis, or {@code Long.MAX_VALUE} when unbounded. */
    public long deadlineAt() {
        return this.<Number>value(DEADLINE_AT).map(Number::longValue).orElse(Long.MAX_VALUE);
    }

    // ── Routing ──────────────────────────────────────────────────────

    public List<String> routedSpecialists() {
        return this.<List<String>>value(ROUTED_SPECIALISTS).orElse(List.of());
    }

    public double routingConfidence() {
        return this.<Number>value(ROUTING_CONFIDENCE).map(Number::doubleValue).orElse(0.0);
    }

    public String routingRationale() {
        return this.<String>value(ROUTING_RATIONALE).orElse("");
    }

    public boolean clarificationNeeded() {
        return this.<Boolean>value(CLARIFICATION_NEEDED).orElse(false);
    }

    public String clarificationMessage() {
        return this.<String>value(CLARIFICATION_MESSAGE).orElse("");
    }

    // ── Gate ─────────────────────────────────────────────────────────

    public Optional<Boolean> gateApproved() {
        return value(GATE_APPROVED);
    }

    public List<String> approvedSpecialists() {
        return this.<List<String>>value(APPROVED_SPECIALISTS).orElse(List.of());
    }

    public List<String> gateWarnings() {
        return this.<List<String>>value(GATE_WARNINGS).orElse(List.of());
    }

    public String blockReason() {
        return this.<String>value(BLOCK_REASON).orElse("");
    }

    // ── Invocation ───────────────────────────────────────────────────

    public Map<String, SpecialistOutcome> outcomes() {
        return this.<Map<String, SpecialistOutcome>>value(OUTCOMES).orElse(Map.of());
    }

    public Map<String, String> specialistErrors() {
        return this.<Map<String, String>>value(SPECIALIST_ERRORS).orElse(Map.of());
    }

    // ── Diagnosis ────────────────────────────────────────────────────

    public boolean hasDiagnosis() {
        return value(SEVERITY).isPresent();
    }

    public List<String> issues() {
        return this.<List<String>>value(ISSUES).orElse(List.of());
    }

    public List<String> rootCauses() {
        return this.<List<String>>value(ROOT_CAUSES).orElse(List.of());
    }

    public List<String> correlations() {
        return this.<List<String>>value(CORRELATIONS).orElse(List.of());
    }

    public Optional<Severity> severity() {
        return this.<String>value(SEVERITY).map(Severity::valueOf);
    }

    public String diagnosisSummary() {
        return this.<String>value(DIAGNOSIS_SUMMARY).orElse("");
    }

    public boolean diagnosisShortcut() {
        return this.<Boolean>value(DIAGNOSIS_SHORTCUT).orElse(false);
    }

    // ── Early exit ───────────────────────────────────────────────────

    public boolean earlyExit() {
        return this.<Boolean>value(EARLY_EXIT).orElse(false);
    }

    public String earlyExitReason() {
        return this.<String>value(EARLY_EXIT_REASON).orElse("");
    }

    public String earlyExitResponse() {
        return this.<String>value(EARLY_EXIT_RESPONSE).orElse("");
    }

    // ── Recommendation / validation ──────────────────────────────────

    public List<Recommendation> recommendations() {
        return this.<List<Recommendation>>value(RECOMMENDATIONS).orElse(List.of());
    }

    public Optional<Double> recommendationConfidence() {
        return this.<Number>value(RECOMMENDATION_CONFIDENCE).map(Number::doubleValue);
    }

    public String actionPlan() {
        return this.<String>value(ACTION_PLAN).orElse("");
    }

    public boolean hasValidation() {
        return value(VALIDATED_RECOMMENDATIONS).isPresent();
    }

    public List<Recommendation> validatedRecommendations() {
        return this.<List<Recommendation>>value(VALIDATED_RECOMMENDATIONS).orElse(List.of());
    }

    public List<String> validationWarnings() {
        return this.<List<String>>value(VALIDATION_WARNINGS).orElse(List.of());
    }

    public List<String> validationErrors() {
        return this.<List<String>>value(VALIDATION_ERRORS).orElse(List.of());
    }

    // ── Bookkeeping ──────────────────────────────────────────────────

    public List<String> capabilitiesInvoked() {
        return this.<List<String>>value(CAPABILITIES_INVOKED).orElse(List.of());
    }

    public List<String> trace() {
        return this.<List<String>>value(TRACE).orElse(List.of());
    }

    public List<String> stagesRun() {
        return this.<List<String>>value(STAGES_RUN).orElse(List.of());
    }

    public Map<String, Long> stageTimings() {
        return this.<Map<String, Long>>value(STAGE_TIMINGS).orElse(Map.of());
    }

    // ── Final output ─────────────────────────────────────────────────

    public Optional<String> finalResponse() {
        return this.<String>value(FINAL_RESPONSE).filter(s -> !s.isBlank());
    }

    public double confidence() {
        return this.<Number>value(CONFIDENCE).map(Number::doubleValue).orElse(0.0);
    }

    public Optional<TerminalPath> terminalPath() {
        return this.<String>value(TERMINAL_PATH).map(TerminalPath::valueOf);
    }

    public long totalElapsedMs() {
        return this.<Number>value(TOTAL_ELAPSED_MS).map(Number::longValue).orElse(0L);
    }
}
