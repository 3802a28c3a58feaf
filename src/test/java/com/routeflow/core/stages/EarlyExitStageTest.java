package com.routeflow.core.stages;

import com.routeflow.core.TestFixtures;
import com.routeflow.core.model.Fork;
import com.routeflow.core.model.Severity;
import com.routeflow.core.state.RunState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EarlyExitStageTest {

    private final EarlyExitStage stage = new EarlyExitStage();

    private static RunState diagnosed(Severity severity, int issues, String summary) {
        var list = new ArrayList<String>();
        for (int i = 1; i <= issues; i++) {
            list.add("issue " + i);
        }
        return TestFixtures.state(
                RunState.RUN_ID, "RF-1",
                RunState.SEVERITY, severity.name(),
                RunState.ISSUES, list,
                RunState.DIAGNOSIS_SUMMARY, summary);
    }

    private Fork fork(RunState state) {
        Map<String, Object> update = stage.apply(state);
        var data = new HashMap<>(state.data());
        data.putAll(update);
        return stage.decide(new RunState(data));
    }

    @Test
    @DisplayName("Severe diagnoses always continue, even with no issues")
    void severeContinues() {
        for (Severity severity : List.of(Severity.HIGH, Severity.CRITICAL)) {
            for (int issues = 0; issues <= 5; issues++) {
                assertEquals(Fork.CONTINUE, fork(diagnosed(severity, issues, "summary")));
            }
        }
    }

    @Test
    @DisplayName("Mild diagnoses with at most two issues exit")
    void mildFewIssuesExit() {
        assertEquals(Fork.EXIT, fork(diagnosed(Severity.LOW, 0, "all good")));
        assertEquals(Fork.EXIT, fork(diagnosed(Severity.MEDIUM, 1, "one thing")));
        assertEquals(Fork.EXIT, fork(diagnosed(Severity.MEDIUM, 2, "two things")));
    }

    @Test
    @DisplayName("More than two issues continue")
    void manyIssuesContinue() {
        assertEquals(Fork.CONTINUE, fork(diagnosed(Severity.LOW, 3, "s")));
        assertEquals(Fork.CONTINUE, fork(diagnosed(Severity.MEDIUM, 4, "s")));
    }

    @Test
    @DisplayName("Exit response is the summary, or a stock line when the summary is blank")
    void exitResponse() {
        assertEquals("Spend is on plan.",
                stage.apply(diagnosed(Severity.LOW, 0, "Spend is on plan.")).get(RunState.EARLY_EXIT_RESPONSE));
        assertEquals(EarlyExitStage.NOTHING_FOUND,
                stage.apply(diagnosed(Severity.LOW, 0, "")).get(RunState.EARLY_EXIT_RESPONSE));
    }

    @Test
    @DisplayName("Continuing writes no exit response but still records a reason")
    void continueHasReason() {
        var update = stage.apply(diagnosed(Severity.CRITICAL, 0, "s"));

        assertFalse(update.containsKey(RunState.EARLY_EXIT_RESPONSE));
        assertEquals("Severity CRITICAL requires recommendations", update.get(RunState.EARLY_EXIT_REASON));
        assertEquals(List.of("Early exit: continue (Severity CRITICAL requires recommendations)"),
                update.get(RunState.TRACE));
    }

    @Test
    @DisplayName("Raising severity never turns continue into exit")
    void monotonicInSeverity() {
        for (int issues = 0; issues <= 4; issues++) {
            boolean continued = false;
            for (Severity severity : Severity.values()) {
                Fork f = fork(diagnosed(severity, issues, "s"));
                if (continued) {
                    assertEquals(Fork.CONTINUE, f, severity + " with " + issues + " issues");
                }
                continued |= f == Fork.CONTINUE;
            }
        }
    }
}
