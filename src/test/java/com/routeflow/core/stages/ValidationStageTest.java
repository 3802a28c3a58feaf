package com.routeflow.core.stages;

import com.routeflow.core.TestFixtures;
import com.routeflow.core.model.Priority;
import com.routeflow.core.model.Recommendation;
import com.routeflow.core.model.Severity;
import com.routeflow.core.state.RunState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValidationStageTest {

    private final ValidationStage stage = new ValidationStage(TestFixtures.pipelineProperties());

    private static Recommendation rec(Priority priority, String action) {
        return new Recommendation(priority, action, "because the diagnosis says so", "better delivery");
    }

    private Map<String, Object> validate(Severity severity, List<Recommendation> items) {
        return stage.apply(TestFixtures.state(
                RunState.RUN_ID, "RF-1",
                RunState.SEVERITY, severity.name(),
                RunState.RECOMMENDATIONS, items));
    }

    @SuppressWarnings("unchecked")
    private static List<Recommendation> accepted(Map<String, Object> update) {
        return (List<Recommendation>) update.get(RunState.VALIDATED_RECOMMENDATIONS);
    }

    @SuppressWarnings("unchecked")
    private static List<String> warnings(Map<String, Object> update) {
        return (List<String>) update.get(RunState.VALIDATION_WARNINGS);
    }

    @SuppressWarnings("unchecked")
    private static List<String> errors(Map<String, Object> update) {
        return (List<String>) update.get(RunState.VALIDATION_ERRORS);
    }

    // ── Required fields ──────────────────────────────────────────────

    @Test
    @DisplayName("Items without an action are removed with an error")
    void missingActionRemoved() {
        var update = validate(Severity.MEDIUM, List.of(
                rec(Priority.MEDIUM, "Shift 10% of budget from display to video"),
                new Recommendation(Priority.HIGH, " ", "r", "i")));

        assertEquals(1, accepted(update).size());
        assertEquals(List.of("Recommendation 2 has no action and was removed"), errors(update));
    }

    @Test
    @DisplayName("Missing priority defaults to medium with a warning")
    void missingPriorityDefaults() {
        var update = validate(Severity.MEDIUM, List.of(
                new Recommendation(null, "Shift 10% of budget from display to video", "r", "i")));

        assertEquals(Priority.MEDIUM, accepted(update).get(0).priority());
        assertTrue(warnings(update).contains("Recommendation 1 has no priority, defaulted to medium"));
    }

    @Test
    @DisplayName("Missing reason is flagged but kept")
    void missingReasonWarns() {
        var update = validate(Severity.MEDIUM, List.of(
                new Recommendation(Priority.LOW, "Shift 10% of budget from display to video", null, null)));

        assertEquals(1, accepted(update).size());
        assertTrue(warnings(update).contains("Recommendation 1 has no reason"));
    }

    // ── Content checks ───────────────────────────────────────────────

    @Test
    @DisplayName("Opposing actions on the same target are flagged")
    void conflictFlagged() {
        var conflicts = ValidationStage.conflicts(List.of(
                rec(Priority.HIGH, "Increase budget on the Quiz campaign by 20%"),
                rec(Priority.MEDIUM, "Reduce budget on the Quiz campaign by 10%")));

        assertEquals(1, conflicts.size());
        assertTrue(conflicts.get(0).startsWith("Recommendations 1 and 2 may conflict (increase vs decrease on "));
        assertTrue(conflicts.get(0).contains("budget"));
    }

    @Test
    @DisplayName("Opposing verbs on different targets are not a conflict")
    void noSharedTarget() {
        var conflicts = ValidationStage.conflicts(List.of(
                rec(Priority.HIGH, "Increase budget on video line items"),
                rec(Priority.MEDIUM, "Reduce frequency caps on retargeting")));

        assertTrue(conflicts.isEmpty());
    }

    @Test
    @DisplayName("Short or generic actions are vague")
    void vagueActions() {
        assertEquals("action is too short", ValidationStage.vagueness("Improve performance").orElseThrow());
        assertTrue(ValidationStage.vagueness("Review the targeting settings for all campaigns")
                .orElseThrow().contains("'review'"));
        assertTrue(ValidationStage.vagueness("Review the specific targeting settings for Quiz").isEmpty());
        assertTrue(ValidationStage.vagueness("Lower the bid floor on Quiz line items to $2.50").isEmpty());
    }

    @Test
    @DisplayName("Severity and priorities must line up")
    void severityAlignment() {
        var mediumOnly = List.of(rec(Priority.MEDIUM, "a"), rec(Priority.LOW, "b"));
        assertEquals("Severity is CRITICAL but no recommendation is high priority",
                ValidationStage.severityAlignment(Severity.CRITICAL, mediumOnly).orElseThrow());

        var allHigh = List.of(rec(Priority.HIGH, "a"), rec(Priority.HIGH, "b"), rec(Priority.HIGH, "c"));
        assertTrue(ValidationStage.severityAlignment(Severity.LOW, allHigh).isPresent());
        assertTrue(ValidationStage.severityAlignment(Severity.HIGH, allHigh).isEmpty());
    }

    // ── Ordering ─────────────────────────────────────────────────────

    @Test
    @DisplayName("Accepted items are sorted by priority, stable on ties")
    void stableSort() {
        var a = rec(Priority.LOW, "Refresh the two oldest creatives this week");
        var b = rec(Priority.HIGH, "Lower the bid floor on Quiz line items to $2.50");
        var c = rec(Priority.MEDIUM, "Shift 10% of budget from display to video");
        var d = rec(Priority.HIGH, "Pause the underperforming retargeting line item now");

        var update = validate(Severity.HIGH, List.of(a, b, c, d));

        assertEquals(List.of(b, d, c, a), accepted(update));
    }

    @Test
    @DisplayName("More than the maximum are truncated after sorting")
    void truncates() {
        var items = new ArrayList<Recommendation>();
        for (int i = 1; i <= 8; i++) {
            items.add(rec(Priority.LOW, "Adjust the bid on line item number " + i + " by 5%"));
        }
        items.add(rec(Priority.HIGH, "Lower the bid floor on Quiz line items to $2.50"));

        var update = validate(Severity.HIGH, items);

        assertEquals(7, accepted(update).size());
        assertEquals(Priority.HIGH, accepted(update).get(0).priority());
        assertTrue(warnings(update).contains("Truncated 9 recommendations to 7"));
    }

    @Test
    @DisplayName("Warnings never remove items")
    void warningsKeepItems() {
        var update = validate(Severity.CRITICAL, List.of(
                rec(Priority.LOW, "Improve things"),
                rec(Priority.LOW, "Increase budget on the Quiz campaign by 20%"),
                rec(Priority.LOW, "Reduce budget on the Quiz campaign by 10%")));

        assertEquals(3, accepted(update).size());
        assertTrue(errors(update).isEmpty());
        assertTrue(warnings(update).size() >= 3);
    }
}
