package com.routeflow.core.stages;

import com.routeflow.core.TestFixtures;
import com.routeflow.core.model.Priority;
import com.routeflow.core.model.Recommendation;
import com.routeflow.core.model.Severity;
import com.routeflow.core.reasoning.ReasoningClient;
import com.routeflow.core.state.RunState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class RecommendationStageTest {

    private static final String THREE_ITEMS = """
            RECOMMENDATION 1:
            Priority: high
            Action: Lower the bid floor on the Quiz line items to $2.50
            Reason: The floor change cut win rate
            Expected Impact: Win rate back above 20%

            **RECOMMENDATION 2:**
            Priority: medium
            Action: Shift 10% of budget from display to video
            Reason: Video is pacing ahead
            Expected Impact: Even pacing across channels

            RECOMMENDATION 3:
            - Priority: low
            - Action: Refresh the two oldest creatives this week
            - Reason: Creative fatigue on older assets

            CONFIDENCE: 0.85
            ACTION_PLAN: Lower the floor first,
            then rebalance budget.
            """;

    private ReasoningClient reasoning;
    private RecommendationStage stage;

    @BeforeEach
    void setUp() {
        reasoning = mock(ReasoningClient.class);
        stage = new RecommendationStage(reasoning);
    }

    private static RunState diagnosed(Severity severity, List<String> issues, List<String> rootCauses) {
        return TestFixtures.state(
                RunState.RUN_ID, "RF-1",
                RunState.QUERY, "why is delivery behind",
                RunState.SEVERITY, severity.name(),
                RunState.ISSUES, issues,
                RunState.ROOT_CAUSES, rootCauses,
                RunState.DIAGNOSIS_SUMMARY, "summary");
    }

    @SuppressWarnings("unchecked")
    private static List<Recommendation> items(Map<String, Object> update) {
        return (List<Recommendation>) update.get(RunState.RECOMMENDATIONS);
    }

    // ── Parsing ──────────────────────────────────────────────────────

    @Test
    @DisplayName("Parses recommendation blocks, confidence and a multi-line action plan")
    void parsesBlocks() {
        var parsed = RecommendationStage.parse(THREE_ITEMS);

        assertEquals(3, parsed.items().size());
        assertEquals(Priority.HIGH, parsed.items().get(0).priority());
        assertEquals("Shift 10% of budget from display to video", parsed.items().get(1).action());
        assertNull(parsed.items().get(2).expectedImpact());
        assertEquals(0.85, parsed.confidence(), 1e-9);
        assertEquals("Lower the floor first,\nthen rebalance budget.", parsed.actionPlan());
    }

    @Test
    @DisplayName("A block without a priority keeps it absent")
    void missingPriorityStaysNull() {
        var parsed = RecommendationStage.parse("RECOMMENDATION 1:\nAction: Pause the Quiz campaign today\n");

        assertNull(parsed.items().get(0).priority());
        assertEquals(RecommendationStage.PARSED_DEFAULT_CONFIDENCE, parsed.confidence(), 1e-9);
    }

    // ── Stage behaviour ──────────────────────────────────────────────

    @Test
    @DisplayName("Nothing diagnosed means nothing to recommend")
    void nothingDiagnosed() {
        var update = stage.apply(diagnosed(Severity.LOW, List.of(), List.of()));

        assertTrue(items(update).isEmpty());
        assertEquals(RecommendationStage.EMPTY_CONFIDENCE, update.get(RunState.RECOMMENDATION_CONFIDENCE));
        verifyNoInteractions(reasoning);
    }

    @Test
    @DisplayName("Well-formed reply is used as-is")
    void usesReply() {
        when(reasoning.complete(anyString())).thenReturn(THREE_ITEMS);

        var update = stage.apply(diagnosed(Severity.MEDIUM, List.of("a", "b", "c"), List.of("d")));

        assertEquals(3, items(update).size());
        assertEquals(0.85, update.get(RunState.RECOMMENDATION_CONFIDENCE));
        assertEquals(List.of("reasoning:recommendation"), update.get(RunState.CAPABILITIES_INVOKED));
    }

    @Test
    @DisplayName("Reasoning failure derives items from the diagnosis")
    void fallbackOnFailure() {
        when(reasoning.complete(anyString())).thenThrow(new RuntimeException("model down"));

        var update = stage.apply(diagnosed(Severity.HIGH, List.of("Pacing behind"), List.of("Bid floor raised")));

        var items = items(update);
        assertTrue(items.size() >= RecommendationStage.MIN_ITEMS);
        assertEquals("Investigate and correct the root cause: Bid floor raised", items.get(0).action());
        assertEquals(Priority.HIGH, items.get(0).priority());
        assertEquals(RecommendationStage.FALLBACK_CONFIDENCE, update.get(RunState.RECOMMENDATION_CONFIDENCE));
    }

    @Test
    @DisplayName("A reply with no blocks counts as a failure")
    void emptyReplyFallsBack() {
        when(reasoning.complete(anyString())).thenReturn("CONFIDENCE: 0.9");

        var update = stage.apply(diagnosed(Severity.MEDIUM, List.of("a", "b", "c"), List.of()));

        assertEquals(RecommendationStage.FALLBACK_CONFIDENCE, update.get(RunState.RECOMMENDATION_CONFIDENCE));
        assertEquals(3, items(update).size());
    }

    // ── Shaping ──────────────────────────────────────────────────────

    @Test
    @DisplayName("Short lists are padded from derived items without duplicates")
    void padsToMinimum() {
        var one = new Recommendation(Priority.MEDIUM, "Resolve the reported issue: Pacing behind", "r", "i");
        var fallback = RecommendationStage.fallbackItems(List.of("Pacing behind"), List.of(), Severity.MEDIUM);

        var shaped = RecommendationStage.shape(List.of(one), fallback, Severity.MEDIUM);

        assertEquals(3, shaped.size());
        assertEquals(3, shaped.stream().map(r -> r.action().toLowerCase()).distinct().count());
    }

    @Test
    @DisplayName("Long lists are capped at seven")
    void capsAtMaximum() {
        var many = new ArrayList<Recommendation>();
        for (int i = 1; i <= 10; i++) {
            many.add(new Recommendation(Priority.LOW, "Adjust line item number " + i + " bid by 5%", "r", "i"));
        }

        var shaped = RecommendationStage.shape(many, List.of(), Severity.LOW);

        assertEquals(RecommendationStage.MAX_ITEMS, shaped.size());
        assertEquals(many.subList(0, 7), shaped);
    }

    @Test
    @DisplayName("Severe diagnosis promotes the first item when none is high")
    void promotesForSevere() {
        var items = List.of(
                new Recommendation(Priority.MEDIUM, "Shift 10% of budget from display to video", "r", "i"),
                new Recommendation(Priority.LOW, "Refresh the two oldest creatives this week", "r", "i"),
                new Recommendation(Priority.LOW, "Tighten frequency caps on retargeting", "r", "i"));

        var shaped = RecommendationStage.shape(items, List.of(), Severity.CRITICAL);

        assertEquals(Priority.HIGH, shaped.get(0).priority());
        assertEquals(Priority.LOW, shaped.get(1).priority());
    }

    @Test
    @DisplayName("Promotion skips items that have no action")
    void promotionSkipsActionless() {
        var items = List.of(
                new Recommendation(Priority.MEDIUM, null, "r", "i"),
                new Recommendation(Priority.MEDIUM, "Shift 10% of budget from display to video", "r", "i"),
                new Recommendation(Priority.LOW, "Refresh the two oldest creatives this week", "r", "i"));

        var shaped = RecommendationStage.shape(items, List.of(), Severity.CRITICAL);

        assertEquals(Priority.MEDIUM, shaped.get(0).priority());
        assertEquals(Priority.HIGH, shaped.get(1).priority());
    }

    @Test
    @DisplayName("A severe run keeps a high item after validation drops an action-less first block")
    void severeSurvivesValidation() {
        when(reasoning.complete(anyString())).thenReturn("""
                RECOMMENDATION 1:
                Priority: medium
                Reason: Pacing is far behind plan

                RECOMMENDATION 2:
                Priority: medium
                Action: Shift 10% of budget from display to video
                Reason: Video is pacing ahead

                RECOMMENDATION 3:
                Priority: low
                Action: Refresh the two oldest creatives this week
                Reason: Creative fatigue on older assets

                CONFIDENCE: 0.8
                """);
        var diagnosed = diagnosed(Severity.CRITICAL, List.of("a", "b", "c", "d", "e"), List.of());
        var merged = new HashMap<String, Object>(diagnosed.data());
        merged.putAll(stage.apply(diagnosed));
        var recommended = new RunState(merged);

        var update = new ValidationStage(TestFixtures.pipelineProperties()).apply(recommended);

        @SuppressWarnings("unchecked")
        var validated = (List<Recommendation>) update.get(RunState.VALIDATED_RECOMMENDATIONS);
        @SuppressWarnings("unchecked")
        var warnings = (List<String>) update.get(RunState.VALIDATION_WARNINGS);
        assertEquals(2, validated.size());
        assertEquals(Priority.HIGH, validated.get(0).priority());
        assertTrue(warnings.stream().noneMatch(w -> w.contains("no recommendation is high priority")), warnings.toString());
    }

    @Test
    @DisplayName("Derived items follow severity")
    void fallbackPriorities() {
        var mild = RecommendationStage.fallbackItems(List.of("i"), List.of("c"), Severity.LOW);
        assertEquals(Priority.MEDIUM, mild.get(0).priority());
        assertEquals(Priority.LOW, mild.get(1).priority());

        var severe = RecommendationStage.fallbackItems(List.of("i"), List.of("c"), Severity.HIGH);
        assertEquals(Priority.HIGH, severe.get(0).priority());
        assertEquals(Priority.MEDIUM, severe.get(1).priority());
    }
}
