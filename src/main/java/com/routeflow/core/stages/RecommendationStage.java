package com.routeflow.core.stages;

import com.routeflow.core.model.Priority;
import com.routeflow.core.model.Recommendation;
import com.routeflow.core.model.Severity;
import com.routeflow.core.model.SpecialistOutcome;
import com.routeflow.core.reasoning.ReasoningClient;
import com.routeflow.core.reasoning.ReasoningParseException;
import com.routeflow.core.reasoning.ReasoningParser;
import com.routeflow.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Produces three to seven prioritized action items from the diagnosis.
 * <p>
 * The reasoning capability replies in blocks:
 * <pre>
 *   RECOMMENDATION 1:
 *   Priority: high
 *   Action: ...
 *   Reason: ...
 *   Expected Impact: ...
 *
 *   CONFIDENCE: 0.8
 *   ACTION_PLAN: ...
 * </pre>
 * When the call fails or yields nothing, items are derived directly from
 * the diagnosed root causes and issues.
 */
@Component
public class RecommendationStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(RecommendationStage.class);

    public static final String NAME = "recommendation";

    static final int MIN_ITEMS = 3;
    static final int MAX_ITEMS = 7;
    static final double EMPTY_CONFIDENCE = 0.8;
    static final double PARSED_DEFAULT_CONFIDENCE = 0.7;
    static final double FALLBACK_CONFIDENCE = 0.6;

    private static final Pattern BLOCK_HEADER = Pattern.compile("^\\W*RECOMMENDATION\\s*#?\\d+\\W*:?.*$",
            Pattern.CASE_INSENSITIVE);

    private final ReasoningClient reasoningClient;

    public RecommendationStage(ReasoningClient reasoningClient) {
        this.reasoningClient = reasoningClient;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Object> apply(RunState state) {
        List<String> issues = state.issues();
        List<String> rootCauses = state.rootCauses();
        Severity severity = state.severity().orElse(Severity.MEDIUM);

        if (issues.isEmpty() && rootCauses.isEmpty()) {
            log.info("No diagnosed issues, nothing to recommend");
            return Map.of(
                    RunState.RECOMMENDATIONS, List.of(),
                    RunState.RECOMMENDATION_CONFIDENCE, EMPTY_CONFIDENCE,
                    RunState.ACTION_PLAN, "",
                    RunState.TRACE, List.of("Recommendation: nothing to recommend"));
        }

        List<Recommendation> fallback = fallbackItems(issues, rootCauses, severity);
        List<Recommendation> items;
        double confidence;
        String actionPlan;
        String trace;
        try {
            String reply = reasoningClient.complete(buildPrompt(state, severity));
            Parsed parsed = parse(reply);
            if (parsed.items().isEmpty()) {
                throw new ReasoningParseException("Reply contained no RECOMMENDATION blocks");
            }
            items = new ArrayList<>(parsed.items());
            confidence = parsed.confidence();
            actionPlan = parsed.actionPlan();
            trace = "Recommendation: %d item(s) from reasoning".formatted(items.size());
        } catch (RuntimeException e) {
            log.warn("Recommendation via reasoning failed, deriving items from diagnosis: {}", e.getMessage());
            items = new ArrayList<>();
            confidence = FALLBACK_CONFIDENCE;
            actionPlan = "";
            trace = "Recommendation: fallback items (" + e.getMessage() + ")";
        }

        items = shape(items, fallback, severity);
        log.info("Recommendation produced {} item(s), confidence {}", items.size(), confidence);

        return Map.of(
                RunState.RECOMMENDATIONS, List.copyOf(items),
                RunState.RECOMMENDATION_CONFIDENCE, confidence,
                RunState.ACTION_PLAN, actionPlan,
                RunState.CAPABILITIES_INVOKED, List.of("reasoning:recommendation"),
                RunState.TRACE, List.of(trace));
    }

    /**
     * Pads to {@link #MIN_ITEMS} from the derived items, caps at {@link #MAX_ITEMS},
     * and makes sure a severe diagnosis gets at least one high-priority item
     * that carries an action.
     */
    static List<Recommendation> shape(List<Recommendation> items, List<Recommendation> fallback, Severity severity) {
        var result = new ArrayList<>(items);
        Set<String> actions = new LinkedHashSet<>();
        for (Recommendation item : result) {
            if (item.hasAction()) {
                actions.add(item.action().toLowerCase());
            }
        }
        for (Recommendation candidate : fallback) {
            if (result.size() >= MIN_ITEMS) {
                break;
            }
            if (actions.add(candidate.action().toLowerCase())) {
                result.add(candidate);
            }
        }
        if (result.size() > MAX_ITEMS) {
            result = new ArrayList<>(result.subList(0, MAX_ITEMS));
        }
        if (severity.isSevere()
                && result.stream().noneMatch(r -> r.hasAction() && r.priority() == Priority.HIGH)) {
            for (int i = 0; i < result.size(); i++) {
                if (result.get(i).hasAction()) {
                    result.set(i, result.get(i).withPriority(Priority.HIGH));
                    break;
                }
            }
        }
        return result;
    }

    static List<Recommendation> fallbackItems(List<String> issues, List<String> rootCauses, Severity severity) {
        var items = new ArrayList<Recommendation>();
        Priority causePriority = severity.isSevere() ? Priority.HIGH : Priority.MEDIUM;
        Priority issuePriority = severity.isSevere() ? Priority.MEDIUM : Priority.LOW;
        for (String cause : rootCauses) {
            items.add(new Recommendation(causePriority,
                    "Investigate and correct the root cause: " + cause,
                    "Diagnosed root cause: " + cause,
                    "Removes a driver of the diagnosed issues"));
        }
        for (String issue : issues) {
            items.add(new Recommendation(issuePriority,
                    "Resolve the reported issue: " + issue,
                    "Diagnosed issue: " + issue,
                    "Brings the affected metric back within its expected range"));
        }
        items.add(new Recommendation(Priority.LOW,
                "Monitor the affected campaign metrics daily for the next week",
                "Confirms whether the changes resolve the diagnosed issues",
                "Earlier detection of any regression"));
        items.add(new Recommendation(Priority.LOW,
                "Re-run this analysis after the changes have been live for several days",
                "Verifies the diagnosis against fresh data",
                "Keeps follow-up actions grounded in current performance"));
        return items;
    }

    record Parsed(List<Recommendation> items, double confidence, String actionPlan) {}

    static Parsed parse(String reply) {
        var items = new ArrayList<Recommendation>();
        double confidence = PARSED_DEFAULT_CONFIDENCE;
        var plan = new StringBuilder();
        boolean inPlan = false;

        String priority = null;
        String action = null;
        String reason = null;
        String impact = null;
        boolean inBlock = false;

        for (String rawLine : reply.split("\\R")) {
            String line = rawLine.trim().replaceFirst("^[-*]\\s*", "").replace("**", "");
            String upper = line.toUpperCase();

            if (BLOCK_HEADER.matcher(line).matches()) {
                if (inBlock) {
                    items.add(new Recommendation(Priority.parseOrNull(priority), action, reason, impact));
                }
                priority = action = reason = impact = null;
                inBlock = true;
                inPlan = false;
            } else if (upper.startsWith("CONFIDENCE:")) {
                confidence = ReasoningParser.confidence(valueOf(line), confidence);
                inPlan = false;
            } else if (upper.startsWith("ACTION_PLAN:") || upper.startsWith("ACTION PLAN:")) {
                if (inBlock) {
                    items.add(new Recommendation(Priority.parseOrNull(priority), action, reason, impact));
                    inBlock = false;
                }
                inPlan = true;
                plan.append(valueOf(line));
            } else if (inPlan) {
                if (!line.isEmpty()) {
                    plan.append(plan.length() > 0 ? "\n" : "").append(line);
                }
            } else if (inBlock) {
                if (upper.startsWith("PRIORITY:")) {
                    priority = valueOf(line);
                } else if (upper.startsWith("ACTION:")) {
                    action = valueOf(line);
                } else if (upper.startsWith("REASON:")) {
                    reason = valueOf(line);
                } else if (upper.startsWith("EXPECTED IMPACT:") || upper.startsWith("IMPACT:")) {
                    impact = valueOf(line);
                }
            }
        }
        if (inBlock) {
            items.add(new Recommendation(Priority.parseOrNull(priority), action, reason, impact));
        }
        return new Parsed(items, confidence, plan.toString().trim());
    }

    private static String buildPrompt(RunState state, Severity severity) {
        var sb = new StringBuilder();
        sb.append("Recommend concrete actions for the diagnosed campaign situation.\n\n");
        sb.append("User question: \"").append(state.query()).append("\"\n");
        sb.append("Severity: ").append(severity).append('\n');
        sb.append("Summary: ").append(state.diagnosisSummary()).append("\n\n");
        appendList(sb, "Issues", state.issues());
        appendList(sb, "Root causes", state.rootCauses());
        appendList(sb, "Correlations", state.correlations());
        Map<String, SpecialistOutcome> outcomes = state.outcomes();
        if (!outcomes.isEmpty()) {
            sb.append("Specialists consulted: ").append(String.join(", ", outcomes.keySet())).append("\n\n");
        }
        sb.append("""
                Give 3 to 7 recommendations, most important first, in this format:
                RECOMMENDATION 1:
                Priority: high|medium|low
                Action: a specific, concrete step
                Reason: which issue or root cause it addresses
                Expected Impact: what should improve

                Then finish with:
                CONFIDENCE: a number between 0 and 1
                ACTION_PLAN: a short ordered plan
                """);
        if (severity.isSevere()) {
            sb.append("At least one recommendation must be high priority.\n");
        }
        return sb.toString();
    }

    private static void appendList(StringBuilder sb, String title, List<String> values) {
        if (values.isEmpty()) {
            return;
        }
        sb.append(title).append(":\n");
        values.forEach(v -> sb.append("- ").append(v).append('\n'));
        sb.append('\n');
    }

    private static String valueOf(String line) {
        return line.substring(line.indexOf(':') + 1).trim();
    }

}
