package com.routeflow.core.stages;

import com.routeflow.core.config.PipelineProperties;
import com.routeflow.core.model.Priority;
import com.routeflow.core.model.Recommendation;
import com.routeflow.core.model.Severity;
import com.routeflow.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Filters and flags recommendations. Deterministic, no external calls.
 * <p>
 * Only a missing action removes an item. Conflicts, vague wording and
 * severity misalignment are reported as warnings. The accepted list is
 * ordered by priority, stable on ties, then capped.
 */
@Component
public class ValidationStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(ValidationStage.class);

    public static final String NAME = "validation";

    static final int MIN_ACTION_WORDS = 5;
    static final int MAX_HIGH_FOR_MILD_SEVERITY = 2;

    private static final List<String> VAGUE_VERBS = List.of("improve", "optimize", "enhance", "review", "consider");

    private static final List<ConflictPair> CONFLICT_PAIRS = List.of(
            new ConflictPair("increase", Set.of("increase", "scale", "raise"), "decrease", Set.of("decrease", "reduce", "lower")),
            new ConflictPair("pause", Set.of("pause", "stop"), "start", Set.of("start", "launch", "enable")),
            new ConflictPair("expand", Set.of("expand", "broaden"), "narrow", Set.of("narrow", "focus", "limit")));

    private static final Set<String> STOPWORDS = Set.of(
            "a", "an", "the", "to", "for", "of", "on", "in", "by", "and", "or", "with", "at", "from",
            "all", "any", "this", "that", "these", "those", "it", "its", "our", "your", "up", "down",
            "more", "less", "be", "is", "are");

    private final PipelineProperties properties;

    public ValidationStage(PipelineProperties properties) {
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Object> apply(RunState state) {
        var warnings = new ArrayList<String>();
        var errors = new ArrayList<String>();
        var accepted = new ArrayList<Recommendation>();

        List<Recommendation> items = state.recommendations();
        for (int i = 0; i < items.size(); i++) {
            Recommendation item = items.get(i);
            int n = i + 1;
            if (!item.hasAction()) {
                errors.add("Recommendation " + n + " has no action and was removed");
                continue;
            }
            if (item.priority() == null) {
                warnings.add("Recommendation " + n + " has no priority, defaulted to medium");
                item = item.withPriority(Priority.MEDIUM);
            }
            if (!item.hasReason()) {
                warnings.add("Recommendation " + n + " has no reason");
            }
            vagueness(item.action()).ifPresent(
                    problem -> warnings.add("Recommendation " + n + " is vague: " + problem));
            accepted.add(item);
        }

        warnings.addAll(conflicts(accepted));
        severityAlignment(state.severity().orElse(Severity.MEDIUM), accepted).ifPresent(warnings::add);

        accepted.sort(Comparator.comparingInt(r -> r.priority().ordinal()));
        int max = properties.getMaxRecommendations();
        if (accepted.size() > max) {
            warnings.add("Truncated " + accepted.size() + " recommendations to " + max);
            accepted = new ArrayList<>(accepted.subList(0, max));
        }

        log.info("Validation accepted {} recommendation(s), {} warning(s), {} error(s)",
                accepted.size(), warnings.size(), errors.size());

        return Map.of(
                RunState.VALIDATED_RECOMMENDATIONS, List.copyOf(accepted),
                RunState.VALIDATION_WARNINGS, List.copyOf(warnings),
                RunState.VALIDATION_ERRORS, List.copyOf(errors),
                RunState.TRACE, List.of("Validation: %d accepted, %d warning(s), %d error(s)"
                        .formatted(accepted.size(), warnings.size(), errors.size())));
    }

    static Optional<String> vagueness(String action) {
        String lower = action.toLowerCase();
        Set<String> words = words(lower);
        if (lower.trim().split("\\s+").length < MIN_ACTION_WORDS) {
            return Optional.of("action is too short");
        }
        if (!lower.contains("specific")) {
            for (String verb : VAGUE_VERBS) {
                if (words.contains(verb)) {
                    return Optional.of("generic verb '" + verb + "' without a specific target");
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Flags pairs of items that push the same target in opposite directions,
     * e.g. "increase budget on X" and "reduce budget on X".
     */
    static List<String> conflicts(List<Recommendation> items) {
        var warnings = new ArrayList<String>();
        for (int i = 0; i < items.size(); i++) {
            for (int j = i + 1; j < items.size(); j++) {
                Set<String> a = words(items.get(i).action().toLowerCase());
                Set<String> b = words(items.get(j).action().toLowerCase());
                for (ConflictPair pair : CONFLICT_PAIRS) {
                    boolean opposed = (intersects(a, pair.first()) && intersects(b, pair.second()))
                            || (intersects(a, pair.second()) && intersects(b, pair.first()));
                    if (!opposed) {
                        continue;
                    }
                    Set<String> shared = targets(a);
                    shared.retainAll(targets(b));
                    if (!shared.isEmpty()) {
                        warnings.add("Recommendations %d and %d may conflict (%s vs %s on %s)".formatted(
                                i + 1, j + 1, pair.firstLabel(), pair.secondLabel(), String.join(", ", shared)));
                        break;
                    }
                }
            }
        }
        return warnings;
    }

    static Optional<String> severityAlignment(Severity severity, List<Recommendation> items) {
        long high = items.stream().filter(r -> r.priority() == Priority.HIGH).count();
        if (severity.isSevere() && high == 0) {
            return Optional.of("Severity is " + severity + " but no recommendation is high priority");
        }
        if (!severity.isSevere() && high > MAX_HIGH_FOR_MILD_SEVERITY) {
            return Optional.of("Severity is " + severity + " but " + high
                    + " recommendations are high priority");
        }
        return Optional.empty();
    }

    private static Set<String> targets(Set<String> words) {
        Set<String> result = new LinkedHashSet<>(words);
        result.removeAll(STOPWORDS);
        for (ConflictPair pair : CONFLICT_PAIRS) {
            result.removeAll(pair.first());
            result.removeAll(pair.second());
        }
        return result;
    }

    private static Set<String> words(String text) {
        return Arrays.stream(text.split("[^a-z0-9%$]+"))
                .filter(w -> !w.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static boolean intersects(Set<String> words, Set<String> verbs) {
        for (String verb : verbs) {
            if (words.contains(verb)) {
                return true;
            }
        }
        return false;
    }

    private record ConflictPair(String firstLabel, Set<String> first, String secondLabel, Set<String> second) {}
}
