package com.routeflow.core.stages;

import com.routeflow.core.config.SpecialistProperties;
import com.routeflow.core.model.RoutingDecision;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Deterministic keyword-to-specialist routing used when the reasoning
 * capability is unavailable or its reply cannot be parsed.
 * <p>
 * Keywords match on word boundaries so short tokens such as "ad" or "io"
 * do not fire inside longer words.
 */
public final class KeywordRouter {

    static final double FALLBACK_CONFIDENCE = 0.6;

    private final Map<String, List<Pattern>> patternsBySpecialist = new LinkedHashMap<>();

    public KeywordRouter(List<SpecialistProperties.Definition> definitions) {
        for (var definition : definitions) {
            var patterns = new ArrayList<Pattern>();
            for (String keyword : definition.getKeywords()) {
                patterns.add(boundaryPattern(keyword));
            }
            patternsBySpecialist.put(definition.getId(), List.copyOf(patterns));
        }
    }

    /**
     * @return the specialists whose keywords occur in the query, in catalog order
     */
    public List<String> match(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String lower = query.toLowerCase();
        var matched = new ArrayList<String>();
        for (var entry : patternsBySpecialist.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                if (pattern.matcher(lower).find()) {
                    matched.add(entry.getKey());
                    break;
                }
            }
        }
        return matched;
    }

    public RoutingDecision route(String query, String clarificationMessage) {
        List<String> matched = match(query);
        if (matched.isEmpty()) {
            return RoutingDecision.clarify(0.0, "Keyword fallback found no matching specialist",
                    clarificationMessage, true);
        }
        return RoutingDecision.routed(matched, FALLBACK_CONFIDENCE,
                "Keyword fallback matched " + String.join(", ", matched), true);
    }

    private static Pattern boundaryPattern(String keyword) {
        return Pattern.compile("(?<![a-z0-9])" + Pattern.quote(keyword.toLowerCase()) + "(?![a-z0-9])");
    }
}
