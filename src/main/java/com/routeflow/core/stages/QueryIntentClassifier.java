package com.routeflow.core.stages;

import java.util.List;

/**
 * Lexical check for purely informational questions ("what is", "show me")
 * as opposed to requests for action ("optimize", "fix"). Action markers are
 * checked first, so "what is the best way to fix X" is not informational.
 */
public final class QueryIntentClassifier {

    static final List<String> ACTION_MARKERS = List.of(
            "optimize", "fix", "improve", "why is", "why are", "what's wrong", "what went wrong",
            "issue", "problem", "recommend", "suggest", "should", "need to");

    static final List<String> INFORMATIONAL_MARKERS = List.of(
            "what is", "what are", "what was", "what will",
            "how is", "how are", "how was", "how will",
            "show me", "tell me", "explain", "describe", "list", "give me", "provide");

    private QueryIntentClassifier() {}

    public static boolean isInformational(String query) {
        if (query == null || query.isBlank()) {
            return false;
        }
        String lower = query.toLowerCase();
        for (String marker : ACTION_MARKERS) {
            if (lower.contains(marker)) {
                return false;
            }
        }
        for (String marker : INFORMATIONAL_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
