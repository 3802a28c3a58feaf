package com.routeflow.core.model;

/**
 * Recommendation priority. Declaration order is the sort order used when
 * the validated list is truncated.
 */
public enum Priority {
    HIGH,
    MEDIUM,
    LOW;

    /**
     * Parses model output, returning {@code null} when the value is missing
     * so validation can tell "absent" apart from "medium".
     */
    public static Priority parseOrNull(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Priority.valueOf(raw.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }
}
