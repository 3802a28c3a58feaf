package com.routeflow.core.model;

/**
 * Ordinal diagnosis classification. Drives early exit and the severity
 * alignment check in validation.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** High and critical diagnoses always continue to recommendations. */
    public boolean isSevere() {
        return this == HIGH || this == CRITICAL;
    }

    /**
     * Lenient parse of model output. Unknown or blank values map to {@link #MEDIUM}.
     */
    public static Severity parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return MEDIUM;
        }
        try {
            return Severity.valueOf(raw.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }
}
