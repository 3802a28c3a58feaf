package com.routeflow.core.specialist;

/**
 * Failure reported by a specialist. Isolated to that specialist; never fails the run.
 */
public class SpecialistException extends RuntimeException {

    private final String specialistId;

    public SpecialistException(String specialistId, String message) {
        super(message);
        this.specialistId = specialistId;
    }

    public SpecialistException(String specialistId, String message, Throwable cause) {
        super(message, cause);
        this.specialistId = specialistId;
    }

    public String getSpecialistId() {
        return specialistId;
    }
}
