package com.routeflow.core.reasoning;

/**
 * Thrown when model output cannot be parsed into the expected type.
 */
public class ReasoningParseException extends RuntimeException {
    public ReasoningParseException(String message) {
        super(message);
    }

    public ReasoningParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
