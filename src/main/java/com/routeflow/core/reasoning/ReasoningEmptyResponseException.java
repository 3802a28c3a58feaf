package com.routeflow.core.reasoning;

/**
 * Thrown when the model returns null or blank content instead of a valid response.
 */
public class ReasoningEmptyResponseException extends RuntimeException {

    public ReasoningEmptyResponseException(String message) {
        super(message);
    }
}
