package com.routeflow.core.reasoning;

/**
 * Natural-language reasoning capability used by routing, diagnosis,
 * recommendation and the reference specialists.
 * <p>
 * Calls are fallible and latency-variable. Callers must treat a thrown
 * exception or unusable text as "capability unavailable" and fall back
 * to a deterministic default.
 */
public interface ReasoningClient {

    /**
     * @param prompt full prompt text
     * @return the model's reply, never blank
     * @throws ReasoningEmptyResponseException when the model returns no content
     */
    String complete(String prompt);
}
