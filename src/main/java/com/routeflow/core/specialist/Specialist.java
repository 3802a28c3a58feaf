package com.routeflow.core.specialist;

import com.routeflow.core.model.SpecialistOutcome;

/**
 * A domain-analysis capability invoked by identifier during the invocation stage.
 * Implementations must be safe to call from several runs at once.
 */
public interface Specialist {

    /** Registry identifier, e.g. {@code budget_risk}. */
    String id();

    /**
     * @param query     the user's question
     * @param sessionId conversation session, or {@code null}
     * @param userId    the requesting user
     * @throws SpecialistException when the specialist cannot produce an answer
     */
    SpecialistOutcome handle(String query, String sessionId, String userId);
}
