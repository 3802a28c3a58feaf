package com.routeflow.core.specialist;

import com.routeflow.core.model.SpecialistOutcome;
import com.routeflow.core.reasoning.ReasoningClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Specialist variant that answers from the reasoning capability using its
 * catalog description as the brief. Used when no data-backed specialist
 * is wired for an identifier.
 */
public class ReasoningSpecialist implements Specialist {

    private static final Logger log = LoggerFactory.getLogger(ReasoningSpecialist.class);

    static final double CONFIDENCE = 0.7;

    private final String id;
    private final String description;
    private final ReasoningClient reasoningClient;

    public ReasoningSpecialist(String id, String description, ReasoningClient reasoningClient) {
        this.id = id;
        this.description = description;
        this.reasoningClient = reasoningClient;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public SpecialistOutcome handle(String query, String sessionId, String userId) {
        String prompt = """
                You are the %s specialist. %s

                Answer the user's question from your area only. Report concrete findings
                and call out anything that looks wrong.

                User question: "%s"
                """.formatted(id, description, query);
        try {
            String response = reasoningClient.complete(prompt);
            return new SpecialistOutcome(response.trim(), CONFIDENCE, List.of("reasoning"));
        } catch (RuntimeException e) {
            log.warn("Specialist {} could not reach the reasoning capability: {}", id, e.getMessage());
            throw new SpecialistException(id, "Reasoning capability unavailable: " + e.getMessage(), e);
        }
    }
}
