package com.routeflow.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Successful answer from a domain specialist.
 *
 * @param response   the specialist's own response text
 * @param confidence confidence score in [0,1]
 * @param toolsUsed  identifiers of the external tools the specialist called
 */
public record SpecialistOutcome(
    String response,
    double confidence,
    List<String> toolsUsed
) implements Serializable {

    public SpecialistOutcome {
        toolsUsed = toolsUsed != null ? List.copyOf(toolsUsed) : List.of();
    }
}
