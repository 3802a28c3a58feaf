package com.routeflow.core.stages;

import com.routeflow.core.config.PipelineProperties;
import com.routeflow.core.metrics.PipelineMetrics;
import com.routeflow.core.model.Fork;
import com.routeflow.core.specialist.SpecialistRegistry;
import com.routeflow.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Deterministic safety check between routing and invocation. Makes no
 * external calls.
 * <p>
 * Unknown specialist ids are dropped before the selection is capped, so a
 * bogus id never displaces a valid one.
 */
@Component
public class GateStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(GateStage.class);

    public static final String NAME = "gate";

    static final String CLARIFICATION_REASON = "Clarification required before specialists can be selected";
    static final String VAGUE_REASON = "Query too vague and routing confidence low";
    static final String NO_SPECIALISTS_REASON = "No valid specialists selected";

    private final SpecialistRegistry registry;
    private final PipelineProperties properties;
    private final PipelineMetrics metrics;

    public GateStage(SpecialistRegistry registry, PipelineProperties properties, PipelineMetrics metrics) {
        this.registry = registry;
        this.properties = properties;
        this.metrics = metrics;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Object> apply(RunState state) {
        var warnings = new ArrayList<String>();

        if (state.clarificationNeeded()) {
            return blocked(CLARIFICATION_REASON, warnings);
        }

        double confidence = state.routingConfidence();
        int tokens = tokenCount(state.query());
        if (tokens < properties.getMinQueryTokens()) {
            warnings.add("Query is very short (" + tokens + " token" + (tokens == 1 ? "" : "s") + ")");
            if (confidence < properties.getShortQueryBlockConfidence()) {
                return blocked(VAGUE_REASON, warnings);
            }
        }
        if (confidence < properties.getLowConfidenceWarning()) {
            warnings.add("Low routing confidence (%.2f)".formatted(confidence));
        }

        var approved = new ArrayList<String>();
        for (String id : new LinkedHashSet<>(state.routedSpecialists())) {
            if (registry.contains(id)) {
                approved.add(id);
            } else {
                warnings.add("Unknown specialist dropped: " + id);
            }
        }

        int max = properties.getMaxSpecialists();
        if (approved.size() > max) {
            warnings.add("Selected " + approved.size() + " specialists, limited to " + max);
            approved = new ArrayList<>(approved.subList(0, max));
        }

        if (approved.isEmpty()) {
            return blocked(NO_SPECIALISTS_REASON, warnings);
        }

        log.info("Gate approved {} (warnings: {})", approved, warnings.size());
        metrics.recordGateDecision(true);
        return Map.of(
                RunState.GATE_APPROVED, true,
                RunState.APPROVED_SPECIALISTS, List.copyOf(approved),
                RunState.GATE_WARNINGS, List.copyOf(warnings),
                RunState.TRACE, List.of("Gate: approved " + approved)
        );
    }

    /** Fork after the gate: blocked runs go straight to the response. */
    public Fork decide(RunState state) {
        return state.gateApproved().orElse(false) ? Fork.PROCEED : Fork.BLOCK;
    }

    private Map<String, Object> blocked(String reason, List<String> warnings) {
        log.info("Gate blocked: {}", reason);
        metrics.recordGateDecision(false);
        var update = new HashMap<String, Object>();
        update.put(RunState.GATE_APPROVED, false);
        update.put(RunState.APPROVED_SPECIALISTS, List.of());
        update.put(RunState.GATE_WARNINGS, List.copyOf(warnings));
        update.put(RunState.BLOCK_REASON, reason);
        update.put(RunState.TRACE, List.of("Gate: blocked (" + reason + ")"));
        return update;
    }

    static int tokenCount(String query) {
        if (query == null || query.isBlank()) {
            return 0;
        }
        return query.trim().split("\\s+").length;
    }
}
