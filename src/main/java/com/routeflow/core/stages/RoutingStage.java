package com.routeflow.core.stages;

import com.routeflow.core.config.PipelineProperties;
import com.routeflow.core.config.SpecialistProperties;
import com.routeflow.core.conversation.ConversationStore;
import com.routeflow.core.metrics.PipelineMetrics;
import com.routeflow.core.model.ConversationMessage;
import com.routeflow.core.model.RoutingDecision;
import com.routeflow.core.reasoning.ReasoningClient;
import com.routeflow.core.reasoning.ReasoningParseException;
import com.routeflow.core.reasoning.ReasoningParser;
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
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Selects the specialists that should answer the query, or asks the user to
 * clarify when the query cannot be routed.
 * <p>
 * The reasoning capability is asked for a line-oriented reply:
 * <pre>
 *   AGENTS: budget_risk, delivery_optimization
 *   REASONING: ...
 *   CONFIDENCE: 0.85
 *   CLARIFICATION: none
 * </pre>
 * Any failure to obtain or parse that reply falls back to {@link KeywordRouter};
 * routing never fails the run.
 */
@Component
public class RoutingStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(RoutingStage.class);

    public static final String NAME = "routing";

    static final double DEFAULT_CONFIDENCE = 0.8;

    private static final Set<String> NO_CLARIFICATION = Set.of(
            "", "none", "n/a", "na", "no", "null", "not needed", "not required", "no clarification needed");

    private final ReasoningClient reasoningClient;
    private final SpecialistRegistry registry;
    private final SpecialistProperties specialistProperties;
    private final PipelineProperties pipelineProperties;
    private final ConversationStore conversationStore;
    private final PipelineMetrics metrics;
    private final KeywordRouter keywordRouter;

    public RoutingStage(ReasoningClient reasoningClient,
                        SpecialistRegistry registry,
                        SpecialistProperties specialistProperties,
                        PipelineProperties pipelineProperties,
                        ConversationStore conversationStore,
                        PipelineMetrics metrics) {
        this.reasoningClient = reasoningClient;
        this.registry = registry;
        this.specialistProperties = specialistProperties;
        this.pipelineProperties = pipelineProperties;
        this.conversationStore = conversationStore;
        this.metrics = metrics;
        this.keywordRouter = new KeywordRouter(specialistProperties.enabled());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Object> apply(RunState state) {
        String query = state.query();
        RoutingDecision decision;
        try {
            String reply = reasoningClient.complete(buildPrompt(query, history(state)));
            decision = parseReply(reply);
        } catch (RuntimeException e) {
            log.warn("Routing via reasoning failed, using keyword fallback: {}", e.getMessage());
            metrics.recordRoutingFallback();
            decision = keywordRouter.route(query, defaultClarificationMessage());
        }

        log.info("Routing decision: specialists={}, confidence={}, clarification={}, fallback={}",
                decision.specialists(), decision.confidence(), decision.clarificationNeeded(), decision.fallback());

        var update = new HashMap<String, Object>();
        update.put(RunState.ROUTED_SPECIALISTS, decision.specialists());
        update.put(RunState.ROUTING_CONFIDENCE, decision.confidence());
        update.put(RunState.ROUTING_RATIONALE, decision.rationale() != null ? decision.rationale() : "");
        update.put(RunState.CLARIFICATION_NEEDED, decision.clarificationNeeded());
        if (decision.clarificationNeeded()) {
            update.put(RunState.CLARIFICATION_MESSAGE, decision.clarificationMessage());
        }
        update.put(RunState.CAPABILITIES_INVOKED, List.of("reasoning:routing"));
        update.put(RunState.TRACE, List.of(traceLine(decision)));
        return update;
    }

    /**
     * Turns the model's reply into a decision. Unknown specialist names are
     * dropped; a reply without an AGENTS line is unusable.
     */
    RoutingDecision parseReply(String reply) {
        String agentsLine = null;
        String rationale = "";
        String clarification = "";
        double confidence = DEFAULT_CONFIDENCE;

        for (String rawLine : reply.split("\\R")) {
            String line = rawLine.trim();
            String upper = line.toUpperCase();
            if (upper.startsWith("AGENTS:")) {
                agentsLine = valueOf(line);
            } else if (upper.startsWith("REASONING:")) {
                rationale = valueOf(line);
            } else if (upper.startsWith("CONFIDENCE:")) {
                confidence = ReasoningParser.confidence(valueOf(line), DEFAULT_CONFIDENCE);
            } else if (upper.startsWith("CLARIFICATION:")) {
                clarification = valueOf(line);
            }
        }
        if (agentsLine == null) {
            throw new ReasoningParseException("Routing reply has no AGENTS line");
        }

        var selected = new LinkedHashSet<String>();
        for (String name : agentsLine.split(",")) {
            String id = name.trim().toLowerCase().replace(' ', '_');
            if (registry.contains(id)) {
                selected.add(id);
            } else if (!id.isEmpty() && !"none".equals(id)) {
                log.debug("Routing reply named unknown specialist '{}', dropped", id);
            }
        }

        boolean modelAsked = !NO_CLARIFICATION.contains(clarification.toLowerCase().replaceAll("[.!]+$", ""));
        if (modelAsked) {
            return RoutingDecision.clarify(confidence, rationale, clarification, false);
        }
        if (selected.isEmpty() || confidence < pipelineProperties.getClarificationThreshold()) {
            return RoutingDecision.clarify(confidence, rationale, defaultClarificationMessage(), false);
        }
        return RoutingDecision.routed(new ArrayList<>(selected), confidence, rationale, false);
    }

    String defaultClarificationMessage() {
        String areas = registry.ids().stream()
                .map(id -> id.replace('_', ' '))
                .collect(Collectors.joining(", "));
        return "I'm not sure what you're asking about. Could you rephrase your question with more detail? "
                + "I can help with: " + areas + ".";
    }

    private List<ConversationMessage> history(RunState state) {
        return state.sessionId()
                .map(session -> {
                    try {
                        return conversationStore.recent(session, pipelineProperties.getHistoryMessages());
                    } catch (RuntimeException e) {
                        log.warn("Could not load conversation history for session {}: {}", session, e.getMessage());
                        return List.<ConversationMessage>of();
                    }
                })
                .orElse(List.of());
    }

    private String buildPrompt(String query, List<ConversationMessage> history) {
        var sb = new StringBuilder();
        sb.append("Select the specialists that should answer the user's question.\n\n");
        sb.append("Available specialists:\n");
        for (var definition : specialistProperties.enabled()) {
            if (registry.contains(definition.getId())) {
                sb.append("- ").append(definition.getId()).append(": ").append(definition.getDescription()).append('\n');
            }
        }
        if (!history.isEmpty()) {
            int maxChars = pipelineProperties.getHistoryMessageChars();
            sb.append("\nRecent conversation:\n");
            for (var message : history) {
                String content = message.content() != null ? message.content() : "";
                if (content.length() > maxChars) {
                    content = content.substring(0, maxChars) + "...";
                }
                sb.append(message.role()).append(": ").append(content).append('\n');
            }
        }
        sb.append("\nUser question: \"").append(query).append("\"\n\n");
        sb.append("""
                Reply with exactly these four lines:
                AGENTS: comma-separated specialist ids, or none
                REASONING: one sentence
                CONFIDENCE: a number between 0 and 1
                CLARIFICATION: a question for the user if the request is ambiguous, otherwise none
                """);
        return sb.toString();
    }

    private static String traceLine(RoutingDecision decision) {
        if (decision.clarificationNeeded()) {
            return "Routing: clarification requested (confidence %.2f%s)"
                    .formatted(decision.confidence(), decision.fallback() ? ", keyword fallback" : "");
        }
        return "Routing: selected %s (confidence %.2f%s)"
                .formatted(decision.specialists(), decision.confidence(), decision.fallback() ? ", keyword fallback" : "");
    }

    private static String valueOf(String line) {
        return line.substring(line.indexOf(':') + 1).trim();
    }

}
