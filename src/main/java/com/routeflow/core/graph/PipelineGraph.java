package com.routeflow.core.graph;

import com.routeflow.core.events.EventBus;
import com.routeflow.core.events.PipelineEvent;
import com.routeflow.core.logging.MdcContext;
import com.routeflow.core.metrics.PipelineMetrics;
import com.routeflow.core.model.Fork;
import com.routeflow.core.stages.DiagnosisStage;
import com.routeflow.core.stages.EarlyExitStage;
import com.routeflow.core.stages.GateStage;
import com.routeflow.core.stages.InvocationStage;
import com.routeflow.core.stages.RecommendationStage;
import com.routeflow.core.stages.ResponseStage;
import com.routeflow.core.stages.RoutingStage;
import com.routeflow.core.stages.Stage;
import com.routeflow.core.stages.ValidationStage;
import com.routeflow.core.state.PipelineStateException;
import com.routeflow.core.state.RunState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives
 * one analysis run.
 * <pre>
 *   START -> routing -> gate -> [Fork]
 *              BLOCK   -> response -> END
 *              PROCEED -> invocation -> diagnosis -> early_exit_check -> [Fork]
 *                           EXIT     -> response -> END
 *                           CONTINUE -> recommendation -> validation -> response -> END
 * </pre>
 * Every stage is wrapped so that its elapsed time and name are merged into
 * the state together with its own update.
 */
@Component
public class PipelineGraph {

    private static final Logger log = LoggerFactory.getLogger(PipelineGraph.class);

    private final CompiledGraph<RunState> compiledGraph;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;

    /** Latest state seen at stage entry, per tracked run. */
    private final ConcurrentHashMap<String, RunState> inFlight = new ConcurrentHashMap<>();

    public PipelineGraph(RoutingStage routing,
                         GateStage gate,
                         InvocationStage invocation,
                         DiagnosisStage diagnosis,
                         EarlyExitStage earlyExit,
                         RecommendationStage recommendation,
                         ValidationStage validation,
                         ResponseStage response,
                         EventBus eventBus,
                         PipelineMetrics metrics) throws Exception {
        this.eventBus = eventBus;
        this.metrics = metrics;

        var graph = new StateGraph<>(RunState.SCHEMA, RunState::new)
                .addNode(routing.name(), timed(routing))
                .addNode(gate.name(), timed(gate))
                .addNode(invocation.name(), timed(invocation))
                .addNode(diagnosis.name(), timed(diagnosis))
                .addNode(earlyExit.name(), timed(earlyExit))
                .addNode(recommendation.name(), timed(recommendation))
                .addNode(validation.name(), timed(validation))
                .addNode(response.name(), timed(response))
                .addEdge(START, routing.name())
                .addEdge(routing.name(), gate.name())
                .addConditionalEdges(gate.name(),
                        edge_async(state -> gate.decide(state).name()),
                        Map.of(Fork.PROCEED.name(), invocation.name(),
                                Fork.BLOCK.name(), response.name()))
                .addEdge(invocation.name(), diagnosis.name())
                .addEdge(diagnosis.name(), earlyExit.name())
                .addConditionalEdges(earlyExit.name(),
                        edge_async(state -> earlyExit.decide(state).name()),
                        Map.of(Fork.EXIT.name(), response.name(),
                                Fork.CONTINUE.name(), recommendation.name()))
                .addEdge(recommendation.name(), validation.name())
                .addEdge(validation.name(), response.name())
                .addEdge(response.name(), END);

        this.compiledGraph = graph.compile(CompileConfig.builder().build());
        log.info("Pipeline graph compiled");
    }

    /**
     * Wraps a stage with re-entry and cancellation checks, timing, MDC and
     * a {@code stage.completed} event.
     */
    AsyncNodeAction<RunState> timed(Stage stage) {
        String name = stage.name();
        return node_async(state -> {
            if (state.stagesRun().contains(name)) {
                throw new PipelineStateException("Stage '" + name + "' already ran in run " + state.runId());
            }
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Run " + state.runId() + " cancelled before stage " + name);
            }
            inFlight.replace(state.runId(), state);
            MdcContext.setStage(state.runId(), name);
            long start = System.nanoTime();
            try {
                Map<String, Object> update = stage.apply(state);
                if (update == null) {
                    throw new PipelineStateException("Stage '" + name + "' returned no update");
                }
                long elapsedMs = (System.nanoTime() - start) / 1_000_000;

                var merged = new HashMap<String, Object>(update);
                merged.put(RunState.STAGE_TIMINGS, Map.of(name, elapsedMs));
                merged.put(RunState.STAGES_RUN, List.of(name));

                log.debug("Stage {} finished in {}ms", name, elapsedMs);
                metrics.recordStage(name, elapsedMs);
                eventBus.publish(PipelineEvent.of(PipelineEvent.STAGE_COMPLETED, state.runId(), name,
                        Map.of("elapsedMs", elapsedMs)));
                return merged;
            } finally {
                MdcContext.clearStage();
            }
        });
    }

    /**
     * Starts recording stage-entry snapshots for a run so that a partial
     * state is available if the run is cut short.
     */
    public void track(String runId, RunState seed) {
        inFlight.put(runId, seed);
    }

    public Optional<RunState> lastSnapshot(String runId) {
        return Optional.ofNullable(inFlight.get(runId));
    }

    public void release(String runId) {
        inFlight.remove(runId);
    }

    public CompiledGraph<RunState> getCompiledGraph() {
        return compiledGraph;
    }
}
