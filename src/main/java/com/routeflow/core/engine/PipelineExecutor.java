package com.routeflow.core.engine;

import com.routeflow.core.config.PipelineProperties;
import com.routeflow.core.conversation.ConversationStore;
import com.routeflow.core.events.EventBus;
import com.routeflow.core.events.PipelineEvent;
import com.routeflow.core.graph.PipelineGraph;
import com.routeflow.core.logging.MdcContext;
import com.routeflow.core.metrics.PipelineMetrics;
import com.routeflow.core.model.ConversationMessage;
import com.routeflow.core.model.PublicResult;
import com.routeflow.core.stages.ResponseStage;
import com.routeflow.core.state.RunState;
import jakarta.annotation.PreDestroy;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Entry point of the analysis pipeline.
 * <p>
 * Seeds a {@link RunState}, drives the compiled {@link PipelineGraph} on a run
 * thread under a single deadline and turns the terminal state into a
 * {@link PublicResult}. Any failure, including an expired deadline, is
 * answered with a degraded response built from the last state the graph
 * produced; callers never see an exception.
 */
@Service
public class PipelineExecutor {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    /**
     * Terminal state of a run and the failure that ended it early, if any.
     */
    public record RunOutcome(RunState state, Throwable error) {

        public boolean failed() {
            return error != null;
        }
    }

    private final PipelineGraph pipelineGraph;
    private final ResponseStage responseStage;
    private final ConversationStore conversationStore;
    private final PipelineProperties properties;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;
    private final ExecutorService runThreads;

    public PipelineExecutor(PipelineGraph pipelineGraph,
                            ResponseStage responseStage,
                            ConversationStore conversationStore,
                            PipelineProperties properties,
                            EventBus eventBus,
                            PipelineMetrics metrics) {
        this.pipelineGraph = pipelineGraph;
        this.responseStage = responseStage;
        this.conversationStore = conversationStore;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        var counter = new AtomicInteger();
        this.runThreads = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "routeflow-run-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Runs a query with the configured default deadline.
     */
    public PublicResult execute(String query, String sessionId, String userId) {
        return execute(query, sessionId, userId, null, null);
    }

    public PublicResult execute(String query, String sessionId, String userId, Duration deadline) {
        return execute(query, sessionId, userId, deadline, null);
    }

    /**
     * Runs one query through the pipeline.
     *
     * @param query     the user's question
     * @param sessionId conversation session, may be {@code null}
     * @param userId    the requesting user
     * @param deadline  overall budget for the run, {@code null} for the configured run timeout
     * @param listener  receives this run's progress events, may be {@code null}
     * @return the user-facing result, never {@code null}
     */
    public PublicResult execute(String query, String sessionId, String userId, Duration deadline,
                                Consumer<PipelineEvent> listener) {
        query = query != null ? query.trim() : "";
        deadline = deadline != null ? deadline : properties.getRunTimeout();
        String runId = generateRunId();
        EventBus.Subscription subscription = listener != null ? eventBus.subscribe(runId, listener) : () -> { };
        MdcContext.setRun(runId);
        try {
            long startedAt = System.currentTimeMillis();
            log.info("Starting run {} for user {} (session {}): {}", runId, userId, sessionId, query);
            eventBus.publish(PipelineEvent.of(PipelineEvent.RUN_STARTED, runId, null,
                    Map.of("query", query, "deadlineMs", deadline.toMillis())));

            var seed = new HashMap<String, Object>();
            seed.put(RunState.RUN_ID, runId);
            seed.put(RunState.QUERY, query);
            seed.put(RunState.USER_ID, userId != null ? userId : "");
            if (sessionId != null && !sessionId.isBlank()) {
                seed.put(RunState.SESSION_ID, sessionId);
            }
            seed.put(RunState.STARTED_AT, startedAt);
            seed.put(RunState.DEADLINE_AT, startedAt + deadline.toMillis());

            RunOutcome outcome = run(Map.copyOf(seed), deadline);
            RunState state = outcome.state();

            ResponseStage.Rendered rendered;
            long totalMs;
            if (!outcome.failed() && state.finalResponse().isPresent()) {
                rendered = new ResponseStage.Rendered(state.finalResponse().get(), state.confidence(),
                        state.terminalPath().orElseThrow());
                totalMs = state.totalElapsedMs();
            } else {
                rendered = responseStage.renderDegraded(state, outcome.error());
                totalMs = System.currentTimeMillis() - startedAt;
            }

            PublicResult result = toPublicResult(state, rendered, outcome.error(), totalMs);
            remember(sessionId, query, result.response());

            metrics.recordRun(rendered.path().tag(), totalMs);
            eventBus.publish(PipelineEvent.of(PipelineEvent.RUN_COMPLETED, runId, null,
                    Map.of("path", rendered.path().tag(), "totalElapsedMs", totalMs)));
            log.info("Run {} finished via {} path in {}ms", runId, rendered.path().tag(), totalMs);
            return result;
        } finally {
            subscription.close();
            MdcContext.clear();
        }
    }

    /**
     * Drives the graph from a seed state until it ends, fails or the deadline
     * passes. On expiry the run thread is interrupted, which cancels any
     * in-flight specialist calls, and the state as of the last stage entered
     * is returned with the failure.
     */
    public RunOutcome run(Map<String, Object> seed, Duration deadline) {
        String runId = String.valueOf(seed.get(RunState.RUN_ID));
        var seedState = new RunState(seed);
        var config = RunnableConfig.builder()
                .threadId(runId)
                .build();

        pipelineGraph.track(runId, seedState);
        Future<Optional<RunState>> future = runThreads.submit(() -> {
            MdcContext.setRun(runId);
            try {
                return pipelineGraph.getCompiledGraph().invoke(seed, config);
            } finally {
                MdcContext.clear();
            }
        });

        try {
            Optional<RunState> result = future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
            if (result.isEmpty()) {
                return new RunOutcome(partial(runId, seedState),
                        new IllegalStateException("Graph execution returned empty state for run " + runId));
            }
            return new RunOutcome(result.get(), null);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Run {} exceeded its {}ms deadline, cancelling", runId, deadline.toMillis());
            return new RunOutcome(partial(runId, seedState),
                    new TimeoutException("Run deadline of " + deadline.toMillis() + "ms exceeded"));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Run {} failed: {}", runId, cause.getMessage(), cause);
            return new RunOutcome(partial(runId, seedState), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("Run {} interrupted", runId);
            return new RunOutcome(partial(runId, seedState), e);
        } finally {
            pipelineGraph.release(runId);
        }
    }

    private RunState partial(String runId, RunState seedState) {
        return pipelineGraph.lastSnapshot(runId).orElse(seedState);
    }

    private PublicResult toPublicResult(RunState state, ResponseStage.Rendered rendered,
                                        Throwable error, long totalMs) {
        var warnings = new ArrayList<String>(state.gateWarnings());
        warnings.addAll(state.validationWarnings());

        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("runId", state.runId());
        metadata.put("path", rendered.path().tag());
        state.severity().ifPresent(severity -> metadata.put("severity", severity.name().toLowerCase()));
        metadata.put("specialistsInvoked", state.approvedSpecialists());
        metadata.put("failedSpecialists", state.specialistErrors());
        metadata.put("recommendationCount", state.validatedRecommendations().size());
        metadata.put("routingConfidence", state.routingConfidence());
        metadata.put("stageTimings", state.stageTimings());
        metadata.put("totalElapsedMs", totalMs);
        metadata.put("capabilitiesInvoked", state.capabilitiesInvoked());
        metadata.put("warnings", warnings);
        metadata.put("trace", state.trace());
        metadata.put("degraded", error != null);
        if (error != null) {
            metadata.put("error", error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
        }

        return new PublicResult(rendered.text(), state.stagesRun(), rendered.confidence(), metadata);
    }

    private void remember(String sessionId, String query, String response) {
        if (sessionId == null || sessionId.isBlank()) {
            return;
        }
        try {
            conversationStore.append(sessionId, ConversationMessage.user(query));
            conversationStore.append(sessionId, ConversationMessage.assistant(response));
        } catch (RuntimeException e) {
            log.warn("Could not record conversation for session {}: {}", sessionId, e.getMessage());
        }
    }

    /**
     * Generates a run ID in the format RF-YYYY-NNNNN.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("RF-%d-%05d", year, count);
    }

    @PreDestroy
    public void shutdown() {
        runThreads.shutdownNow();
    }
}
