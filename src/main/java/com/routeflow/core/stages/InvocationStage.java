package com.routeflow.core.stages;

import com.routeflow.core.config.PipelineProperties;
import com.routeflow.core.logging.MdcContext;
import com.routeflow.core.metrics.PipelineMetrics;
import com.routeflow.core.model.SpecialistOutcome;
import com.routeflow.core.specialist.Specialist;
import com.routeflow.core.specialist.SpecialistRegistry;
import com.routeflow.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Calls every approved specialist concurrently and waits for all of them.
 * <p>
 * Each run gets its own workers, one per specialist, so every call starts at
 * once and its timeout is not shared with other runs. The timeout is the
 * specialist timeout, further capped by whatever remains of the run deadline.
 * A failure or timeout is recorded against that specialist only. On return
 * every approved id has exactly one entry in either the outcome map or the
 * error map.
 */
@Component
public class InvocationStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(InvocationStage.class);

    public static final String NAME = "invocation";

    private final SpecialistRegistry registry;
    private final Duration specialistTimeout;
    private final PipelineMetrics metrics;

    @Autowired
    public InvocationStage(SpecialistRegistry registry, PipelineProperties properties, PipelineMetrics metrics) {
        this(registry, properties.getSpecialistTimeout(), metrics);
    }

    InvocationStage(SpecialistRegistry registry, Duration specialistTimeout, PipelineMetrics metrics) {
        this.registry = registry;
        this.specialistTimeout = specialistTimeout;
        this.metrics = metrics;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Object> apply(RunState state) {
        List<String> approved = state.approvedSpecialists();
        String runId = state.runId();

        if (approved.isEmpty()) {
            return Map.of(
                    RunState.OUTCOMES, Map.of(),
                    RunState.SPECIALIST_ERRORS, Map.of(),
                    RunState.TRACE, List.of("Invocation: no specialists to call"));
        }

        var outcomes = new LinkedHashMap<String, SpecialistOutcome>();
        var errors = new LinkedHashMap<String, String>();

        long remaining = state.deadlineAt() == Long.MAX_VALUE
                ? Long.MAX_VALUE
                : state.deadlineAt() - System.currentTimeMillis();
        long timeoutMs = Math.min(specialistTimeout.toMillis(), remaining);

        if (timeoutMs <= 0) {
            for (String id : approved) {
                errors.put(id, "Run deadline exceeded before invocation");
                metrics.recordSpecialistInvocation(id, "timeout");
            }
            return result(outcomes, errors, List.of());
        }

        var submittedIds = new ArrayList<String>();
        var tasks = new ArrayList<Callable<SpecialistOutcome>>();
        for (String id : approved) {
            var specialist = registry.find(id);
            if (specialist.isEmpty()) {
                log.warn("Specialist {} is not registered, recording as failed", id);
                errors.put(id, "Unknown specialist: " + id);
                metrics.recordSpecialistInvocation(id, "error");
                continue;
            }
            submittedIds.add(id);
            tasks.add(task(runId, specialist.get(), state));
        }

        if (submittedIds.isEmpty()) {
            return result(outcomes, errors, submittedIds);
        }

        log.info("Invoking {} specialist(s) concurrently with {}ms timeout", submittedIds.size(), timeoutMs);

        ExecutorService workers = Executors.newFixedThreadPool(submittedIds.size(), workerThreadFactory(runId));
        try {
            List<Future<SpecialistOutcome>> futures = workers.invokeAll(tasks, timeoutMs, TimeUnit.MILLISECONDS);
            for (int i = 0; i < futures.size(); i++) {
                collect(submittedIds.get(i), futures.get(i), timeoutMs, outcomes, errors);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Invocation interrupted, outstanding specialist calls cancelled");
            for (String id : submittedIds) {
                if (!outcomes.containsKey(id) && !errors.containsKey(id)) {
                    errors.put(id, "Cancelled: run was interrupted");
                    metrics.recordSpecialistInvocation(id, "timeout");
                }
            }
        } finally {
            workers.shutdownNow();
        }

        return result(outcomes, errors, submittedIds);
    }

    private Callable<SpecialistOutcome> task(String runId, Specialist specialist, RunState state) {
        String query = state.query();
        String sessionId = state.sessionId().orElse(null);
        String userId = state.userId();
        return () -> {
            MdcContext.setSpecialist(runId, specialist.id());
            try {
                log.info("Calling specialist {}", specialist.id());
                return specialist.handle(query, sessionId, userId);
            } finally {
                MdcContext.clear();
            }
        };
    }

    private void collect(String id, Future<SpecialistOutcome> future, long timeoutMs,
                         Map<String, SpecialistOutcome> outcomes, Map<String, String> errors)
            throws InterruptedException {
        if (future.isCancelled()) {
            log.warn("Specialist {} timed out after {}ms", id, timeoutMs);
            errors.put(id, "Timed out after " + timeoutMs + "ms");
            metrics.recordSpecialistInvocation(id, "timeout");
            return;
        }
        try {
            SpecialistOutcome outcome = future.get();
            if (outcome == null) {
                errors.put(id, "Specialist returned no outcome");
                metrics.recordSpecialistInvocation(id, "error");
                return;
            }
            outcomes.put(id, outcome);
            metrics.recordSpecialistInvocation(id, "success");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            log.warn("Specialist {} failed: {}", id, message);
            errors.put(id, message);
            metrics.recordSpecialistInvocation(id, "error");
        }
    }

    private static Map<String, Object> result(Map<String, SpecialistOutcome> outcomes,
                                              Map<String, String> errors,
                                              List<String> submittedIds) {
        var capabilities = new ArrayList<String>();
        for (String id : submittedIds) {
            capabilities.add("specialist:" + id);
            SpecialistOutcome outcome = outcomes.get(id);
            if (outcome != null) {
                outcome.toolsUsed().forEach(tool -> capabilities.add("tool:" + id + "/" + tool));
            }
        }
        String trace = "Invocation: %d succeeded, %d failed%s".formatted(
                outcomes.size(), errors.size(), errors.isEmpty() ? "" : " " + errors.keySet());
        return Map.of(
                RunState.OUTCOMES, Collections.unmodifiableMap(outcomes),
                RunState.SPECIALIST_ERRORS, Collections.unmodifiableMap(errors),
                RunState.CAPABILITIES_INVOKED, List.copyOf(capabilities),
                RunState.TRACE, List.of(trace));
    }

    private static ThreadFactory workerThreadFactory(String runId) {
        var counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "routeflow-specialist-" + runId + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
