package com.routeflow.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for pipeline runs.
 */
@Service
public class PipelineMetrics {

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRun(String path, long ms) {
        Timer.builder("routeflow.run.duration")
                .tag("path", path)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordStage(String stage, long ms) {
        Timer.builder("routeflow.stage.duration")
                .tag("stage", stage)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param result "success", "error" or "timeout"
     */
    public void recordSpecialistInvocation(String specialistId, String result) {
        Counter.builder("routeflow.specialist.invocations")
                .description("Specialist calls by outcome")
                .tag("specialist", specialistId)
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordRoutingFallback() {
        Counter.builder("routeflow.routing.fallbacks")
                .description("Routing decisions made by keyword matching")
                .register(registry)
                .increment();
    }

    public void recordGateDecision(boolean approved) {
        Counter.builder("routeflow.gate.decisions")
                .tag("result", approved ? "approved" : "blocked")
                .register(registry)
                .increment();
    }
}
