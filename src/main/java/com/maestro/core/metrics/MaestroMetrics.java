package com.maestro.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for workflow execution.
 */
@Service
public class MaestroMetrics {

    private final MeterRegistry registry;

    public MaestroMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskExecution(String agent, long ms) {
        Timer.builder("maestro.task.duration")
                .tag("agent", agent)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param outcome "completed", "retried" or "failed"
     */
    public void recordTaskAttempt(String outcome) {
        Counter.builder("maestro.task.attempts")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordSkippedTasks(int count) {
        Counter.builder("maestro.tasks.skipped")
                .description("Tasks skipped because a dependency failed")
                .register(registry)
                .increment(count);
    }

    public void recordBatch(int size) {
        DistributionSummary.builder("maestro.batch.size")
                .description("Number of tasks dispatched per batch")
                .register(registry)
                .record(size);
    }

    public void recordWorkflowResult(String status) {
        Counter.builder("maestro.workflows.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * @param route "exact", "capability" or "default"
     */
    public void recordRouting(String route) {
        Counter.builder("maestro.routing.decisions")
                .tag("route", route)
                .register(registry)
                .increment();
    }
}
