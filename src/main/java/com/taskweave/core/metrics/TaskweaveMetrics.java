package com.taskweave.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for workflow planning and execution.
 */
@Service
public class TaskweaveMetrics {

    private final MeterRegistry registry;

    public TaskweaveMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPlanningDuration(long ms) {
        Timer.builder("taskweave.planning.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskExecution(String domain, long ms) {
        Timer.builder("taskweave.task.duration")
                .tag("domain", domain)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param outcome "completed", "failed" or "blocked"
     */
    public void recordTaskOutcome(String outcome) {
        Counter.builder("taskweave.tasks.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordWorkflowResult(String status, boolean degraded) {
        Counter.builder("taskweave.workflows.total")
                .tag("status", status)
                .tag("degraded", String.valueOf(degraded))
                .register(registry)
                .increment();
    }

    /**
     * Records how many tasks a step dispatched.
     *
     * @param taskCount number of tasks in the step
     * @param mode      "parallel" or "sequential"
     */
    public void recordStepExecution(int taskCount, String mode) {
        DistributionSummary.builder("taskweave.step.task_count")
                .description("Number of tasks dispatched per execution step")
                .tag("mode", mode)
                .register(registry)
                .record(taskCount);
    }
}
