package com.taskweave.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Ordered execution steps built from a dependency graph.
 *
 * @param steps                    steps in ascending depth order
 * @param totalSteps               number of steps
 * @param canParallelize           true iff any step holds more than one task
 * @param estimatedDurationMinutes sum of per-task complexity weights
 * @param criticalPath             longest weighted root-to-leaf chain
 * @param error                    structural error marker, null for a usable plan
 * @param createdAt                creation time
 */
public record ExecutionPlan(
    List<ExecutionStep> steps,
    int totalSteps,
    boolean canParallelize,
    int estimatedDurationMinutes,
    List<String> criticalPath,
    String error,
    Instant createdAt
) implements Serializable {

    public static final String CYCLE_ERROR = "Cannot create plan: circular dependency detected";

    public ExecutionPlan {
        steps = List.copyOf(steps);
        criticalPath = List.copyOf(criticalPath);
    }

    public static ExecutionPlan failed(String error) {
        return new ExecutionPlan(List.of(), 0, false, 0, List.of(), error, Instant.now());
    }

    public boolean hasError() {
        return error != null;
    }

    public List<String> allTaskIds() {
        return steps.stream().flatMap(s -> s.taskIds().stream()).toList();
    }
}
