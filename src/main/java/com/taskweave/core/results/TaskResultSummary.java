package com.taskweave.core.results;

import java.time.Instant;
import java.util.List;

/**
 * All results of one task folded together, oldest first.
 *
 * @param status "completed" when at least one result exists, otherwise "no_results"
 */
public record TaskResultSummary(
    String taskId,
    String status,
    List<Result> outputs,
    List<String> workers,
    Instant firstResult,
    Instant lastResult
) {
    public static final String COMPLETED = "completed";
    public static final String NO_RESULTS = "no_results";

    public static TaskResultSummary empty(String taskId) {
        return new TaskResultSummary(taskId, NO_RESULTS, List.of(), List.of(), null, null);
    }

    public int resultCount() {
        return outputs.size();
    }
}
