package com.taskweave.core.model;

import com.taskweave.core.results.WorkflowResultSummary;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one orchestrated workflow.
 *
 * @param workflowId               generated workflow id
 * @param status                   {@link WorkflowStatus#COMPLETED} only when every task completed
 * @param degraded                 true when any task failed, blocked or was never dispatched
 * @param totalSteps               number of plan steps
 * @param canParallelize           whether the plan had a multi-task step
 * @param criticalPath             task ids on the critical path
 * @param criticalPathLength       number of tasks on the critical path
 * @param criticalPathMinutes      summed complexity weight of the critical path
 * @param estimatedDurationMinutes summed complexity weight of every task
 * @param overallProgress          mean task progress in [0,1]
 * @param completedTasks           ids that completed
 * @param failedTasks              ids that failed
 * @param blockedTasks             ids blocked on clarification
 * @param pendingTasks             ids never dispatched because a dependency did not complete
 * @param clarifications           questions per blocked task id
 * @param results                  aggregated worker outputs
 */
public record WorkflowResult(
    String workflowId,
    WorkflowStatus status,
    boolean degraded,
    int totalSteps,
    boolean canParallelize,
    List<String> criticalPath,
    int criticalPathLength,
    int criticalPathMinutes,
    int estimatedDurationMinutes,
    double overallProgress,
    List<String> completedTasks,
    List<String> failedTasks,
    List<String> blockedTasks,
    List<String> pendingTasks,
    Map<String, List<String>> clarifications,
    WorkflowResultSummary results
) {

    public boolean isComplete() {
        return status == WorkflowStatus.COMPLETED && !degraded;
    }
}
