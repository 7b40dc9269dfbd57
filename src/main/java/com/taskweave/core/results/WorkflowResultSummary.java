package com.taskweave.core.results;

import java.util.List;
import java.util.Map;

/**
 * Results folded across the tasks of a workflow.
 *
 * @param totalTasks   number of task ids requested
 * @param totalResults number of results across those tasks
 * @param workers      distinct worker ids involved, in first-seen order
 * @param taskResults  per-task summaries keyed by task id, in request order
 */
public record WorkflowResultSummary(
    int totalTasks,
    int totalResults,
    List<String> workers,
    Map<String, TaskResultSummary> taskResults
) {}
