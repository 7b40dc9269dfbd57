package com.taskweave.core.tracking;

import com.taskweave.core.model.TaskState;

import java.util.Map;

/**
 * Snapshot of tracker counters.
 */
public record TrackerStats(
    int totalTasks,
    Map<TaskState, Integer> statusCounts,
    double overallProgress,
    int readyTasks
) {}
