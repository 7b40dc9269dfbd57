package com.taskweave.core.planning;

/**
 * Plan-level progress snapshot.
 */
public record PlanProgress(
    int totalTasks,
    int completed,
    int failed,
    int pending,
    double progressPercentage
) {}
