package com.taskweave.core.engine;

import com.taskweave.core.events.EventBus;
import com.taskweave.core.model.WorkflowStatus;
import com.taskweave.core.results.ResultStats;
import com.taskweave.core.tracking.TrackerStats;

/**
 * Progress snapshot of the current (or last) workflow run.
 */
public record OrchestratorProgress(
    String workflowId,
    WorkflowStatus status,
    double overallProgress,
    TrackerStats taskStats,
    ResultStats resultStats,
    EventBus.BusStats busStats
) {}
