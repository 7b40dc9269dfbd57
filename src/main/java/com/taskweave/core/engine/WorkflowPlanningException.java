package com.taskweave.core.engine;

import com.taskweave.core.model.PlanningFailure;

/**
 * Thrown by {@link Orchestrator#executeTask} when a structural problem aborts planning.
 */
public class WorkflowPlanningException extends RuntimeException {

    private final PlanningFailure failure;

    public WorkflowPlanningException(PlanningFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public WorkflowPlanningException(PlanningFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public PlanningFailure getFailure() {
        return failure;
    }
}
