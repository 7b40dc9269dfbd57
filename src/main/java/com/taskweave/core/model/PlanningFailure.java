package com.taskweave.core.model;

/**
 * Structural reasons that abort the planning phase.
 */
public enum PlanningFailure {
    CYCLIC_DEPENDENCY,
    UNKNOWN_TASK_REFERENCE
}
