package com.taskweave.core.model;

/**
 * Lifecycle status of a workflow run.
 */
public enum WorkflowStatus {
    IDLE,
    PLANNING,
    EXECUTING,
    COMPLETED,
    FAILED
}
