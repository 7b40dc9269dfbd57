package com.taskweave.core.graph;

/**
 * Thrown when a subtask depends on an id that is not part of the same subtask batch.
 */
public class UnknownTaskReferenceException extends RuntimeException {

    private final String taskId;
    private final String missingDependency;

    public UnknownTaskReferenceException(String taskId, String missingDependency) {
        super("Task " + taskId + " depends on unknown task " + missingDependency);
        this.taskId = taskId;
        this.missingDependency = missingDependency;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getMissingDependency() {
        return missingDependency;
    }
}
