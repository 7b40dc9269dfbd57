package com.taskweave.core.tracking;

import com.taskweave.core.model.TaskState;

/**
 * Thrown when a tracked task is asked to make a transition its state machine forbids.
 */
public class IllegalTaskTransitionException extends RuntimeException {

    private final String taskId;
    private final TaskState from;
    private final TaskState to;

    public IllegalTaskTransitionException(String taskId, TaskState from, TaskState to) {
        super("Task " + taskId + " cannot move from " + from + " to " + to);
        this.taskId = taskId;
        this.from = from;
        this.to = to;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskState getFrom() {
        return from;
    }

    public TaskState getTo() {
        return to;
    }
}
