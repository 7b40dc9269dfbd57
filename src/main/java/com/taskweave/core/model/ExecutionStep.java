package com.taskweave.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * One step of an execution plan: tasks that may run together once every earlier step settled.
 */
public record ExecutionStep(
    int stepNumber,
    List<String> taskIds,
    boolean canParallelize
) implements Serializable {

    public ExecutionStep {
        taskIds = List.copyOf(taskIds);
    }
}
