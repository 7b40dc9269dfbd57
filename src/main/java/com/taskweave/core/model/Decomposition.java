package com.taskweave.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of the decomposer.
 *
 * @param rootTask the task as a whole ("task_0")
 * @param subtasks executable subtasks; equal to {@code [rootTask]} when no decomposition was needed
 * @param taskTree every task id mapped to its direct children by parent id (informational)
 */
public record Decomposition(
    SubTask rootTask,
    List<SubTask> subtasks,
    Map<String, List<String>> taskTree
) implements Serializable {

    public Decomposition {
        subtasks = List.copyOf(subtasks);
        var tree = new LinkedHashMap<String, List<String>>();
        taskTree.forEach((k, v) -> tree.put(k, List.copyOf(v)));
        taskTree = Collections.unmodifiableMap(tree);
    }
}
