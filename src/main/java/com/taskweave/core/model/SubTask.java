package com.taskweave.core.model;

import java.io.Serializable;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * A unit of work produced by decomposition.
 *
 * @param id           identifier, unique within one decomposition (e.g. "task_1")
 * @param description  what this subtask should accomplish
 * @param parentId     tree lineage only, nullable; scheduling uses {@code dependencies}
 * @param dependencies IDs of subtasks that must complete first, duplicates removed
 * @param domain       domain tag of the subtask
 * @param complexity   complexity tier, drives duration weights
 * @param status       decomposition-time status, {@link TaskState#PENDING} when created
 */
public record SubTask(
    String id,
    String description,
    String parentId,
    List<String> dependencies,
    String domain,
    Complexity complexity,
    TaskState status
) implements Serializable {

    public SubTask {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("SubTask id must not be blank");
        }
        description = description != null ? description : "";
        dependencies = dependencies != null ? List.copyOf(new LinkedHashSet<>(dependencies)) : List.of();
        domain = domain != null && !domain.isBlank() ? domain : "general";
        complexity = complexity != null ? complexity : Complexity.SIMPLE;
        status = status != null ? status : TaskState.PENDING;
    }

    public static SubTask of(String id, String description, List<String> dependencies) {
        return new SubTask(id, description, null, dependencies, "general", Complexity.SIMPLE, TaskState.PENDING);
    }

    public SubTask withStatus(TaskState newStatus) {
        return new SubTask(id, description, parentId, dependencies, domain, complexity, newStatus);
    }
}
