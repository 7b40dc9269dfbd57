package com.taskweave.core.decomposition;

import com.taskweave.core.model.Complexity;
import com.taskweave.core.model.SubTask;
import com.taskweave.core.model.TaskAnalysis;
import com.taskweave.core.model.TaskState;

import java.util.ArrayList;
import java.util.List;

/**
 * Generic fallback: one sequential subtask per extracted requirement fragment.
 */
public class RequirementSliceStrategy implements DecompositionStrategy {

    static final int MAX_SLICES = 5;

    static final List<String> DEFAULT_STEPS = List.of(
            "Analyze requirements",
            "Plan approach",
            "Execute task",
            "Verify results");

    @Override
    public String domain() {
        return "general";
    }

    @Override
    public List<SubTask> decompose(TaskAnalysis analysis, String parentId) {
        List<String> requirements = analysis.requirements().isEmpty()
                ? DEFAULT_STEPS
                : analysis.requirements();

        var subtasks = new ArrayList<SubTask>();
        int limit = Math.min(requirements.size(), MAX_SLICES);
        for (int i = 1; i <= limit; i++) {
            subtasks.add(new SubTask(
                    TaskDecomposer.taskId(i),
                    requirements.get(i - 1),
                    parentId,
                    i > 1 ? List.of(TaskDecomposer.taskId(i - 1)) : List.of(),
                    "general",
                    Complexity.SIMPLE,
                    TaskState.PENDING));
        }
        return subtasks;
    }
}
