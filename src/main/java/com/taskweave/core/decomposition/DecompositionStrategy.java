package com.taskweave.core.decomposition;

import com.taskweave.core.model.SubTask;
import com.taskweave.core.model.TaskAnalysis;

import java.util.List;

/**
 * Turns an analysis into an ordered batch of subtasks for one primary domain.
 * <p>
 * Implementations must only reference subtask IDs produced in the same batch.
 */
public interface DecompositionStrategy {

    /**
     * Domain key this strategy is selected for, e.g. "development".
     */
    String domain();

    /**
     * @param analysis the task analysis
     * @param parentId id of the root task the produced subtasks hang under
     * @return subtasks in execution-chain order
     */
    List<SubTask> decompose(TaskAnalysis analysis, String parentId);
}
