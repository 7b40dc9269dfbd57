package com.taskweave.core.worker;

import java.util.Map;

/**
 * External collaborator that performs one subtask.
 * <p>
 * Implementations own any timeout for their work. Throwing is treated the same as
 * returning {@link WorkerResult#error(String)}.
 */
@FunctionalInterface
public interface Worker {

    /**
     * @param description what the subtask should accomplish
     * @param context     caller context plus task metadata and outputs of completed dependencies
     * @return the outcome; null is treated as an error
     */
    WorkerResult execute(String description, Map<String, Object> context);
}
