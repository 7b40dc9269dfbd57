package com.taskweave.core.decomposition;

import com.taskweave.core.model.Decomposition;
import com.taskweave.core.model.SubTask;
import com.taskweave.core.model.TaskAnalysis;
import com.taskweave.core.model.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Breaks an analyzed task into subtasks using a strategy keyed by the primary domain.
 * <p>
 * Tasks that need no decomposition come back as a single subtask equal to the root.
 * Otherwise the root ("task_0") is returned separately and the subtasks hang under it.
 */
@Service
public class TaskDecomposer {

    private static final Logger log = LoggerFactory.getLogger(TaskDecomposer.class);

    public static final String ROOT_TASK_ID = "task_0";
    public static final int DEFAULT_MAX_DEPTH = 3;

    private final Map<String, DecompositionStrategy> strategies = new LinkedHashMap<>();
    private final DecompositionStrategy fallback;

    public TaskDecomposer() {
        this(List.of(
                PhaseTemplateStrategy.development(),
                PhaseTemplateStrategy.devops(),
                PhaseTemplateStrategy.data(),
                PhaseTemplateStrategy.research()));
    }

    TaskDecomposer(List<DecompositionStrategy> domainStrategies) {
        for (var strategy : domainStrategies) {
            strategies.put(strategy.domain(), strategy);
        }
        this.fallback = new RequirementSliceStrategy();
        strategies.putIfAbsent(fallback.domain(), fallback);
    }

    public Decomposition decompose(TaskAnalysis analysis) {
        return decompose(analysis, DEFAULT_MAX_DEPTH);
    }

    /**
     * Decomposes a task.
     *
     * @param analysis analysis produced by the task analyzer
     * @param maxDepth maximum tree depth; the built-in strategies produce one level
     * @return root task, subtasks and the parent/child tree
     * @throws IllegalArgumentException if {@code maxDepth} is below 1
     */
    public Decomposition decompose(TaskAnalysis analysis, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, was " + maxDepth);
        }

        String primaryDomain = analysis.primaryDomain();
        var root = new SubTask(ROOT_TASK_ID, analysis.description(), null, List.of(),
                primaryDomain, analysis.complexity(), TaskState.PENDING);

        if (!analysis.requiresDecomposition()) {
            log.debug("No decomposition needed for {} task", analysis.complexity().value());
            return new Decomposition(root, List.of(root), Map.of(root.id(), List.of()));
        }

        var strategy = strategies.getOrDefault(primaryDomain, fallback);
        List<SubTask> subtasks = strategy.decompose(analysis, root.id());
        verifyBatch(subtasks);

        var all = new ArrayList<SubTask>();
        all.add(root);
        all.addAll(subtasks);

        log.info("Decomposed {} task into {} subtask(s) using '{}' strategy",
                analysis.complexity().value(), subtasks.size(), strategy.domain());
        return new Decomposition(root, subtasks, buildTaskTree(all));
    }

    static String taskId(int index) {
        return "task_" + index;
    }

    /**
     * Enforces the batch contract: unique IDs, dependencies only on IDs of the same batch.
     */
    private void verifyBatch(List<SubTask> subtasks) {
        var ids = new HashSet<String>();
        for (var subtask : subtasks) {
            if (!ids.add(subtask.id())) {
                throw new IllegalStateException("Strategy produced duplicate subtask id " + subtask.id());
            }
        }
        for (var subtask : subtasks) {
            for (var dep : subtask.dependencies()) {
                if (!ids.contains(dep)) {
                    throw new IllegalStateException("Subtask " + subtask.id()
                            + " depends on " + dep + " which is not part of the batch");
                }
            }
        }
    }

    private Map<String, List<String>> buildTaskTree(List<SubTask> tasks) {
        var tree = new LinkedHashMap<String, List<String>>();
        for (var task : tasks) {
            tree.put(task.id(), new ArrayList<>());
        }
        for (var task : tasks) {
            if (task.parentId() != null && tree.containsKey(task.parentId())) {
                tree.get(task.parentId()).add(task.id());
            }
        }
        return tree;
    }
}
