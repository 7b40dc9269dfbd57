package com.taskweave.core.planning;

import com.taskweave.core.model.Complexity;
import com.taskweave.core.model.DependencyGraph;
import com.taskweave.core.model.ExecutionPlan;
import com.taskweave.core.model.ExecutionStep;
import com.taskweave.core.model.SubTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts a dependency graph into ordered execution steps, estimates duration and
 * computes the critical path.
 */
@Service
public class ExecutionPlanner {

    private static final Logger log = LoggerFactory.getLogger(ExecutionPlanner.class);

    /**
     * Creates an execution plan. A cyclic graph yields an empty plan carrying
     * {@link ExecutionPlan#CYCLE_ERROR}.
     *
     * @param graph    graph built from {@code subtasks}
     * @param subtasks the subtasks, used for complexity weights
     */
    public ExecutionPlan createPlan(DependencyGraph graph, List<SubTask> subtasks) {
        if (graph.hasCycles()) {
            log.warn("Refusing to plan a cyclic graph");
            return ExecutionPlan.failed(ExecutionPlan.CYCLE_ERROR);
        }

        var steps = new ArrayList<ExecutionStep>();
        int stepNumber = 1;
        for (var group : graph.parallelGroups()) {
            steps.add(new ExecutionStep(stepNumber++, group, group.size() > 1));
        }
        if (steps.isEmpty()) {
            for (var taskId : graph.executionOrder()) {
                steps.add(new ExecutionStep(stepNumber++, List.of(taskId), false));
            }
        }

        boolean canParallelize = steps.stream().anyMatch(ExecutionStep::canParallelize);
        int estimated = estimateDuration(subtasks);
        List<String> criticalPath = getCriticalPath(graph, subtasks);

        log.info("Execution plan: {} steps, parallel={}, ~{} min, critical path {}",
                steps.size(), canParallelize, estimated, criticalPath);
        return new ExecutionPlan(steps, steps.size(), canParallelize, estimated, criticalPath, null, Instant.now());
    }

    public int estimateDuration(List<SubTask> subtasks) {
        return subtasks.stream().mapToInt(t -> t.complexity().estimatedMinutes()).sum();
    }

    /**
     * Longest weighted root-to-leaf chain, via DP over the topological order.
     * <p>
     * {@code dist[v]} is the heaviest chain ending just before {@code v}; the path ends at the
     * node maximizing {@code dist[v] + weight(v)}, ties going to the earliest node in
     * topological order.
     *
     * @return ids along the path, empty for an empty or cyclic graph
     */
    public List<String> getCriticalPath(DependencyGraph graph, List<SubTask> subtasks) {
        var order = graph.executionOrder();
        if (order.isEmpty()) {
            return List.of();
        }
        var weights = weights(subtasks);
        var dist = new HashMap<String, Integer>();
        var predecessor = new HashMap<String, String>();
        for (var id : order) {
            dist.put(id, 0);
        }

        for (var u : order) {
            int through = dist.get(u) + weightOf(weights, u);
            for (var v : graph.dependentsOf(u)) {
                if (through > dist.get(v)) {
                    dist.put(v, through);
                    predecessor.put(v, u);
                }
            }
        }

        String end = order.get(0);
        int best = -1;
        for (var id : order) {
            int finish = dist.get(id) + weightOf(weights, id);
            if (finish > best) {
                best = finish;
                end = id;
            }
        }

        var path = new ArrayList<String>();
        for (String current = end; current != null; current = predecessor.get(current)) {
            path.add(current);
        }
        Collections.reverse(path);
        return path;
    }

    /**
     * Sum of complexity weights along a path.
     */
    public int pathWeight(List<String> path, List<SubTask> subtasks) {
        var weights = weights(subtasks);
        return path.stream().mapToInt(id -> weightOf(weights, id)).sum();
    }

    /**
     * Pending tasks of the first step that still has tasks outside {@code completedIds}.
     */
    public List<String> getNextTasks(ExecutionPlan plan, Set<String> completedIds) {
        for (var step : plan.steps()) {
            var pending = step.taskIds().stream().filter(id -> !completedIds.contains(id)).toList();
            if (!pending.isEmpty()) {
                return pending;
            }
        }
        return List.of();
    }

    public PlanProgress progress(ExecutionPlan plan, Set<String> completedIds, Set<String> failedIds) {
        var all = plan.allTaskIds();
        int total = all.size();
        int completed = (int) all.stream().filter(completedIds::contains).count();
        int failed = (int) all.stream().filter(failedIds::contains).count();
        int pending = total - completed - failed;
        double percentage = total > 0 ? Math.round(completed * 10000.0 / total) / 100.0 : 0.0;
        return new PlanProgress(total, completed, failed, pending, percentage);
    }

    private static Map<String, Integer> weights(List<SubTask> subtasks) {
        var weights = new HashMap<String, Integer>();
        for (var task : subtasks) {
            weights.put(task.id(), task.complexity().estimatedMinutes());
        }
        return weights;
    }

    private static int weightOf(Map<String, Integer> weights, String id) {
        return weights.getOrDefault(id, Complexity.SIMPLE.estimatedMinutes());
    }
}
