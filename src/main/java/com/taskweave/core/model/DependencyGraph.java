package com.taskweave.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dependency DAG derived from a subtask list.
 * <p>
 * When {@code hasCycles} is true, {@code executionOrder} and {@code parallelGroups} are empty
 * and {@code error} describes the problem.
 *
 * @param adjacency      task id to the ids that depend on it, in subtask insertion order
 * @param inDegree       number of dependencies per task id
 * @param hasCycles      whether a circular dependency was found
 * @param executionOrder topological order (Kahn), empty when cyclic
 * @param parallelGroups ids grouped by BFS depth, ascending, empty when cyclic
 * @param error          structural error marker, null when the graph is valid
 */
public record DependencyGraph(
    Map<String, List<String>> adjacency,
    Map<String, Integer> inDegree,
    boolean hasCycles,
    List<String> executionOrder,
    List<List<String>> parallelGroups,
    String error
) implements Serializable {

    public static final String CYCLE_ERROR = "Circular dependency detected";

    public DependencyGraph {
        var adj = new LinkedHashMap<String, List<String>>();
        adjacency.forEach((k, v) -> adj.put(k, List.copyOf(v)));
        adjacency = Collections.unmodifiableMap(adj);
        inDegree = Collections.unmodifiableMap(new LinkedHashMap<>(inDegree));
        executionOrder = List.copyOf(executionOrder);
        parallelGroups = parallelGroups.stream().map(List::copyOf).toList();
    }

    public static DependencyGraph cyclic(Map<String, List<String>> adjacency, Map<String, Integer> inDegree) {
        return new DependencyGraph(adjacency, inDegree, true, List.of(), List.of(), CYCLE_ERROR);
    }

    public boolean hasError() {
        return error != null;
    }

    public List<String> dependentsOf(String taskId) {
        return adjacency.getOrDefault(taskId, List.of());
    }

    public int size() {
        return inDegree.size();
    }
}
