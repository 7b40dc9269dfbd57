package com.taskweave.core.graph;

import com.taskweave.core.model.DagStatistics;
import com.taskweave.core.model.DependencyGraph;
import com.taskweave.core.model.SubTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds the dependency DAG of a subtask batch.
 * <p>
 * Edges run from a dependency to its dependents. The mapper is stateless: building the
 * same immutable subtask list twice yields equal graphs.
 */
@Service
public class DependencyMapper {

    private static final Logger log = LoggerFactory.getLogger(DependencyMapper.class);

    /**
     * Builds the graph, detects cycles and computes execution order and parallel groups.
     *
     * @param subtasks subtasks of one decomposition batch
     * @return the graph; {@link DependencyGraph#hasCycles()} is set for circular dependencies
     * @throws UnknownTaskReferenceException if a dependency names an id missing from the batch
     * @throws IllegalArgumentException      if two subtasks share an id
     */
    public DependencyGraph buildGraph(List<SubTask> subtasks) {
        validateReferences(subtasks);

        var adjacency = new LinkedHashMap<String, List<String>>();
        var inDegree = new LinkedHashMap<String, Integer>();
        for (var task : subtasks) {
            adjacency.put(task.id(), new ArrayList<>());
            inDegree.put(task.id(), 0);
        }
        for (var task : subtasks) {
            for (var dep : task.dependencies()) {
                adjacency.get(dep).add(task.id());
                inDegree.merge(task.id(), 1, Integer::sum);
            }
        }

        if (hasCycles(adjacency)) {
            log.warn("Circular dependency detected among {} subtasks", subtasks.size());
            return DependencyGraph.cyclic(adjacency, inDegree);
        }

        List<String> executionOrder = topologicalSort(adjacency, inDegree);
        List<List<String>> parallelGroups = parallelGroups(adjacency, inDegree, subtasks);

        log.debug("Built graph: {} nodes, order={}, groups={}", subtasks.size(), executionOrder, parallelGroups);
        return new DependencyGraph(adjacency, inDegree, false, executionOrder, parallelGroups, null);
    }

    /**
     * IDs not yet completed whose dependencies are all completed, in subtask order.
     */
    public List<String> getReadyTasks(Set<String> completedIds, List<SubTask> subtasks) {
        var ready = new ArrayList<String>();
        for (var task : subtasks) {
            if (completedIds.contains(task.id())) {
                continue;
            }
            if (completedIds.containsAll(task.dependencies())) {
                ready.add(task.id());
            }
        }
        return ready;
    }

    public DagStatistics statistics(DependencyGraph graph) {
        int roots = (int) graph.inDegree().values().stream().filter(d -> d == 0).count();
        int leaves = (int) graph.adjacency().values().stream().filter(List::isEmpty).count();
        int maxParallelism = graph.parallelGroups().stream().mapToInt(List::size).max().orElse(0);
        return new DagStatistics(graph.size(), roots, leaves, graph.parallelGroups().size(), maxParallelism);
    }

    private void validateReferences(List<SubTask> subtasks) {
        var ids = new HashSet<String>();
        for (var task : subtasks) {
            if (!ids.add(task.id())) {
                throw new IllegalArgumentException("Duplicate subtask id " + task.id());
            }
        }
        for (var task : subtasks) {
            for (var dep : task.dependencies()) {
                if (!ids.contains(dep)) {
                    throw new UnknownTaskReferenceException(task.id(), dep);
                }
            }
        }
    }

    /**
     * Iterative DFS with an explicit stack; a gray node reached again is a back edge.
     */
    private boolean hasCycles(Map<String, List<String>> adjacency) {
        var visited = new HashSet<String>();
        var onStack = new HashSet<String>();

        for (var start : adjacency.keySet()) {
            if (visited.contains(start)) {
                continue;
            }
            Deque<Map.Entry<String, Iterator<String>>> stack = new ArrayDeque<>();
            stack.push(Map.entry(start, adjacency.get(start).iterator()));
            visited.add(start);
            onStack.add(start);

            while (!stack.isEmpty()) {
                var frame = stack.peek();
                var neighbors = frame.getValue();
                if (!neighbors.hasNext()) {
                    onStack.remove(frame.getKey());
                    stack.pop();
                    continue;
                }
                String next = neighbors.next();
                if (onStack.contains(next)) {
                    return true;
                }
                if (visited.add(next)) {
                    onStack.add(next);
                    stack.push(Map.entry(next, adjacency.get(next).iterator()));
                }
            }
        }
        return false;
    }

    /**
     * Kahn's algorithm; the initial queue follows subtask insertion order.
     */
    private List<String> topologicalSort(Map<String, List<String>> adjacency, Map<String, Integer> inDegree) {
        var remaining = new HashMap<>(inDegree);
        Deque<String> queue = new ArrayDeque<>();
        for (var id : inDegree.keySet()) {
            if (inDegree.get(id) == 0) {
                queue.add(id);
            }
        }

        var order = new ArrayList<String>();
        while (!queue.isEmpty()) {
            String node = queue.poll();
            order.add(node);
            for (var dependent : adjacency.get(node)) {
                if (remaining.merge(dependent, -1, Integer::sum) == 0) {
                    queue.add(dependent);
                }
            }
        }
        return order;
    }

    /**
     * BFS depth levels from the roots; a node's depth is fixed when its last dependency is
     * released, so equal-depth nodes never have a path between them.
     */
    private List<List<String>> parallelGroups(Map<String, List<String>> adjacency,
                                              Map<String, Integer> inDegree,
                                              List<SubTask> subtasks) {
        var remaining = new HashMap<>(inDegree);
        record Visit(String id, int depth) {}
        Deque<Visit> queue = new ArrayDeque<>();
        for (var id : inDegree.keySet()) {
            if (inDegree.get(id) == 0) {
                queue.add(new Visit(id, 0));
            }
        }

        var byDepth = new TreeMap<Integer, List<String>>();
        while (!queue.isEmpty()) {
            var visit = queue.poll();
            byDepth.computeIfAbsent(visit.depth(), d -> new ArrayList<>()).add(visit.id());
            for (var dependent : adjacency.get(visit.id())) {
                if (remaining.merge(dependent, -1, Integer::sum) == 0) {
                    queue.add(new Visit(dependent, visit.depth() + 1));
                }
            }
        }

        var position = indexOf(subtasks.stream().map(SubTask::id).toList());
        var groups = new ArrayList<List<String>>();
        for (var group : byDepth.values()) {
            group.sort(Comparator.comparingInt(position::get));
            groups.add(group);
        }
        return groups;
    }

    private static Map<String, Integer> indexOf(Collection<String> ids) {
        var index = new HashMap<String, Integer>();
        int i = 0;
        for (var id : ids) {
            index.put(id, i++);
        }
        return index;
    }
}
