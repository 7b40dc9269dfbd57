package com.taskweave.core.tracking;

import com.taskweave.core.model.Complexity;
import com.taskweave.core.model.SubTask;
import com.taskweave.core.model.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single point of truth for the runtime state of every task in one workflow.
 * <p>
 * All reads and writes go through the tracker's monitor, so workers completing in parallel
 * cannot race. Readers get snapshots of {@link TrackedTask}, never the live entries.
 */
public class TaskStateTracker {

    private static final Logger log = LoggerFactory.getLogger(TaskStateTracker.class);

    private final Map<String, TrackedTask> tasks = new LinkedHashMap<>();

    public TrackedTask addTask(SubTask subtask) {
        return addTask(subtask.id(), subtask.description(), subtask.dependencies(), subtask.domain(),
                subtask.complexity(), Map.of("parentId", subtask.parentId() != null ? subtask.parentId() : ""));
    }

    /**
     * Registers a task. Registering an existing id returns the existing entry unchanged.
     */
    public synchronized TrackedTask addTask(String taskId, String description, List<String> dependencies,
                                            String domain, Complexity complexity,
                                            Map<String, Object> metadata) {
        var existing = tasks.get(taskId);
        if (existing != null) {
            log.warn("Task {} already tracked", taskId);
            return existing.snapshot();
        }
        var task = new TrackedTask(taskId, description, dependencies, domain, complexity, metadata);
        tasks.put(taskId, task);
        log.debug("Tracking task {}", taskId);
        return task.snapshot();
    }

    public synchronized void assign(String taskId, String workerId) {
        require(taskId).assign(workerId);
        log.info("Assigned task {} to worker {}", taskId, workerId);
    }

    public synchronized void start(String taskId) {
        var task = require(taskId);
        task.start();
        log.info("Task {} started by worker {}", taskId, task.getWorkerId());
    }

    public synchronized void updateProgress(String taskId, double progress) {
        require(taskId).updateProgress(progress);
        log.debug("Task {} progress: {}", taskId, progress);
    }

    public synchronized void complete(String taskId, Object result) {
        require(taskId).complete(result);
        log.info("Task {} completed", taskId);
    }

    public synchronized void fail(String taskId, String error) {
        require(taskId).fail(error);
        log.error("Task {} failed: {}", taskId, error);
    }

    /**
     * Marks an in-progress task as blocked on clarification.
     */
    public synchronized void block(String taskId, List<String> questions) {
        require(taskId).block(questions);
        log.warn("Task {} blocked pending clarification ({} question(s))", taskId,
                questions != null ? questions.size() : 0);
    }

    public synchronized Optional<TrackedTask> getTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId)).map(TrackedTask::snapshot);
    }

    public synchronized boolean contains(String taskId) {
        return tasks.containsKey(taskId);
    }

    /**
     * Pending tasks whose every dependency is {@link TaskState#COMPLETED}. A failed, blocked
     * or unknown dependency keeps a task out of the result.
     */
    public synchronized List<TrackedTask> getReadyTasks() {
        var ready = new ArrayList<TrackedTask>();
        for (var task : tasks.values()) {
            if (task.getStatus() == TaskState.PENDING && dependenciesCompleted(task)) {
                ready.add(task.snapshot());
            }
        }
        return ready;
    }

    public synchronized boolean isReady(String taskId) {
        var task = tasks.get(taskId);
        return task != null && task.getStatus() == TaskState.PENDING && dependenciesCompleted(task);
    }

    public synchronized List<TrackedTask> getTasksByStatus(TaskState status) {
        return tasks.values().stream()
                .filter(t -> t.getStatus() == status)
                .map(TrackedTask::snapshot)
                .toList();
    }

    public synchronized List<TrackedTask> getTasksByWorker(String workerId) {
        return tasks.values().stream()
                .filter(t -> workerId.equals(t.getWorkerId()))
                .map(TrackedTask::snapshot)
                .toList();
    }

    public synchronized List<TrackedTask> getAllTasks() {
        return tasks.values().stream().map(TrackedTask::snapshot).toList();
    }

    public synchronized List<String> taskIds() {
        return List.copyOf(tasks.keySet());
    }

    /**
     * Mean of per-task progress, 0 when nothing is tracked.
     */
    public synchronized double getOverallProgress() {
        if (tasks.isEmpty()) {
            return 0.0;
        }
        return tasks.values().stream().mapToDouble(TrackedTask::getProgress).sum() / tasks.size();
    }

    public synchronized TrackerStats stats() {
        var counts = new EnumMap<TaskState, Integer>(TaskState.class);
        for (var state : TaskState.values()) {
            counts.put(state, 0);
        }
        for (var task : tasks.values()) {
            counts.merge(task.getStatus(), 1, Integer::sum);
        }
        return new TrackerStats(tasks.size(), Collections.unmodifiableMap(counts),
                getOverallProgress(), getReadyTasks().size());
    }

    public synchronized void clear() {
        tasks.clear();
        log.debug("Tracker cleared");
    }

    private boolean dependenciesCompleted(TrackedTask task) {
        for (var dep : task.getDependencies()) {
            var dependency = tasks.get(dep);
            if (dependency == null || dependency.getStatus() != TaskState.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    private TrackedTask require(String taskId) {
        var task = tasks.get(taskId);
        if (task == null) {
            throw new IllegalArgumentException("Unknown task " + taskId);
        }
        return task;
    }
}
