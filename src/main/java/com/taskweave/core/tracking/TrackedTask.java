package com.taskweave.core.tracking;

import com.taskweave.core.model.Complexity;
import com.taskweave.core.model.TaskState;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime state of one subtask.
 * <p>
 * Mutators are package-private and guarded by {@link TaskState#canTransitionTo}; only
 * {@link TaskStateTracker} changes a tracked task. Callers outside the package receive
 * snapshots.
 */
public final class TrackedTask {

    private final String taskId;
    private final String description;
    private final List<String> dependencies;
    private final String domain;
    private final Complexity complexity;
    private final Map<String, Object> metadata;
    private final Instant createdAt;

    private TaskState status = TaskState.PENDING;
    private String workerId;
    private double progress;
    private Object result;
    private String error;
    private List<String> questions = List.of();
    private Instant assignedAt;
    private Instant startedAt;
    private Instant completedAt;

    TrackedTask(String taskId, String description, List<String> dependencies,
                String domain, Complexity complexity, Map<String, Object> metadata) {
        this.taskId = taskId;
        this.description = description != null ? description : "";
        this.dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        this.domain = domain != null ? domain : "general";
        this.complexity = complexity != null ? complexity : Complexity.SIMPLE;
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
        this.createdAt = Instant.now();
    }

    private TrackedTask(TrackedTask source) {
        this.taskId = source.taskId;
        this.description = source.description;
        this.dependencies = source.dependencies;
        this.domain = source.domain;
        this.complexity = source.complexity;
        this.metadata = source.metadata;
        this.createdAt = source.createdAt;
        this.status = source.status;
        this.workerId = source.workerId;
        this.progress = source.progress;
        this.result = source.result;
        this.error = source.error;
        this.questions = source.questions;
        this.assignedAt = source.assignedAt;
        this.startedAt = source.startedAt;
        this.completedAt = source.completedAt;
    }

    TrackedTask snapshot() {
        return new TrackedTask(this);
    }

    void assign(String workerId) {
        transition(TaskState.ASSIGNED);
        this.workerId = workerId;
        this.assignedAt = Instant.now();
    }

    void start() {
        transition(TaskState.IN_PROGRESS);
        this.startedAt = Instant.now();
    }

    void updateProgress(double value) {
        if (status != TaskState.ASSIGNED && status != TaskState.IN_PROGRESS) {
            throw new IllegalTaskTransitionException(taskId, status, status);
        }
        this.progress = Math.max(0.0, Math.min(1.0, value));
    }

    void complete(Object result) {
        transition(TaskState.COMPLETED);
        this.result = result;
        this.progress = 1.0;
        this.completedAt = Instant.now();
    }

    void fail(String error) {
        transition(TaskState.FAILED);
        this.error = error;
        this.completedAt = Instant.now();
    }

    void block(List<String> questions) {
        transition(TaskState.BLOCKED);
        this.questions = questions != null ? List.copyOf(questions) : List.of();
        this.completedAt = Instant.now();
    }

    private void transition(TaskState next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalTaskTransitionException(taskId, status, next);
        }
        status = next;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    public String getDomain() {
        return domain;
    }

    public Complexity getComplexity() {
        return complexity;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public TaskState getStatus() {
        return status;
    }

    public String getWorkerId() {
        return workerId;
    }

    public double getProgress() {
        return progress;
    }

    public Object getResult() {
        return result;
    }

    public String getError() {
        return error;
    }

    /**
     * Clarification questions reported by the worker, empty unless the task is blocked.
     */
    public List<String> getQuestions() {
        return questions;
    }

    public Instant getAssignedAt() {
        return assignedAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    @Override
    public String toString() {
        return "TrackedTask{" + taskId + ", " + status + ", progress=" + progress
                + (workerId != null ? ", worker=" + workerId : "") + "}";
    }
}
