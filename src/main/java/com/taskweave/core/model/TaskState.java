package com.taskweave.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Runtime state of a tracked task.
 * <p>
 * {@code PENDING -> ASSIGNED -> IN_PROGRESS -> {COMPLETED | FAILED | BLOCKED}}.
 * A pending or assigned task may also fail directly when dispatch itself breaks.
 */
public enum TaskState {
    PENDING,
    ASSIGNED,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    BLOCKED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == BLOCKED;
    }

    public boolean canTransitionTo(TaskState next) {
        return allowedNext().contains(next);
    }

    private Set<TaskState> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(ASSIGNED, FAILED);
            case ASSIGNED -> EnumSet.of(IN_PROGRESS, FAILED);
            case IN_PROGRESS -> EnumSet.of(COMPLETED, FAILED, BLOCKED);
            case COMPLETED, FAILED, BLOCKED -> EnumSet.noneOf(TaskState.class);
        };
    }
}
