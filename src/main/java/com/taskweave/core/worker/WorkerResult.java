package com.taskweave.core.worker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome reported by a {@link Worker}.
 *
 * @param status    which of the three outcomes this is
 * @param output    opaque output, set for {@link Status#COMPLETED}
 * @param metadata  worker metadata, set for {@link Status#COMPLETED}
 * @param questions clarification questions, set for {@link Status#CLARIFICATION_NEEDED}
 * @param message   error message, set for {@link Status#ERROR}
 */
public record WorkerResult(
    Status status,
    Object output,
    Map<String, Object> metadata,
    List<String> questions,
    String message
) {

    public enum Status {
        COMPLETED,
        CLARIFICATION_NEEDED,
        ERROR
    }

    public WorkerResult {
        if (status == null) {
            throw new IllegalArgumentException("WorkerResult status must not be null");
        }
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
        questions = questions != null ? List.copyOf(questions) : List.of();
    }

    public static WorkerResult completed(Object output) {
        return completed(output, Map.of());
    }

    public static WorkerResult completed(Object output, Map<String, Object> metadata) {
        return new WorkerResult(Status.COMPLETED, output, metadata, List.of(), null);
    }

    public static WorkerResult clarificationNeeded(List<String> questions) {
        return new WorkerResult(Status.CLARIFICATION_NEEDED, null, Map.of(), questions, null);
    }

    public static WorkerResult error(String message) {
        return new WorkerResult(Status.ERROR, null, Map.of(), List.of(), message);
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }

    public boolean needsClarification() {
        return status == Status.CLARIFICATION_NEEDED;
    }
}
