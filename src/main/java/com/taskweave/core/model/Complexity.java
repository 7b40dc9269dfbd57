package com.taskweave.core.model;

/**
 * Complexity tier of a task or subtask.
 * <p>
 * Each tier carries the time weight, in minutes, used for duration estimates
 * and critical-path computation.
 */
public enum Complexity {
    SIMPLE("simple", 5),
    MEDIUM("medium", 15),
    COMPLEX("complex", 30);

    private final String value;
    private final int estimatedMinutes;

    Complexity(String value, int estimatedMinutes) {
        this.value = value;
        this.estimatedMinutes = estimatedMinutes;
    }

    public String value() {
        return value;
    }

    public int estimatedMinutes() {
        return estimatedMinutes;
    }

    /**
     * Resolves a tier from its lowercase value. Unknown or null values map to {@link #SIMPLE}.
     */
    public static Complexity fromValue(String value) {
        if (value == null) {
            return SIMPLE;
        }
        for (Complexity c : values()) {
            if (c.value.equalsIgnoreCase(value.trim())) {
                return c;
            }
        }
        return SIMPLE;
    }
}
