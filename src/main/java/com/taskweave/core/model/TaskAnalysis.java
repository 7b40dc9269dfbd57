package com.taskweave.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Result of analyzing a raw task description.
 *
 * @param description           the raw description as given
 * @param complexity            complexity tier
 * @param domains               domain tags ordered by descending score, never empty
 * @param requiresDecomposition true for medium and complex tasks
 * @param estimatedSubtasks     rough subtask count estimate
 * @param requirements          requirement fragments extracted from the description
 * @param context               caller-supplied context, carried through untouched
 */
public record TaskAnalysis(
    String description,
    Complexity complexity,
    List<String> domains,
    boolean requiresDecomposition,
    int estimatedSubtasks,
    List<String> requirements,
    Map<String, Object> context
) implements Serializable {

    public TaskAnalysis {
        description = description != null ? description : "";
        complexity = complexity != null ? complexity : Complexity.SIMPLE;
        domains = domains == null || domains.isEmpty() ? List.of("general") : List.copyOf(domains);
        requirements = requirements != null ? List.copyOf(requirements) : List.of();
        context = context != null ? Map.copyOf(context) : Map.of();
    }

    public String primaryDomain() {
        return domains.get(0);
    }
}
