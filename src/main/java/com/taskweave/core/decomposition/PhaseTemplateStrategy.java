package com.taskweave.core.decomposition;

import com.taskweave.core.model.Complexity;
import com.taskweave.core.model.SubTask;
import com.taskweave.core.model.TaskAnalysis;
import com.taskweave.core.model.TaskState;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits a fixed sequence of phases, each depending on the previous one.
 */
public class PhaseTemplateStrategy implements DecompositionStrategy {

    /**
     * A phase of the template.
     *
     * @param name   phase name, prefixed to the task description
     * @param domain domain tag of the phase subtask
     */
    public record Phase(String name, String domain) {}

    private final String domain;
    private final List<Phase> phases;

    public PhaseTemplateStrategy(String domain, List<Phase> phases) {
        if (phases == null || phases.isEmpty()) {
            throw new IllegalArgumentException("Phase template for " + domain + " needs at least one phase");
        }
        this.domain = domain;
        this.phases = List.copyOf(phases);
    }

    @Override
    public String domain() {
        return domain;
    }

    public List<Phase> phases() {
        return phases;
    }

    @Override
    public List<SubTask> decompose(TaskAnalysis analysis, String parentId) {
        var subtasks = new ArrayList<SubTask>();
        String previousId = null;
        int index = 1;
        for (var phase : phases) {
            String id = TaskDecomposer.taskId(index++);
            subtasks.add(new SubTask(
                    id,
                    phase.name() + " for " + analysis.description(),
                    parentId,
                    previousId != null ? List.of(previousId) : List.of(),
                    phase.domain(),
                    Complexity.SIMPLE,
                    TaskState.PENDING));
            previousId = id;
        }
        return subtasks;
    }

    static PhaseTemplateStrategy development() {
        return new PhaseTemplateStrategy("development", List.of(
                new Phase("Requirements analysis", "development"),
                new Phase("Design and architecture", "design"),
                new Phase("Implementation", "development"),
                new Phase("Testing", "testing"),
                new Phase("Documentation", "development")));
    }

    static PhaseTemplateStrategy devops() {
        return new PhaseTemplateStrategy("devops", List.of(
                new Phase("Infrastructure setup", "devops"),
                new Phase("Configuration management", "devops"),
                new Phase("Deployment pipeline", "devops"),
                new Phase("Monitoring and logging", "devops"),
                new Phase("Security hardening", "devops")));
    }

    static PhaseTemplateStrategy data() {
        return new PhaseTemplateStrategy("data", List.of(
                new Phase("Data collection and preparation", "data"),
                new Phase("Exploratory data analysis", "data"),
                new Phase("Data processing and transformation", "data"),
                new Phase("Analysis and modeling", "data"),
                new Phase("Visualization and reporting", "data")));
    }

    static PhaseTemplateStrategy research() {
        return new PhaseTemplateStrategy("research", List.of(
                new Phase("Define research scope and questions", "research"),
                new Phase("Literature review and background research", "research"),
                new Phase("Data gathering and analysis", "research"),
                new Phase("Synthesis and conclusions", "research"),
                new Phase("Documentation and presentation", "research")));
    }
}
