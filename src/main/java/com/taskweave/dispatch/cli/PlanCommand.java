package com.taskweave.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskweave.core.analysis.TaskAnalyzer;
import com.taskweave.core.config.OrchestratorProperties;
import com.taskweave.core.decomposition.TaskDecomposer;
import com.taskweave.core.graph.DependencyMapper;
import com.taskweave.core.graph.UnknownTaskReferenceException;
import com.taskweave.core.model.ExecutionPlan;
import com.taskweave.core.planning.ExecutionPlanner;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.LinkedHashMap;
import java.util.concurrent.Callable;

/**
 * CLI command: taskweave plan "&lt;description&gt;" [--json]
 * <p>
 * Analyzes and decomposes a task, builds its dependency graph and prints the
 * resulting execution plan. No worker is invoked.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Build an execution plan for a task")
@Component
public class PlanCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Natural language task description")
    private String description;

    @Option(names = "--json", description = "Print the plan as JSON")
    private boolean json;

    private final TaskAnalyzer analyzer;
    private final TaskDecomposer decomposer;
    private final DependencyMapper dependencyMapper;
    private final ExecutionPlanner planner;
    private final OrchestratorProperties properties;
    private final ObjectMapper objectMapper;

    public PlanCommand(TaskAnalyzer analyzer, TaskDecomposer decomposer, DependencyMapper dependencyMapper,
                       ExecutionPlanner planner, OrchestratorProperties properties, ObjectMapper objectMapper) {
        this.analyzer = analyzer;
        this.decomposer = decomposer;
        this.dependencyMapper = dependencyMapper;
        this.planner = planner;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        var analysis = analyzer.analyze(description);
        var decomposition = decomposer.decompose(analysis, properties.getMaxDepth());
        var subtasks = decomposition.subtasks();

        ExecutionPlan plan;
        try {
            plan = planner.createPlan(dependencyMapper.buildGraph(subtasks), subtasks);
        } catch (UnknownTaskReferenceException e) {
            ConsoleOutput.error("Planning failed: " + e.getMessage());
            return 1;
        }

        if (json) {
            var document = new LinkedHashMap<String, Object>();
            document.put("analysis", analysis);
            document.put("subtasks", subtasks);
            document.put("plan", plan);
            try {
                System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize execution plan", e);
            }
            return plan.hasError() ? 1 : 0;
        }

        ConsoleOutput.printBanner();
        if (plan.hasError()) {
            ConsoleOutput.error(plan.error());
            return 1;
        }

        ConsoleOutput.info(String.format("Complexity: %s | Domains: %s",
                analysis.complexity().value(), String.join(", ", analysis.domains())));
        System.out.println();
        System.out.println("SUBTASKS:");
        for (var subtask : subtasks) {
            String deps = subtask.dependencies().isEmpty() ? "" : " <- " + String.join(", ", subtask.dependencies());
            System.out.printf("  %-8s [%-11s] %s%s%n", subtask.id(), subtask.domain(), subtask.description(), deps);
        }
        System.out.println();
        for (var step : plan.steps()) {
            ConsoleOutput.step(step);
        }
        ConsoleOutput.criticalPath(plan.criticalPath(), planner.pathWeight(plan.criticalPath(), subtasks));
        ConsoleOutput.success(String.format("%d step(s), parallel=%s, estimated %d min",
                plan.totalSteps(), plan.canParallelize(), plan.estimatedDurationMinutes()));
        return 0;
    }
}
