package com.taskweave.dispatch.cli;

import com.taskweave.core.analysis.TaskAnalyzer;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: taskweave analyze "&lt;description&gt;"
 * <p>
 * Prints the complexity, domains and requirements detected for a task.
 */
@Command(name = "analyze", mixinStandardHelpOptions = true, description = "Analyze a task description")
@Component
public class AnalyzeCommand implements Runnable {

    @Parameters(index = "0", description = "Natural language task description")
    private String description;

    private final TaskAnalyzer analyzer;

    public AnalyzeCommand(TaskAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var analysis = analyzer.analyze(description);

        ConsoleOutput.info(String.format("Complexity: %s | Domains: %s",
                analysis.complexity().value(), String.join(", ", analysis.domains())));
        ConsoleOutput.info("Requires decomposition: " + analysis.requiresDecomposition()
                + " | Estimated subtasks: " + analysis.estimatedSubtasks());

        if (!analysis.requirements().isEmpty()) {
            System.out.println();
            System.out.println("REQUIREMENTS:");
            for (var requirement : analysis.requirements()) {
                System.out.println("  - " + requirement);
            }
        }
    }
}
